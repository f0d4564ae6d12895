/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ferry.gateway;

import dev.mars.ferry.core.exceptions.RequestAlreadyRemovedException;
import dev.mars.ferry.core.exceptions.SubmissionException;

import java.util.List;
import java.util.Optional;

/**
 * External transfer subsystem that performs the actual network exchange.
 *
 * <p>A gateway accepts a small, fixed number of concurrent requests and reports on them
 * asynchronously through {@link GatewayRequestListener}s. Requests stay listed after they
 * complete until they are removed; removing an unfinished request cancels it, and the
 * gateway then reports {@link GatewayStatus#COMPLETED} with a
 * {@link dev.mars.ferry.core.exceptions.RequestCanceledException} as the error.</p>
 *
 * <p>Callbacks may be delivered on any thread, including synchronously from inside
 * {@link #submit(SubmitRequest)} or {@link #remove(GatewayRequest)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface TransferGateway {

    /**
     * @return a snapshot of every request the gateway currently holds
     */
    List<GatewayRequest> listActiveRequests();

    /**
     * @throws SubmissionException if the gateway refuses the request
     */
    GatewayRequest submit(SubmitRequest request) throws SubmissionException;

    Optional<GatewayRequest> find(String requestId);

    /**
     * Drops the request, cancelling it if it is still running.
     *
     * @throws RequestAlreadyRemovedException if the request was removed before
     */
    void remove(GatewayRequest request) throws RequestAlreadyRemovedException;
}

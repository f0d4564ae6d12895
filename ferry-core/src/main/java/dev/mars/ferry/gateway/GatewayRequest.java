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

import dev.mars.ferry.core.TransferMethod;

import java.net.URI;

/**
 * A request accepted by a {@link TransferGateway}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface GatewayRequest {

    /**
     * @return the gateway-assigned id, unique among the gateway's requests
     */
    String getRequestId();

    /**
     * @return the correlation tag given at submission
     */
    String getTag();

    TransferMethod getMethod();

    URI getRemoteUri();

    String getStagingPath();

    GatewayStatus getStatus();

    /**
     * @return the last protocol status code, {@code 0} if there was no response
     */
    int getStatusCode();

    /**
     * @return the error of a completed request, {@code null} on success
     */
    Throwable getError();

    long getBytesTransferred();

    /**
     * @return total size, {@code -1} if unknown
     */
    long getTotalBytes();

    void subscribe(GatewayRequestListener listener);

    void unsubscribe(GatewayRequestListener listener);
}

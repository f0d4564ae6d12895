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

package dev.mars.ferry.core.exceptions;

/**
 * Error attached by a gateway to a request that was removed before it completed.
 *
 * <p>It is never thrown by Ferry code. Gateways report it as the error of the final
 * {@code COMPLETED} status so that the status machine can tell a cancellation apart
 * from a genuine failure.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class RequestCanceledException extends FerryException {

    private final String requestId;

    public RequestCanceledException(String requestId) {
        super("The request " + requestId + " has previously been cancelled");
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}

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
 * Raised when a gateway reports a completed transfer without an error but with a
 * status code other than 200 or 206.
 *
 * <p>There is no defined meaning for such a completion (redirects are expected to be
 * followed inside the gateway), so the coordinator refuses to guess. This is an
 * unchecked exception on purpose: it propagates out of the status callback to whoever
 * delivered the report.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class UnhandledStatusCodeException extends IllegalStateException {

    private final String requestId;
    private final int statusCode;

    public UnhandledStatusCodeException(String requestId, int statusCode) {
        super("Unhandled successful transfer status " + statusCode + " for request " + requestId);
        this.requestId = requestId;
        this.statusCode = statusCode;
    }

    public String getRequestId() {
        return requestId;
    }

    public int getStatusCode() {
        return statusCode;
    }
}

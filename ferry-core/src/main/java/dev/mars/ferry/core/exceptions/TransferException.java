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
 * Failure of a single transfer, raised when an admission hook cannot prepare the local
 * side or carried as the error of a gateway request that ended badly.
 *
 * <p>The transfer is identified by its correlation tag. When the failure followed a remote
 * response, the response status code is kept with it; {@code 0} means no response was
 * received or none applies.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class TransferException extends FerryException {

    private final String transferId;
    private final int statusCode;

    public TransferException(String transferId, String message) {
        this(transferId, 0, message, null);
    }

    public TransferException(String transferId, String message, Throwable cause) {
        this(transferId, 0, message, cause);
    }

    /**
     * @param transferId correlation tag of the transfer
     * @param statusCode response status code, or {@code 0} if there was no response
     * @param message    what went wrong
     * @param cause      underlying failure, may be {@code null}
     */
    public TransferException(String transferId, int statusCode, String message, Throwable cause) {
        super(message, cause);
        if (statusCode < 0) {
            throw new IllegalArgumentException("Status code cannot be negative: " + statusCode);
        }
        this.transferId = transferId;
        this.statusCode = statusCode;
    }

    public String getTransferId() {
        return transferId;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasResponse() {
        return statusCode > 0;
    }

    @Override
    public String getMessage() {
        if (hasResponse()) {
            return "Transfer " + transferId + " failed (HTTP " + statusCode + "): " + super.getMessage();
        }
        return "Transfer " + transferId + " failed: " + super.getMessage();
    }
}

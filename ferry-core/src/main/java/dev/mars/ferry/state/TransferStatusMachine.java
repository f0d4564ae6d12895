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

package dev.mars.ferry.state;

import dev.mars.ferry.core.TransferStatus;
import dev.mars.ferry.core.exceptions.RequestCanceledException;
import dev.mars.ferry.core.exceptions.UnhandledStatusCodeException;
import dev.mars.ferry.gateway.GatewayStatus;

import java.util.Optional;

/**
 * Maps gateway status reports onto the application's {@link TransferStatus} taxonomy.
 *
 * <p>The machine is stateless. The coordinator calls {@link #resolveTransient(GatewayStatus, int)}
 * for every report and, when the gateway reports {@link GatewayStatus#COMPLETED}, calls
 * {@link #classifyCompletion(String, int, Throwable)} after it has released the request's slot.</p>
 *
 * <h3>Transient Mapping:</h3>
 * <pre>
 * NONE                                   → NONE
 * TRANSFERRING                           → TRANSFERRING
 * PAUSED                                 → PAUSED
 * WAITING, status code 500-599           → WAITING_FOR_RETRY
 * WAITING, any other status code         → WAITING
 * WAITING_FOR_EXTERNAL_POWER*            → same name
 * WAITING_FOR_NON_VOICE_BLOCKING_NETWORK → same name
 * WAITING_FOR_WIFI                       → NONE
 * UNKNOWN, COMPLETED                     → (no transient status)
 * </pre>
 *
 * <h3>Completion Classification:</h3>
 * <pre>
 * no error, 200 or 206          → SUCCEEDED
 * no error, any other code      → UnhandledStatusCodeException
 * RequestCanceledException      → CANCELED
 * error, 400-499                → FAILED
 * error, 500-599                → FAILED_SERVER
 * error, 0 or any other code    → FAILED
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class TransferStatusMachine {

    public TransferStatusMachine() {
    }

    /**
     * @param gatewayStatus reported gateway status
     * @param statusCode    last protocol status code of the request
     * @return the application status to set, empty when the report carries no transient status
     */
    public Optional<TransferStatus> resolveTransient(GatewayStatus gatewayStatus, int statusCode) {
        switch (gatewayStatus) {
            case NONE:
                return Optional.of(TransferStatus.NONE);
            case TRANSFERRING:
                return Optional.of(TransferStatus.TRANSFERRING);
            case PAUSED:
                return Optional.of(TransferStatus.PAUSED);
            case WAITING:
                return Optional.of(isServerError(statusCode)
                        ? TransferStatus.WAITING_FOR_RETRY
                        : TransferStatus.WAITING);
            case WAITING_FOR_EXTERNAL_POWER:
                return Optional.of(TransferStatus.WAITING_FOR_EXTERNAL_POWER);
            case WAITING_FOR_EXTERNAL_POWER_DUE_TO_BATTERY_SAVER_MODE:
                return Optional.of(TransferStatus.WAITING_FOR_EXTERNAL_POWER_DUE_TO_BATTERY_SAVER_MODE);
            case WAITING_FOR_NON_VOICE_BLOCKING_NETWORK:
                return Optional.of(TransferStatus.WAITING_FOR_NON_VOICE_BLOCKING_NETWORK);
            case WAITING_FOR_WIFI:
                // Folded into NONE; jobs in NONE are not cancellable.
                return Optional.of(TransferStatus.NONE);
            case UNKNOWN:
            case COMPLETED:
            default:
                return Optional.empty();
        }
    }

    /**
     * Classifies a completed gateway request.
     *
     * @param requestId  gateway request id, used in the error message
     * @param statusCode last protocol status code
     * @param error      error reported with the completion, {@code null} if none
     * @return the outcome
     * @throws UnhandledStatusCodeException if there is no error and the code is neither 200 nor 206
     */
    public CompletionOutcome classifyCompletion(String requestId, int statusCode, Throwable error) {
        if (error == null) {
            if (statusCode == 200 || statusCode == 206) {
                return CompletionOutcome.SUCCEEDED;
            }
            throw new UnhandledStatusCodeException(requestId, statusCode);
        }
        if (error instanceof RequestCanceledException) {
            return CompletionOutcome.CANCELED;
        }
        if (statusCode >= 400 && statusCode <= 499) {
            return CompletionOutcome.FAILED;
        }
        if (isServerError(statusCode)) {
            return CompletionOutcome.FAILED_SERVER;
        }
        return CompletionOutcome.FAILED;
    }

    private static boolean isServerError(int statusCode) {
        return statusCode >= 500 && statusCode <= 599;
    }
}

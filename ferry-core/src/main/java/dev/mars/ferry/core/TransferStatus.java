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

package dev.mars.ferry.core;

/**
 * Application-level lifecycle of a transfer job.
 *
 * <p>This is a superset of the states reported by the transfer gateway. The gateway only
 * knows about requests it has accepted; the application additionally tracks jobs that are
 * waiting in the coordinator's own queue ({@link #QUEUED}) and splits the gateway's single
 * completed state into success, client failure, server failure and cancellation.</p>
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * NONE → QUEUED → {TRANSFERRING, WAITING, WAITING_FOR_RETRY, WAITING_FOR_*, PAUSED}
 *                              ↓
 *             {COMPLETED | FAILED | FAILED_SERVER | CANCELED}
 * </pre>
 *
 * <p>The transient states in the middle may cycle among themselves for as long as the
 * gateway keeps the request. A terminal job only leaves its state when it is explicitly
 * enqueued again.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 * @see dev.mars.ferry.state.TransferStatusMachine
 */
public enum TransferStatus {

    /**
     * The job has not been queued yet, or the gateway reported a state that the
     * application deliberately folds into "no status" (waiting for Wi-Fi).
     */
    NONE,

    /**
     * The job sits in the coordinator's internal queue waiting for a free gateway slot.
     */
    QUEUED,

    /**
     * Data is currently being moved by the gateway.
     */
    TRANSFERRING,

    /**
     * The gateway holds the request and is waiting, either behind earlier requests or
     * while retrying after a network error.
     */
    WAITING,

    /**
     * The gateway holds the request and is waiting to retry after a server error (5xx).
     */
    WAITING_FOR_RETRY,

    /**
     * The gateway is waiting for a Wi-Fi connection. The status machine never produces
     * this value (see {@link dev.mars.ferry.state.TransferStatusMachine}); it is kept so
     * that persisted records and view layers can still name it.
     */
    WAITING_FOR_WIFI,

    /**
     * The gateway is waiting for external power.
     */
    WAITING_FOR_EXTERNAL_POWER,

    /**
     * The gateway is waiting for external power because battery saver mode is on.
     */
    WAITING_FOR_EXTERNAL_POWER_DUE_TO_BATTERY_SAVER_MODE,

    /**
     * The gateway is waiting for a network that supports simultaneous voice and data.
     */
    WAITING_FOR_NON_VOICE_BLOCKING_NETWORK,

    /**
     * The request is paused inside the gateway.
     */
    PAUSED,

    /**
     * The transfer finished and its completion hook placed the result.
     */
    COMPLETED,

    /**
     * The transfer ended with a client-side or unclassified error, or could not be admitted.
     */
    FAILED,

    /**
     * The transfer ended with a server error (5xx) that the gateway gave up retrying.
     */
    FAILED_SERVER,

    /**
     * The transfer was canceled before it completed.
     */
    CANCELED;

    /**
     * Terminal states are {@link #COMPLETED}, {@link #FAILED}, {@link #FAILED_SERVER} and
     * {@link #CANCELED}. No further transition happens without re-enqueueing the job.
     *
     * @return {@code true} if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == FAILED_SERVER || this == CANCELED;
    }

    /**
     * A job is admitted while the gateway holds a request for it: every state that is
     * neither terminal, {@link #NONE} nor {@link #QUEUED}.
     *
     * @return {@code true} if the job is under gateway management
     */
    public boolean isAdmitted() {
        return this != NONE && this != QUEUED && !isTerminal();
    }

    /**
     * @return {@code true} for {@link #FAILED} and {@link #FAILED_SERVER}
     */
    public boolean isFailure() {
        return this == FAILED || this == FAILED_SERVER;
    }

    /**
     * @return {@code true} for every waiting variant, including {@link #WAITING_FOR_RETRY}
     */
    public boolean isWaiting() {
        return this == WAITING
                || this == WAITING_FOR_RETRY
                || this == WAITING_FOR_WIFI
                || this == WAITING_FOR_EXTERNAL_POWER
                || this == WAITING_FOR_EXTERNAL_POWER_DUE_TO_BATTERY_SAVER_MODE
                || this == WAITING_FOR_NON_VOICE_BLOCKING_NETWORK;
    }
}

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

/**
 * Status of a request as reported by a {@link TransferGateway}.
 *
 * <p>{@link #COMPLETED} folds success, failure and cancellation together; the outcome is
 * told apart by {@link GatewayRequest#getStatusCode()} and {@link GatewayRequest#getError()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public enum GatewayStatus {
    NONE,
    TRANSFERRING,
    WAITING,
    WAITING_FOR_WIFI,
    WAITING_FOR_EXTERNAL_POWER,
    WAITING_FOR_EXTERNAL_POWER_DUE_TO_BATTERY_SAVER_MODE,
    WAITING_FOR_NON_VOICE_BLOCKING_NETWORK,
    PAUSED,
    COMPLETED,
    /** The gateway lost track of the request. */
    UNKNOWN
}

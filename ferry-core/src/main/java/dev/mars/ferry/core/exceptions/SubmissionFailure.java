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
 * Reasons a gateway may give for refusing a submission.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public enum SubmissionFailure {
    /** The gateway is already holding as many requests as it accepts. */
    CAPACITY_EXCEEDED,
    /** A request for the same location was already submitted. */
    DUPLICATE_REQUEST,
    /** Background transfers are switched off. */
    SYSTEM_DISABLED,
    /** Not enough space left to stage the transfer. */
    INSUFFICIENT_STORAGE,
    /** The transport layer rejected the request. */
    TRANSPORT_ERROR
}

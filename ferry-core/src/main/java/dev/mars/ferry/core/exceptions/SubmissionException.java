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
 * Thrown by a {@link dev.mars.ferry.gateway.TransferGateway} that refuses to accept a request.
 *
 * <p>The coordinator never lets this escape: a rejected submission demotes the job to
 * {@code FAILED} (if it is still queued) and the admission loop moves on to the next job.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class SubmissionException extends TransferException {

    private final SubmissionFailure failure;

    public SubmissionException(String transferId, SubmissionFailure failure, String message) {
        super(transferId, message);
        this.failure = failure;
    }

    public SubmissionException(String transferId, SubmissionFailure failure, String message, Throwable cause) {
        super(transferId, message, cause);
        this.failure = failure;
    }

    public SubmissionFailure getFailure() {
        return failure;
    }
}

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

import java.util.Objects;

/**
 * A single status change of a transfer job.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class StatusChangeEvent {

    private final TransferStatus previous;
    private final TransferStatus current;
    private final Transferable job;

    public StatusChangeEvent(TransferStatus previous, TransferStatus current, Transferable job) {
        this.previous = Objects.requireNonNull(previous, "Previous status cannot be null");
        this.current = Objects.requireNonNull(current, "Current status cannot be null");
        this.job = Objects.requireNonNull(job, "Job cannot be null");
    }

    public TransferStatus getPrevious() { return previous; }
    public TransferStatus getCurrent() { return current; }
    public Transferable getJob() { return job; }

    @Override
    public String toString() {
        return "StatusChangeEvent{job=" + job.getCorrelationTag() + ", " + previous + " -> " + current + "}";
    }
}

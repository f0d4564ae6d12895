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

import dev.mars.ferry.core.exceptions.TransferException;

import java.net.URI;

/**
 * Capability set every job must offer to be scheduled by the
 * {@link dev.mars.ferry.coordinator.TransferCoordinator}.
 *
 * <h3>Identity:</h3>
 * <p>The id is assigned once by the repository when the job is first committed. Its
 * decimal form is the correlation tag handed to the gateway, which is how status reports
 * for a request are traced back to the job after a restart.</p>
 *
 * <h3>Locations:</h3>
 * <ul>
 *   <li>{@link #getFullLocalPath()}: final location of the file, for example {@code /music/a.mp3}</li>
 *   <li>{@link #getStagingPath()}: where the gateway reads or writes while the transfer is
 *       under its control, the staging root followed by the full local path</li>
 * </ul>
 *
 * <h3>Hooks:</h3>
 * <ul>
 *   <li>{@link #onBeforeAdmit()} runs synchronously right before submission and may veto it</li>
 *   <li>{@link #onComplete()} runs once, off the admission path, after the gateway reports success</li>
 *   <li>{@link #onProgress(long, long)} runs on every progress report</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 * @see TransferJob
 */
public interface Transferable {

    /**
     * @return the persistent id, or {@code 0} if the job has not been committed yet
     */
    long getId();

    /**
     * Assigns the persistent id. Only the repository calls this.
     *
     * @throws IllegalStateException if an id was already assigned
     * @throws IllegalArgumentException if the id is not positive
     */
    void assignId(long id);

    /**
     * @return the tag used to correlate gateway requests with this job
     */
    default String getCorrelationTag() {
        return String.valueOf(getId());
    }

    TransferMethod getMethod();

    default TransferDirection getDirection() {
        return getMethod().direction();
    }

    String getRemoteUrl();

    URI getRemoteUri();

    String getFullLocalPath();

    String getStagingPath();

    /**
     * @return the gateway request id, empty until admitted
     */
    String getExternalRequestId();

    void setExternalRequestId(String requestId);

    TransferStatus getStatus();

    /**
     * Sets the status and notifies listeners. Setting {@link TransferStatus#CANCELED}
     * resets the progress fields first.
     */
    void setStatus(TransferStatus status);

    /**
     * @throws TransferException if the job cannot be submitted right now
     */
    void onBeforeAdmit() throws TransferException;

    void onComplete();

    void onProgress(long bytesTransferred, long totalBytes);

    void resetProgress();

    void addStatusChangeListener(StatusChangeListener listener);

    void removeStatusChangeListener(StatusChangeListener listener);
}

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
import dev.mars.ferry.storage.TransferStorage;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Mutable transfer job tracked by the coordinator from enqueue to a terminal status.
 *
 * <p>The job holds routing information (method, remote URL, local path and file name),
 * its gateway correlation (external request id) and its lifecycle (status and progress).
 * Routing fields are validated on assignment; lifecycle fields are mutated by the
 * coordinator and by the job's own hooks once it has been enqueued.</p>
 *
 * <h3>Thread Safety:</h3>
 * <p>All mutable state is guarded by the job's own monitor. Gateway progress callbacks only
 * take this monitor, never the coordinator's. Status listeners are invoked after the
 * monitor has been released, so a listener may safely read the job or call back into the
 * coordinator.</p>
 *
 * <h3>Initial State:</h3>
 * <ul>
 *   <li>Method: GET</li>
 *   <li>Status: NONE</li>
 *   <li>Total bytes: -1 (unknown), indeterminate</li>
 *   <li>External request id: empty</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 * @see Transferable
 * @see TransferStatus
 */
public class TransferJob implements Transferable {

    private static final Logger logger = Logger.getLogger(TransferJob.class.getName());

    private final Object lock = new Object();
    private final TransferStorage storage;
    private final List<StatusChangeListener> listeners = new CopyOnWriteArrayList<>();

    private long id;
    private TransferMethod method = TransferMethod.GET;
    private String remoteUrl;
    private String localPath;
    private String filename;
    private String externalRequestId = "";
    private String externalReference;

    private TransferStatus status = TransferStatus.NONE;
    private long totalBytes = -1;
    private long bytesTransferred;
    private boolean indeterminate = true;
    private double progress;

    /**
     * Creates an empty job bound to the given storage. Routing fields must be set before
     * the job is enqueued.
     *
     * @param storage storage used for staging and final placement
     */
    public TransferJob(TransferStorage storage) {
        this.storage = Objects.requireNonNull(storage, "Transfer storage cannot be null");
    }

    /**
     * Creates a job with all routing fields set.
     *
     * @throws IllegalArgumentException if the URL or the path is not valid
     */
    public TransferJob(TransferStorage storage, TransferMethod method, String remoteUrl,
                       String localPath, String filename) {
        this(storage);
        setMethod(method);
        setRemoteUrl(remoteUrl);
        setLocalPath(localPath);
        setFilename(filename);
    }

    // ========== IDENTITY ==========

    @Override
    public long getId() {
        synchronized (lock) {
            return id;
        }
    }

    @Override
    public void assignId(long newId) {
        if (newId <= 0) {
            throw new IllegalArgumentException("Transfer id must be positive: " + newId);
        }
        synchronized (lock) {
            if (id != 0) {
                throw new IllegalStateException("Transfer already has id " + id);
            }
            id = newId;
        }
    }

    public String getExternalReference() {
        synchronized (lock) {
            return externalReference;
        }
    }

    /**
     * Opaque caller-owned value linking the job to a domain object. Stored and returned
     * unchanged.
     */
    public void setExternalReference(String externalReference) {
        synchronized (lock) {
            this.externalReference = externalReference;
        }
    }

    // ========== ROUTING ==========

    @Override
    public TransferMethod getMethod() {
        synchronized (lock) {
            return method;
        }
    }

    public void setMethod(TransferMethod method) {
        Objects.requireNonNull(method, "Transfer method cannot be null");
        synchronized (lock) {
            this.method = method;
        }
    }

    @Override
    public String getRemoteUrl() {
        synchronized (lock) {
            return remoteUrl;
        }
    }

    /**
     * @throws IllegalArgumentException if the value is not a well-formed absolute URI
     */
    public void setRemoteUrl(String remoteUrl) {
        if (!isAbsoluteUri(remoteUrl)) {
            throw new IllegalArgumentException("The provided remote URL is not valid (" + remoteUrl + ")");
        }
        synchronized (lock) {
            this.remoteUrl = remoteUrl;
        }
    }

    @Override
    public URI getRemoteUri() {
        String url = getRemoteUrl();
        return url == null ? null : URI.create(url);
    }

    public String getLocalPath() {
        synchronized (lock) {
            return localPath;
        }
    }

    /**
     * Sets the directory the file ends up in. The value is normalized to start with
     * {@code /} and not end with {@code /}.
     *
     * @throws IllegalArgumentException if the value is not a well-formed relative path
     */
    public void setLocalPath(String localPath) {
        String normalized = normalizePath(localPath);
        synchronized (lock) {
            this.localPath = normalized;
        }
    }

    public String getFilename() {
        synchronized (lock) {
            return filename;
        }
    }

    /**
     * @throws IllegalArgumentException if the name is blank or contains a path separator
     */
    public void setFilename(String filename) {
        if (filename == null || filename.isBlank() || filename.contains("/") || filename.contains("\\")
                || filename.equals(".") || filename.equals("..")) {
            throw new IllegalArgumentException("The provided file name is not valid (" + filename + ")");
        }
        synchronized (lock) {
            this.filename = filename;
        }
    }

    @Override
    public String getFullLocalPath() {
        synchronized (lock) {
            if (localPath == null || filename == null) {
                return null;
            }
            return localPath + "/" + filename;
        }
    }

    @Override
    public String getStagingPath() {
        String fullLocalPath = getFullLocalPath();
        return fullLocalPath == null ? null : storage.getStagingRoot() + fullLocalPath;
    }

    public TransferStorage getStorage() {
        return storage;
    }

    @Override
    public String getExternalRequestId() {
        synchronized (lock) {
            return externalRequestId;
        }
    }

    @Override
    public void setExternalRequestId(String requestId) {
        synchronized (lock) {
            this.externalRequestId = requestId == null ? "" : requestId;
        }
    }

    // ========== LIFECYCLE ==========

    @Override
    public TransferStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    @Override
    public void setStatus(TransferStatus newStatus) {
        Objects.requireNonNull(newStatus, "Transfer status cannot be null");
        TransferStatus previous;
        synchronized (lock) {
            previous = status;
            status = newStatus;
            if (newStatus == TransferStatus.CANCELED) {
                resetProgressLocked();
            }
        }
        logger.fine("Transfer " + getCorrelationTag() + " status " + previous + " -> " + newStatus);
        fireStatusChanged(new StatusChangeEvent(previous, newStatus, this));
    }

    public long getTotalBytes() {
        synchronized (lock) {
            return totalBytes;
        }
    }

    public long getBytesTransferred() {
        synchronized (lock) {
            return bytesTransferred;
        }
    }

    public boolean isIndeterminate() {
        synchronized (lock) {
            return indeterminate;
        }
    }

    /**
     * @return progress between 0.0 and 1.0; only meaningful when not indeterminate
     */
    public double getProgress() {
        synchronized (lock) {
            return progress;
        }
    }

    @Override
    public void onProgress(long transferred, long total) {
        synchronized (lock) {
            indeterminate = total == -1 && status == TransferStatus.TRANSFERRING;
            totalBytes = total;
            bytesTransferred = transferred;
            if (indeterminate || total <= 0) {
                progress = 0.0;
            } else {
                progress = Math.min(1.0, (double) transferred / total);
            }
        }
    }

    @Override
    public void resetProgress() {
        synchronized (lock) {
            resetProgressLocked();
        }
    }

    /**
     * Puts back progress values read from persistent storage. No listener is notified.
     */
    public void restoreProgress(long transferred, long total, boolean indeterminate, double progress) {
        synchronized (lock) {
            this.bytesTransferred = transferred;
            this.totalBytes = total;
            this.indeterminate = indeterminate;
            this.progress = progress;
        }
    }

    private void resetProgressLocked() {
        bytesTransferred = 0;
        indeterminate = true;
        progress = 0.0;
    }

    // ========== HOOKS ==========

    @Override
    public void onBeforeAdmit() throws TransferException {
        getDirection().prepare(this, storage);
    }

    /**
     * Places the result of a successful gateway exchange and sets the final status:
     * {@link TransferStatus#COMPLETED} if the result is in place, otherwise
     * {@link TransferStatus#FAILED}. Failures are logged, never thrown.
     */
    @Override
    public void onComplete() {
        TransferDirection direction = getDirection();
        if (direction.finish(this, storage)) {
            synchronized (lock) {
                if (totalBytes >= 0) {
                    bytesTransferred = totalBytes;
                }
                indeterminate = false;
                progress = 1.0;
            }
            logger.info("Transfer " + getCorrelationTag() + " completed: " + getFullLocalPath());
            setStatus(TransferStatus.COMPLETED);
        } else {
            logger.warning("Transfer " + getCorrelationTag() + " could not be finalized (" + direction + ")");
            setStatus(TransferStatus.FAILED);
        }
    }

    // ========== LISTENERS ==========

    @Override
    public void addStatusChangeListener(StatusChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public void removeStatusChangeListener(StatusChangeListener listener) {
        listeners.remove(listener);
    }

    private void fireStatusChanged(StatusChangeEvent event) {
        for (StatusChangeListener listener : listeners) {
            try {
                listener.onStatusChanged(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Status listener failed for " + event, e);
            }
        }
    }

    // ========== VALIDATION ==========

    static boolean isAbsoluteUri(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(value);
            return uri.isAbsolute() && !uri.isOpaque() && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    static String normalizePath(String value) {
        if (value == null) {
            throw new IllegalArgumentException("The provided path is not valid (null)");
        }
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("The provided path is not valid (" + value + ")", e);
        }
        if (uri.isAbsolute() || uri.getRawAuthority() != null || uri.getRawQuery() != null
                || uri.getRawFragment() != null || value.contains("\\")) {
            throw new IllegalArgumentException("The provided path is not valid (" + value + ")");
        }

        String normalized = value;
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        if (normalized.length() == 1 || normalized.contains("//")) {
            throw new IllegalArgumentException("The provided path is not valid (" + value + ")");
        }
        for (String segment : normalized.substring(1).split("/")) {
            if (segment.equals("..") || segment.equals(".")) {
                throw new IllegalArgumentException("The provided path is not valid (" + value + ")");
            }
        }
        return normalized;
    }

    @Override
    public String toString() {
        return "TransferJob{" +
                "id=" + getId() +
                ", method=" + getMethod() +
                ", remoteUrl='" + getRemoteUrl() + '\'' +
                ", fullLocalPath='" + getFullLocalPath() + '\'' +
                ", status=" + getStatus() +
                '}';
    }
}

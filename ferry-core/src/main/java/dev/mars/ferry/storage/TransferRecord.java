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

package dev.mars.ferry.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.ferry.core.TransferJob;
import dev.mars.ferry.core.TransferMethod;
import dev.mars.ferry.core.TransferStatus;

/**
 * Serializable snapshot of a {@link TransferJob}, as written by {@link JsonFileTransferRepository}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class TransferRecord {

    @JsonProperty("id")
    private long id;

    @JsonProperty("method")
    private TransferMethod method;

    @JsonProperty("remoteUrl")
    private String remoteUrl;

    @JsonProperty("localPath")
    private String localPath;

    @JsonProperty("filename")
    private String filename;

    @JsonProperty("externalRequestId")
    private String externalRequestId;

    @JsonProperty("externalReference")
    private String externalReference;

    @JsonProperty("status")
    private TransferStatus status;

    @JsonProperty("totalBytes")
    private long totalBytes;

    @JsonProperty("bytesTransferred")
    private long bytesTransferred;

    @JsonProperty("indeterminate")
    private boolean indeterminate;

    @JsonProperty("progress")
    private double progress;

    /**
     * Default constructor.
     */
    public TransferRecord() {
    }

    public static TransferRecord from(TransferJob job) {
        TransferRecord record = new TransferRecord();
        record.id = job.getId();
        record.method = job.getMethod();
        record.remoteUrl = job.getRemoteUrl();
        record.localPath = job.getLocalPath();
        record.filename = job.getFilename();
        record.externalRequestId = job.getExternalRequestId();
        record.externalReference = job.getExternalReference();
        record.status = job.getStatus();
        record.totalBytes = job.getTotalBytes();
        record.bytesTransferred = job.getBytesTransferred();
        record.indeterminate = job.isIndeterminate();
        record.progress = job.getProgress();
        return record;
    }

    /**
     * Rebuilds a live job bound to the given storage.
     *
     * @throws IllegalArgumentException if the stored routing fields are no longer valid
     */
    public TransferJob toJob(TransferStorage storage) {
        TransferJob job = new TransferJob(storage, method != null ? method : TransferMethod.GET,
                remoteUrl, localPath, filename);
        job.assignId(id);
        job.setExternalRequestId(externalRequestId);
        job.setExternalReference(externalReference);
        job.setStatus(status != null ? status : TransferStatus.NONE);
        job.restoreProgress(bytesTransferred, totalBytes, indeterminate, progress);
        return job;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public TransferMethod getMethod() { return method; }
    public void setMethod(TransferMethod method) { this.method = method; }

    public String getRemoteUrl() { return remoteUrl; }
    public void setRemoteUrl(String remoteUrl) { this.remoteUrl = remoteUrl; }

    public String getLocalPath() { return localPath; }
    public void setLocalPath(String localPath) { this.localPath = localPath; }

    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }

    public String getExternalRequestId() { return externalRequestId; }
    public void setExternalRequestId(String externalRequestId) { this.externalRequestId = externalRequestId; }

    public String getExternalReference() { return externalReference; }
    public void setExternalReference(String externalReference) { this.externalReference = externalReference; }

    public TransferStatus getStatus() { return status; }
    public void setStatus(TransferStatus status) { this.status = status; }

    public long getTotalBytes() { return totalBytes; }
    public void setTotalBytes(long totalBytes) { this.totalBytes = totalBytes; }

    public long getBytesTransferred() { return bytesTransferred; }
    public void setBytesTransferred(long bytesTransferred) { this.bytesTransferred = bytesTransferred; }

    public boolean isIndeterminate() { return indeterminate; }
    public void setIndeterminate(boolean indeterminate) { this.indeterminate = indeterminate; }

    public double getProgress() { return progress; }
    public void setProgress(double progress) { this.progress = progress; }
}

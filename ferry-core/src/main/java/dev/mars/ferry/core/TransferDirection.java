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

import java.io.IOException;
import java.util.logging.Logger;

/**
 * Direction of a transfer, derived from its {@link TransferMethod}.
 *
 * <p>Each direction carries the local-side work a job needs around the gateway
 * exchange:</p>
 * <ul>
 *   <li><b>DOWNLOAD:</b> the gateway writes into the staging area, so the staging directory
 *       must exist before admission and the staged file is moved to its final location on
 *       completion.</li>
 *   <li><b>UPLOAD:</b> the gateway reads from the staging area, so the staged source must
 *       already be there; nothing is moved on completion.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 * @see TransferJob#onBeforeAdmit()
 * @see TransferJob#onComplete()
 */
public enum TransferDirection {

    DOWNLOAD("Remote -> Local") {
        @Override
        void prepare(Transferable job, TransferStorage storage) throws TransferException {
            String stagingPath = job.getStagingPath();
            String stagingDirectory = stagingPath.substring(0, stagingPath.lastIndexOf('/'));
            try {
                storage.ensureDirectory(stagingDirectory);
            } catch (IOException e) {
                throw new TransferException(job.getCorrelationTag(),
                        "Could not create staging directory " + stagingDirectory, e);
            }
        }

        @Override
        boolean finish(Transferable job, TransferStorage storage) {
            String stagingPath = job.getStagingPath();
            if (!storage.exists(stagingPath)) {
                logger.warning("Staged download missing for transfer " + job.getCorrelationTag() + ": " + stagingPath);
                return false;
            }
            try {
                storage.move(stagingPath, job.getFullLocalPath());
                return true;
            } catch (IOException e) {
                logger.warning("Failed to move " + stagingPath + " to " + job.getFullLocalPath()
                        + " - " + e.getMessage());
                return false;
            }
        }
    },

    UPLOAD("Local -> Remote") {
        @Override
        void prepare(Transferable job, TransferStorage storage) throws TransferException {
            if (!storage.exists(job.getStagingPath())) {
                throw new TransferException(job.getCorrelationTag(),
                        "Upload source not found: " + job.getStagingPath());
            }
        }

        @Override
        boolean finish(Transferable job, TransferStorage storage) {
            return true;
        }
    };

    private static final Logger logger = Logger.getLogger(TransferDirection.class.getName());

    private final String description;

    TransferDirection(String description) {
        this.description = description;
    }

    /**
     * Local-side preparation run right before the job is submitted.
     *
     * @throws TransferException if the job cannot be submitted
     */
    abstract void prepare(Transferable job, TransferStorage storage) throws TransferException;

    /**
     * Local-side work after the gateway reports success.
     *
     * @return {@code true} if the result is in place
     */
    abstract boolean finish(Transferable job, TransferStorage storage);

    public String getDescription() {
        return description;
    }

    public boolean isDownload() {
        return this == DOWNLOAD;
    }

    public boolean isUpload() {
        return this == UPLOAD;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}

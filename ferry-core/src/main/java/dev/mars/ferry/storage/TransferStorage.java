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

import java.io.IOException;
import java.nio.file.Path;

/**
 * File placement collaborator used by transfer jobs and gateways.
 *
 * <p>All paths are logical, slash-separated paths such as {@code /music/track.mp3}.
 * A leading slash is relative to the storage root, never to the host file system root.
 * The staging area that gateways write downloads into (and read uploads from) lives
 * under {@link #getStagingRoot()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface TransferStorage {

    /**
     * @return the logical staging prefix, for example {@code /shared/transfers}
     */
    String getStagingRoot();

    /**
     * Maps a logical path onto the underlying file system.
     *
     * @param path logical path
     * @return the resolved file system path
     * @throws IllegalArgumentException if the path escapes the storage root
     */
    Path resolve(String path);

    /**
     * Creates the directory (and its parents) if it does not exist yet.
     */
    void ensureDirectory(String path) throws IOException;

    boolean exists(String path);

    /**
     * Moves a file, replacing the target if it exists and creating the target's parent
     * directories as needed.
     */
    void move(String source, String target) throws IOException;

    /**
     * Deletes the file if present.
     *
     * @return {@code true} if a file was deleted
     */
    boolean delete(String path) throws IOException;

    long size(String path) throws IOException;

    /**
     * @return usable bytes left on the store that holds the storage root
     */
    long getUsableSpace() throws IOException;
}

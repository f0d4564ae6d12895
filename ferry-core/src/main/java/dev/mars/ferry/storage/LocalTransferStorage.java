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

import dev.mars.ferry.config.FerryConfiguration;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Logger;

/**
 * {@link TransferStorage} over a directory of the local file system.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class LocalTransferStorage implements TransferStorage {
    private static final Logger logger = Logger.getLogger(LocalTransferStorage.class.getName());

    private final Path root;
    private final String stagingRoot;

    /**
     * @param root             directory all logical paths resolve under
     * @param stagingDirectory staging directory relative to the root, e.g. {@code shared/transfers}
     */
    public LocalTransferStorage(Path root, String stagingDirectory) {
        this.root = root.toAbsolutePath().normalize();
        String staging = stagingDirectory.startsWith("/") ? stagingDirectory : "/" + stagingDirectory;
        this.stagingRoot = staging.endsWith("/") ? staging.substring(0, staging.length() - 1) : staging;
    }

    public LocalTransferStorage(FerryConfiguration configuration) {
        this(configuration.getStorageRoot(), configuration.getStagingDirectory());
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public String getStagingRoot() {
        return stagingRoot;
    }

    @Override
    public Path resolve(String path) {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        String relative = path;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            logger.warning("Potentially unsafe path detected: " + path);
            throw new IllegalArgumentException("Path escapes the storage root: " + path);
        }
        return resolved;
    }

    @Override
    public void ensureDirectory(String path) throws IOException {
        Path directory = resolve(path);
        if (!Files.isDirectory(directory)) {
            Files.createDirectories(directory);
            logger.info("Created directory: " + directory);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    @Override
    public void move(String source, String target) throws IOException {
        Path from = resolve(source);
        Path to = resolve(target);
        Path parent = to.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Moved file from " + from + " to " + to);
    }

    @Override
    public boolean delete(String path) throws IOException {
        Path file = resolve(path);
        boolean deleted = Files.deleteIfExists(file);
        if (deleted) {
            logger.info("Deleted file: " + file);
        }
        return deleted;
    }

    @Override
    public long size(String path) throws IOException {
        return Files.size(resolve(path));
    }

    @Override
    public long getUsableSpace() throws IOException {
        Path existing = root;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            throw new IOException("No existing directory above storage root " + root);
        }
        FileStore store = Files.getFileStore(existing);
        return store.getUsableSpace();
    }

    @Override
    public String toString() {
        return "LocalTransferStorage{root=" + root + ", stagingRoot='" + stagingRoot + "'}";
    }
}

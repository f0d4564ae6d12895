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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.ferry.core.TransferJob;
import dev.mars.ferry.core.Transferable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Repository that mirrors the in-memory job set to a JSON file on every commit.
 *
 * <p>The file is an array of {@link TransferRecord}s. It is written to a temporary file in
 * the same directory and then moved over the previous version, so a crash during commit
 * leaves the last committed state intact. Existing records are loaded back into live
 * {@link TransferJob}s when the repository is constructed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class JsonFileTransferRepository extends InMemoryTransferRepository {
    private static final Logger logger = Logger.getLogger(JsonFileTransferRepository.class.getName());

    private static final TypeReference<List<TransferRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper;

    /**
     * Opens the repository, loading any records already in the file.
     *
     * @param file    the JSON file, created on first commit
     * @param storage storage the loaded jobs are bound to
     * @throws IOException if an existing file cannot be read
     */
    public JsonFileTransferRepository(Path file, TransferStorage storage) throws IOException {
        this.file = file;
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        load(storage);
    }

    @Override
    public void insert(Transferable job) {
        if (!(job instanceof TransferJob)) {
            throw new IllegalArgumentException("Only TransferJob instances can be persisted: " + job);
        }
        super.insert(job);
    }

    @Override
    public void commit() throws IOException {
        synchronized (lock) {
            super.commit();
            write();
        }
    }

    public Path getFile() {
        return file;
    }

    private void load(TransferStorage storage) throws IOException {
        if (!Files.exists(file)) {
            logger.info("No transfer repository at " + file + ", starting empty");
            return;
        }
        List<TransferRecord> records = mapper.readValue(file.toFile(), RECORD_LIST);
        int loaded = 0;
        for (TransferRecord record : records) {
            if (record.getId() <= 0) {
                logger.warning("Skipping transfer record without id in " + file);
                continue;
            }
            try {
                restore(record.toJob(storage));
                loaded++;
            } catch (IllegalArgumentException e) {
                logger.warning("Skipping invalid transfer record " + record.getId() + ": " + e.getMessage());
            }
        }
        logger.info("Loaded " + loaded + " transfers from " + file);
    }

    private void write() throws IOException {
        List<TransferRecord> records = new ArrayList<>();
        for (Transferable job : findAll()) {
            records.add(TransferRecord.from((TransferJob) job));
        }

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            mapper.writeValue(temp.toFile(), records);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.fine("Wrote " + records.size() + " transfers to " + file);
    }
}

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

import dev.mars.ferry.core.Transferable;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Persistent record of transfer jobs consumed by the coordinator.
 *
 * <p>Inserts and deletes are staged and only take effect on {@link #commit()}. Ids are
 * assigned to newly inserted jobs when they are committed, so a job only gets a correlation
 * tag once it has been committed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface TransferRepository {

    /**
     * @return committed jobs in status {@code QUEUED}, in insertion order
     */
    List<Transferable> listNonTerminalPending();

    /**
     * @param tag correlation tag received from the gateway
     * @return the job, empty if the tag is not a number or no job has that id
     */
    Optional<Transferable> findByCorrelationTag(String tag);

    Optional<Transferable> findById(long id);

    /**
     * @return every committed job, in insertion order
     */
    List<Transferable> findAll();

    void insert(Transferable job);

    void delete(Transferable job);

    /**
     * Applies staged inserts and deletes.
     *
     * @throws IOException if the repository could not be written
     */
    void commit() throws IOException;
}

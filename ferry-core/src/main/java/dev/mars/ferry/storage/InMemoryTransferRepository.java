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

import dev.mars.ferry.core.TransferStatus;
import dev.mars.ferry.core.Transferable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Repository that keeps live job instances in memory.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class InMemoryTransferRepository implements TransferRepository {
    private static final Logger logger = Logger.getLogger(InMemoryTransferRepository.class.getName());

    protected final Object lock = new Object();

    private final Map<Long, Transferable> jobs = new LinkedHashMap<>();
    private final List<Transferable> pendingInserts = new ArrayList<>();
    private final List<Transferable> pendingDeletes = new ArrayList<>();
    private final AtomicLong lastId = new AtomicLong(0);

    @Override
    public List<Transferable> listNonTerminalPending() {
        synchronized (lock) {
            return jobs.values().stream()
                    .filter(job -> job.getStatus() == TransferStatus.QUEUED)
                    .collect(Collectors.toList());
        }
    }

    @Override
    public Optional<Transferable> findByCorrelationTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        try {
            return findById(Long.parseLong(tag.trim()));
        } catch (NumberFormatException e) {
            logger.fine("Correlation tag is not a transfer id: " + tag);
            return Optional.empty();
        }
    }

    @Override
    public Optional<Transferable> findById(long id) {
        synchronized (lock) {
            return Optional.ofNullable(jobs.get(id));
        }
    }

    @Override
    public List<Transferable> findAll() {
        synchronized (lock) {
            return new ArrayList<>(jobs.values());
        }
    }

    @Override
    public void insert(Transferable job) {
        synchronized (lock) {
            pendingDeletes.remove(job);
            if (!pendingInserts.contains(job)) {
                pendingInserts.add(job);
            }
        }
    }

    @Override
    public void delete(Transferable job) {
        synchronized (lock) {
            pendingInserts.remove(job);
            if (!pendingDeletes.contains(job)) {
                pendingDeletes.add(job);
            }
        }
    }

    @Override
    public void commit() throws IOException {
        synchronized (lock) {
            for (Transferable job : pendingDeletes) {
                if (job.getId() != 0 && jobs.remove(job.getId()) != null) {
                    logger.fine("Deleted transfer " + job.getId());
                }
            }
            for (Transferable job : pendingInserts) {
                if (job.getId() == 0) {
                    job.assignId(lastId.incrementAndGet());
                } else {
                    lastId.accumulateAndGet(job.getId(), Math::max);
                }
                jobs.put(job.getId(), job);
                logger.fine("Inserted transfer " + job.getId());
            }
            pendingDeletes.clear();
            pendingInserts.clear();
        }
    }

    /**
     * Puts back a job loaded from persistent storage without staging it.
     */
    protected void restore(Transferable job) {
        synchronized (lock) {
            lastId.accumulateAndGet(job.getId(), Math::max);
            jobs.put(job.getId(), job);
        }
    }

    public int size() {
        synchronized (lock) {
            return jobs.size();
        }
    }
}

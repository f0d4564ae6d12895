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

package dev.mars.ferry.coordinator;

import dev.mars.ferry.config.FerryConfiguration;
import dev.mars.ferry.core.TransferStatus;
import dev.mars.ferry.core.Transferable;
import dev.mars.ferry.core.exceptions.RequestAlreadyRemovedException;
import dev.mars.ferry.core.exceptions.SubmissionException;
import dev.mars.ferry.core.exceptions.TransferException;
import dev.mars.ferry.core.exceptions.UnhandledStatusCodeException;
import dev.mars.ferry.gateway.GatewayRequest;
import dev.mars.ferry.gateway.GatewayRequestListener;
import dev.mars.ferry.gateway.GatewayStatus;
import dev.mars.ferry.gateway.SubmitRequest;
import dev.mars.ferry.gateway.TransferGateway;
import dev.mars.ferry.monitoring.CoordinatorTelemetryMetrics;
import dev.mars.ferry.state.CompletionOutcome;
import dev.mars.ferry.state.TransferStatusMachine;
import dev.mars.ferry.storage.TransferRepository;
import io.vertx.core.Vertx;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Admission-controlled scheduler between an unbounded set of transfer jobs and a
 * {@link TransferGateway} that only accepts a few concurrent requests.
 *
 * <p>Jobs wait in an internal FIFO queue until a gateway slot is free. The admission loop
 * submits queued jobs while fewer than {@link #getMaxActiveRequests()} requests are
 * active. Every status report from the gateway is passed through the
 * {@link TransferStatusMachine}; a completed report releases the request's slot and runs
 * the admission loop again before the outcome is applied to the job.</p>
 *
 * <h3>Thread Safety:</h3>
 * <p>One monitor guards the queue and the active-request counter. Admission, cancellation,
 * reconciliation and every gateway status report take it. Progress reports only touch
 * the job. A call to the admission loop made while a pass is already running on the same
 * thread (a gateway reporting synchronously from {@code submit}, for example) returns
 * immediately; the running pass re-checks its condition on every iteration.</p>
 *
 * <h3>Startup:</h3>
 * <p>{@link #start(Vertx, TransferGateway, TransferRepository, FerryConfiguration)} sets the
 * counter to the number of requests the gateway already holds, reattaches every request
 * whose tag resolves to a job, removes those that do not, and fails admitted jobs whose
 * request the gateway no longer holds. It then loads the repository's queued jobs and runs
 * one admission pass.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 * @see TransferStatusMachine
 */
public class TransferCoordinator {
    private static final Logger logger = Logger.getLogger(TransferCoordinator.class.getName());

    private final Object lock = new Object();
    private final Deque<Transferable> queue = new ArrayDeque<>();
    // requests whose completion hook has been dispatched but has not finished
    private final Set<String> completingRequests = new HashSet<>();

    private final Vertx vertx;
    private final TransferGateway gateway;
    private final TransferRepository repository;
    private final FerryConfiguration configuration;
    private final CoordinatorTelemetryMetrics metrics;
    private final TransferStatusMachine statusMachine = new TransferStatusMachine();
    private final GatewayRequestListener requestListener = new RequestListener();
    private final int maxActiveRequests;

    private int activeRequests;
    private boolean admissionInProgress;

    private TransferCoordinator(Vertx vertx, TransferGateway gateway, TransferRepository repository,
                                FerryConfiguration configuration, CoordinatorTelemetryMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.gateway = Objects.requireNonNull(gateway, "Transfer gateway cannot be null");
        this.repository = Objects.requireNonNull(repository, "Transfer repository cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.maxActiveRequests = configuration.getMaxActiveRequests();
    }

    /**
     * Creates a coordinator and reconciles it with the gateway and the repository.
     * Metrics are created from the configuration.
     */
    public static TransferCoordinator start(Vertx vertx, TransferGateway gateway, TransferRepository repository,
                                            FerryConfiguration configuration) {
        return start(vertx, gateway, repository, configuration, CoordinatorTelemetryMetrics.create(configuration));
    }

    /**
     * Creates a coordinator and reconciles it with the gateway and the repository.
     *
     * @param vertx         runs completion hooks off the admission path
     * @param gateway       the external transfer subsystem
     * @param repository    source of job records
     * @param configuration coordinator ceiling and transfer preferences
     * @param metrics       telemetry sink
     * @return the running coordinator
     */
    public static TransferCoordinator start(Vertx vertx, TransferGateway gateway, TransferRepository repository,
                                            FerryConfiguration configuration, CoordinatorTelemetryMetrics metrics) {
        TransferCoordinator coordinator = new TransferCoordinator(vertx, gateway, repository, configuration, metrics);
        coordinator.reconcile();
        return coordinator;
    }

    private void reconcile() {
        synchronized (lock) {
            List<GatewayRequest> requests = gateway.listActiveRequests();
            activeRequests = requests.size();
            logger.info("Starting transfer coordinator: " + activeRequests + " gateway requests, ceiling "
                    + maxActiveRequests);

            Set<String> heldRequestIds = new HashSet<>();
            for (GatewayRequest request : requests) {
                heldRequestIds.add(request.getRequestId());
                if (repository.findByCorrelationTag(request.getTag()).isPresent()) {
                    request.subscribe(requestListener);
                    processTransfer(request);
                } else {
                    removeOrphan(request);
                }
            }
            failLostJobs(heldRequestIds);

            List<Transferable> pending = repository.listNonTerminalPending();
            for (Transferable job : pending) {
                if (!queue.contains(job)) {
                    queue.addLast(job);
                }
            }
            logger.info("Loaded " + pending.size() + " queued transfers");
            updateGauges();
            runAdmissionLoop();
        }
    }

    private void failLostJobs(Set<String> heldRequestIds) {
        for (Transferable job : repository.findAll()) {
            String requestId = job.getExternalRequestId();
            if (!job.getStatus().isAdmitted() || heldRequestIds.contains(requestId)
                    || completingRequests.contains(requestId)) {
                continue;
            }
            logger.warning("Transfer " + job.getCorrelationTag() + " was " + job.getStatus()
                    + " but the gateway no longer holds request " + requestId + "; marking it failed");
            job.setExternalRequestId("");
            job.setStatus(TransferStatus.FAILED);
            metrics.recordOrphanRemoved();
        }
    }

    // ========== ENQUEUE ==========

    /**
     * Appends the job to the queue after resetting its progress, marks it
     * {@link TransferStatus#QUEUED} and runs one admission pass.
     *
     * @throws IllegalArgumentException if the job has not been committed to the repository
     * @throws IllegalStateException if the job is currently held by the gateway
     */
    public void enqueue(Transferable job) {
        checkEnqueueable(job);
        job.resetProgress();
        synchronized (lock) {
            addToQueue(job, false);
            runAdmissionLoop();
        }
    }

    /**
     * Puts the job at the head of the queue, marks it {@link TransferStatus#QUEUED} and runs
     * one admission pass. Progress is left as it is.
     *
     * @throws IllegalArgumentException if the job has not been committed to the repository
     * @throws IllegalStateException if the job is currently held by the gateway
     */
    public void enqueueFirst(Transferable job) {
        checkEnqueueable(job);
        synchronized (lock) {
            addToQueue(job, true);
            runAdmissionLoop();
        }
    }

    /**
     * Appends every job in iteration order, then runs one admission pass.
     */
    public void enqueueAll(Collection<? extends Transferable> jobs) {
        for (Transferable job : jobs) {
            checkEnqueueable(job);
        }
        synchronized (lock) {
            for (Transferable job : jobs) {
                job.resetProgress();
                addToQueue(job, false);
            }
            runAdmissionLoop();
        }
    }

    private void checkEnqueueable(Transferable job) {
        Objects.requireNonNull(job, "Transfer job cannot be null");
        if (job.getId() == 0) {
            throw new IllegalArgumentException("Transfer must be committed to the repository before it is enqueued");
        }
        if (job.getStatus().isAdmitted()) {
            throw new IllegalStateException("Transfer " + job.getCorrelationTag() + " is already active ("
                    + job.getStatus() + ")");
        }
    }

    private void addToQueue(Transferable job, boolean first) {
        queue.remove(job);
        if (first) {
            queue.addFirst(job);
        } else {
            queue.addLast(job);
        }
        job.setStatus(TransferStatus.QUEUED);
        logger.fine("Queued transfer " + job.getCorrelationTag() + (first ? " at head" : ""));
        updateGauges();
    }

    // ========== ADMISSION ==========

    /**
     * Admits queued jobs while gateway slots are free. A job that cannot be admitted and is
     * still {@link TransferStatus#QUEUED} is marked {@link TransferStatus#FAILED}.
     */
    public void runAdmissionLoop() {
        synchronized (lock) {
            if (admissionInProgress) {
                return;
            }
            admissionInProgress = true;
            try {
                while (activeRequests < maxActiveRequests && !queue.isEmpty()) {
                    Transferable job = queue.pollFirst();
                    updateGauges();
                    if (!admit(job) && job.getStatus() == TransferStatus.QUEUED) {
                        job.setStatus(TransferStatus.FAILED);
                    }
                }
            } finally {
                admissionInProgress = false;
                updateGauges();
            }
        }
    }

    /**
     * Submits one job to the gateway, outside of the queue and the ceiling check.
     *
     * @return {@code true} if the gateway accepted the job
     */
    boolean admit(Transferable job) {
        synchronized (lock) {
            String tag = job.getCorrelationTag();

            URI remoteUri = toAbsoluteUri(job.getRemoteUrl());
            if (remoteUri == null) {
                logger.warning("Unable to admit transfer " + tag + ": malformed remote URI (" + job.getRemoteUrl() + ")");
                metrics.recordAdmissionFailed("INVALID_REMOTE_URI");
                return false;
            }
            String stagingPath = job.getStagingPath();
            if (job.getFullLocalPath() == null || stagingPath == null || !isRelativePath(job.getFullLocalPath())) {
                logger.warning("Unable to admit transfer " + tag + ": malformed local path (" + job.getFullLocalPath() + ")");
                metrics.recordAdmissionFailed("INVALID_LOCAL_PATH");
                return false;
            }

            try {
                job.onBeforeAdmit();
            } catch (TransferException e) {
                logger.warning("Unable to admit transfer " + tag + ": " + e.getMessage());
                metrics.recordAdmissionFailed("PREPARE_FAILED");
                return false;
            }

            SubmitRequest submitRequest = new SubmitRequest(tag, job.getMethod(), remoteUri, job.getDirection(),
                    stagingPath, configuration.getTransferPreferences());
            GatewayRequest request;
            try {
                request = gateway.submit(submitRequest);
            } catch (SubmissionException e) {
                logger.warning("Unable to admit transfer " + tag + " (" + e.getFailure() + "): " + e.getMessage());
                metrics.recordAdmissionFailed(e.getFailure());
                return false;
            }

            job.setExternalRequestId(request.getRequestId());
            activeRequests++;
            metrics.recordAdmitted();
            updateGauges();
            logger.info("Admitted transfer " + tag + " as request " + request.getRequestId()
                    + " (" + activeRequests + "/" + maxActiveRequests + " active)");

            request.subscribe(requestListener);
            processTransfer(request);
            if (job.getStatus() == TransferStatus.QUEUED) {
                job.setStatus(TransferStatus.WAITING);
            }
            return true;
        }
    }

    // ========== CANCELLATION ==========

    /**
     * Cancels a job. A queued job is taken off the queue and marked
     * {@link TransferStatus#CANCELED} without contacting the gateway. An active job has its
     * gateway request removed once; the gateway's final report then resolves it to
     * {@link TransferStatus#CANCELED}. An active job whose request the gateway no longer
     * holds is marked {@link TransferStatus#CANCELED} directly. Jobs in
     * {@link TransferStatus#NONE} or a terminal status are left alone.
     */
    public void cancel(Transferable job) {
        synchronized (lock) {
            TransferStatus status = job.getStatus();
            if (status == TransferStatus.QUEUED) {
                queue.remove(job);
                job.setStatus(TransferStatus.CANCELED);
                metrics.recordCanceled();
                updateGauges();
                logger.info("Canceled queued transfer " + job.getCorrelationTag());
            } else if (status.isAdmitted()) {
                String requestId = job.getExternalRequestId();
                if (completingRequests.contains(requestId)) {
                    logger.fine("Transfer " + job.getCorrelationTag() + " is already completing");
                } else if (requestId.isEmpty() || gateway.find(requestId).isEmpty()) {
                    job.setExternalRequestId("");
                    job.setStatus(TransferStatus.CANCELED);
                    metrics.recordCanceled();
                    logger.info("Canceled transfer " + job.getCorrelationTag() + " with no gateway request");
                } else {
                    logger.info("Canceling active transfer " + job.getCorrelationTag() + " (request " + requestId + ")");
                    removeExternalRequest(requestId);
                    runAdmissionLoop();
                }
            } else {
                logger.fine("Nothing to cancel for transfer " + job.getCorrelationTag() + " in status " + status);
            }
        }
    }

    /**
     * Cancels every queued job, then every request the gateway holds. Requests that do not
     * belong to a current job are removed as orphans.
     */
    public void cancelAll() {
        synchronized (lock) {
            for (Transferable job : new ArrayList<>(queue)) {
                cancel(job);
            }
            for (GatewayRequest request : gateway.listActiveRequests()) {
                Optional<Transferable> job = repository.findByCorrelationTag(request.getTag());
                if (job.isPresent() && request.getRequestId().equals(job.get().getExternalRequestId())) {
                    cancel(job.get());
                } else {
                    removeOrphan(request);
                }
            }
        }
    }

    /**
     * Removes a request from the gateway and releases its slot. A request that is no
     * longer known, or that was removed before, releases nothing.
     *
     * @return {@code true} if a slot was released
     */
    boolean removeExternalRequest(String requestId) {
        synchronized (lock) {
            if (requestId == null || requestId.isEmpty()) {
                return false;
            }
            Optional<GatewayRequest> request = gateway.find(requestId);
            if (request.isEmpty()) {
                logger.fine("Gateway request " + requestId + " is no longer known");
                return false;
            }
            try {
                gateway.remove(request.get());
            } catch (RequestAlreadyRemovedException e) {
                logger.fine(e.getMessage());
                return false;
            }
            if (activeRequests > 0) {
                activeRequests--;
            } else {
                logger.warning("Removed gateway request " + requestId + " while no slot was in use");
            }
            updateGauges();
            logger.fine("Released slot of request " + requestId + " (" + activeRequests + "/" + maxActiveRequests + " active)");
            return true;
        }
    }

    private void removeOrphan(GatewayRequest request) {
        logger.warning("Removing orphaned gateway request " + request.getRequestId() + " (tag " + request.getTag() + ")");
        removeExternalRequest(request.getRequestId());
        metrics.recordOrphanRemoved();
    }

    // ========== STATUS RECONCILIATION ==========

    /**
     * Applies the request's current gateway status to its job.
     *
     * @throws UnhandledStatusCodeException if the request completed without error and with
     *                                      a status code other than 200 or 206
     */
    void processTransfer(GatewayRequest request) {
        synchronized (lock) {
            Optional<Transferable> found = repository.findByCorrelationTag(request.getTag());
            if (found.isEmpty()) {
                removeOrphan(request);
                return;
            }
            Transferable job = found.get();
            boolean current = isCurrentRequest(job, request);
            GatewayStatus gatewayStatus = request.getStatus();

            if (gatewayStatus == GatewayStatus.COMPLETED) {
                removeExternalRequest(request.getRequestId());
                runAdmissionLoop();
                if (!current || job.getStatus().isTerminal()
                        || completingRequests.contains(request.getRequestId())) {
                    logger.fine("Ignoring completion of stale request " + request.getRequestId()
                            + " for transfer " + job.getCorrelationTag());
                    return;
                }
                applyCompletion(job, request);
                return;
            }

            if (!current) {
                logger.fine("Ignoring " + gatewayStatus + " from stale request " + request.getRequestId());
                return;
            }
            statusMachine.resolveTransient(gatewayStatus, request.getStatusCode())
                    .filter(status -> status != job.getStatus())
                    .ifPresent(job::setStatus);
        }
    }

    private void applyCompletion(Transferable job, GatewayRequest request) {
        CompletionOutcome outcome;
        try {
            outcome = statusMachine.classifyCompletion(request.getRequestId(), request.getStatusCode(), request.getError());
        } catch (UnhandledStatusCodeException e) {
            logger.log(Level.SEVERE, "Unable to process transfer " + job.getCorrelationTag(), e);
            throw e;
        }

        switch (outcome) {
            case SUCCEEDED:
                metrics.recordCompleted();
                dispatchCompletion(job, request.getRequestId());
                break;
            case CANCELED:
                job.setStatus(TransferStatus.CANCELED);
                metrics.recordCanceled();
                logger.info("Transfer " + job.getCorrelationTag() + " canceled");
                break;
            default:
                TransferStatus status = outcome.getTerminalStatus();
                job.setStatus(status);
                metrics.recordFailed(status);
                logger.warning("Transfer " + job.getCorrelationTag() + " ended " + status
                        + " (status code " + request.getStatusCode() + "): " + describe(request.getError()));
                break;
        }
    }

    private void dispatchCompletion(Transferable job, String requestId) {
        completingRequests.add(requestId);
        vertx.executeBlocking(() -> {
            job.onComplete();
            return null;
        }, false).onComplete(ar -> {
            if (ar.failed()) {
                logger.log(Level.WARNING, "Completion hook failed for transfer " + job.getCorrelationTag(), ar.cause());
                job.setStatus(TransferStatus.FAILED);
            }
            synchronized (lock) {
                completingRequests.remove(requestId);
            }
        });
    }

    private static boolean isCurrentRequest(Transferable job, GatewayRequest request) {
        String externalRequestId = job.getExternalRequestId();
        return externalRequestId.isEmpty() || externalRequestId.equals(request.getRequestId());
    }

    // ========== INTROSPECTION ==========

    public int getActiveRequestCount() {
        synchronized (lock) {
            return activeRequests;
        }
    }

    public int getQueuedCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    /**
     * @return a snapshot of the queue, head first
     */
    public List<Transferable> getQueuedJobs() {
        synchronized (lock) {
            return new ArrayList<>(queue);
        }
    }

    public int getMaxActiveRequests() {
        return maxActiveRequests;
    }

    // ========== HELPERS ==========

    private void updateGauges() {
        metrics.updateActiveRequests(activeRequests);
        metrics.updateQueuedJobs(queue.size());
    }

    private static URI toAbsoluteUri(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(value);
            return uri.isAbsolute() ? uri : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static boolean isRelativePath(String value) {
        if (value.isBlank()) {
            return false;
        }
        try {
            return !new URI(value).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String describe(Throwable error) {
        return error == null ? "no error" : error.getMessage();
    }

    private final class RequestListener implements GatewayRequestListener {

        @Override
        public void onProgress(GatewayRequest request, long bytesTransferred, long totalBytes) {
            repository.findByCorrelationTag(request.getTag())
                    .filter(job -> isCurrentRequest(job, request))
                    .ifPresent(job -> job.onProgress(bytesTransferred, totalBytes));
        }

        @Override
        public void onStatusChanged(GatewayRequest request) {
            processTransfer(request);
        }
    }
}

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
import dev.mars.ferry.core.TransferMethod;
import dev.mars.ferry.core.TransferPreferences;
import dev.mars.ferry.core.TransferStatus;
import dev.mars.ferry.core.Transferable;
import dev.mars.ferry.core.TransferJob;
import dev.mars.ferry.core.exceptions.RequestCanceledException;
import dev.mars.ferry.core.exceptions.SubmissionFailure;
import dev.mars.ferry.core.exceptions.TransferException;
import dev.mars.ferry.core.exceptions.UnhandledStatusCodeException;
import dev.mars.ferry.gateway.GatewayRequest;
import dev.mars.ferry.gateway.GatewayStatus;
import dev.mars.ferry.gateway.SubmitRequest;
import dev.mars.ferry.monitoring.CoordinatorTelemetryMetrics;
import dev.mars.ferry.simulator.InMemoryTransferGateway;
import dev.mars.ferry.simulator.InMemoryTransferGateway.SimulatedRequest;
import dev.mars.ferry.storage.InMemoryTransferRepository;
import dev.mars.ferry.storage.LocalTransferStorage;
import dev.mars.ferry.storage.TransferStorage;
import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for TransferCoordinator against the in-memory gateway simulator.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
@DisplayName("TransferCoordinator")
class TransferCoordinatorTest {

    @TempDir
    Path storageRoot;

    private Vertx vertx;
    private LocalTransferStorage storage;
    private InMemoryTransferRepository repository;
    private InMemoryTransferGateway gateway;
    private CoordinatorTelemetryMetrics metrics;

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
        storage = new LocalTransferStorage(storageRoot, "shared/transfers");
        repository = new InMemoryTransferRepository();
        gateway = new InMemoryTransferGateway();
        metrics = new CoordinatorTelemetryMetrics(OpenTelemetry.noop().getMeter("ferry-test"));
    }

    private TransferCoordinator start(int maxActiveRequests) {
        Properties properties = new Properties();
        properties.setProperty(FerryConfiguration.MAX_ACTIVE_REQUESTS, String.valueOf(maxActiveRequests));
        properties.setProperty(FerryConfiguration.TRANSFER_PREFERENCES, TransferPreferences.ALLOW_CELLULAR.name());
        return TransferCoordinator.start(vertx, gateway, repository, new FerryConfiguration(properties), metrics);
    }

    private TransferJob newJob(String filename) throws IOException {
        TransferJob job = new TransferJob(storage, TransferMethod.GET,
                "https://files.example.com/" + filename, "downloads", filename);
        repository.insert(job);
        repository.commit();
        return job;
    }

    private List<TransferJob> newJobs(int count) throws IOException {
        List<TransferJob> jobs = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            jobs.add(newJob("file-" + i + ".bin"));
        }
        return jobs;
    }

    private static String requestId(Transferable job) {
        return job.getExternalRequestId();
    }

    /**
     * Download job whose completion hook counts its runs and holds until released.
     */
    private static class GatedDownloadJob extends TransferJob {
        private final AtomicInteger completions = new AtomicInteger();
        private final CountDownLatch release = new CountDownLatch(1);

        GatedDownloadJob(TransferStorage storage, String filename) {
            super(storage, TransferMethod.GET, "https://files.example.com/" + filename, "downloads", filename);
        }

        @Override
        public void onComplete() {
            completions.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            super.onComplete();
        }
    }

    @Nested
    @DisplayName("Admission")
    class Admission {

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("Seven jobs under a ceiling of five: five admitted, two queued, completion admits the next")
        void testCeilingAndRefill(VertxTestContext testContext) throws IOException {
            TransferCoordinator coordinator = start(5);
            List<TransferJob> jobs = newJobs(7);

            coordinator.enqueueAll(jobs);

            assertThat(coordinator.getActiveRequestCount()).isEqualTo(5);
            assertThat(coordinator.getQueuedCount()).isEqualTo(2);
            assertThat(gateway.getRequestCount()).isEqualTo(5);
            for (int i = 0; i < 5; i++) {
                assertThat(jobs.get(i).getStatus()).isEqualTo(TransferStatus.WAITING);
                assertThat(requestId(jobs.get(i))).isNotEmpty();
            }
            assertThat(jobs.get(5).getStatus()).isEqualTo(TransferStatus.QUEUED);
            assertThat(jobs.get(6).getStatus()).isEqualTo(TransferStatus.QUEUED);
            assertThat(coordinator.getQueuedJobs()).containsExactly(jobs.get(5), jobs.get(6));

            Files.writeString(storageRoot.resolve("shared/transfers/downloads/file-1.bin"), "first");
            jobs.get(0).addStatusChangeListener(event -> {
                if (event.getCurrent().isTerminal()) {
                    testContext.verify(() -> assertThat(event.getCurrent()).isEqualTo(TransferStatus.COMPLETED));
                    testContext.completeNow();
                }
            });

            gateway.complete(requestId(jobs.get(0)), 200, null);

            assertThat(jobs.get(5).getStatus()).isEqualTo(TransferStatus.WAITING);
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(5);
            assertThat(coordinator.getQueuedJobs()).containsExactly(jobs.get(6));
            assertThat(gateway.getRequestCount()).isEqualTo(5);
        }

        @Test
        void testSubmitRequestCarriesJobRouting() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("report.pdf");

            coordinator.enqueue(job);

            SubmitRequest submitted = gateway.getSubmissions().get(0);
            assertThat(submitted.getTag()).isEqualTo(job.getCorrelationTag());
            assertThat(submitted.getMethod()).isEqualTo(TransferMethod.GET);
            assertThat(submitted.getRemoteUri().toString()).isEqualTo("https://files.example.com/report.pdf");
            assertThat(submitted.getStagingPath()).isEqualTo("/shared/transfers/downloads/report.pdf");
            assertThat(submitted.getPreferences()).isEqualTo(TransferPreferences.ALLOW_CELLULAR);
            assertThat(Files.isDirectory(storageRoot.resolve("shared/transfers/downloads"))).isTrue();
        }

        @Test
        @DisplayName("Gateway capacity rejection fails the job and keeps the counter unchanged")
        void testCapacityExceeded() throws IOException {
            gateway.setMaxRequests(2);
            TransferCoordinator coordinator = start(5);
            List<TransferJob> jobs = newJobs(3);

            coordinator.enqueueAll(jobs);

            assertThat(jobs.get(2).getStatus()).isEqualTo(TransferStatus.FAILED);
            assertThat(requestId(jobs.get(2))).isEmpty();
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(2);
            assertThat(coordinator.getQueuedCount()).isZero();
        }

        @Test
        void testRejectedSubmissionDoesNotStopTheLoop() throws IOException {
            gateway.failNextSubmission(SubmissionFailure.DUPLICATE_REQUEST);
            TransferCoordinator coordinator = start(5);
            List<TransferJob> jobs = newJobs(2);

            coordinator.enqueueAll(jobs);

            assertThat(jobs.get(0).getStatus()).isEqualTo(TransferStatus.FAILED);
            assertThat(jobs.get(1).getStatus()).isEqualTo(TransferStatus.WAITING);
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(1);
        }

        @Test
        void testPreparationFailureFailsJobWithoutSubmission() throws IOException {
            Files.createDirectories(storageRoot.resolve("shared/transfers"));
            Files.writeString(storageRoot.resolve("shared/transfers/downloads"), "not a directory");
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("blocked.bin");

            coordinator.enqueue(job);

            assertThat(job.getStatus()).isEqualTo(TransferStatus.FAILED);
            assertThat(gateway.getSubmissions()).isEmpty();
            assertThat(coordinator.getActiveRequestCount()).isZero();
        }

        @Test
        void testUploadWithoutSourceFails() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob upload = new TransferJob(storage, TransferMethod.POST,
                    "https://files.example.com/upload", "outbox", "data.bin");
            repository.insert(upload);
            repository.commit();

            coordinator.enqueue(upload);

            assertThat(upload.getStatus()).isEqualTo(TransferStatus.FAILED);
            assertThat(gateway.getSubmissions()).isEmpty();
        }

        @Test
        @DisplayName("Running the admission loop again with no free slot changes nothing")
        void testAdmissionLoopIsIdempotent() throws IOException {
            TransferCoordinator coordinator = start(2);
            coordinator.enqueueAll(newJobs(4));

            for (int i = 0; i < 10; i++) {
                coordinator.runAdmissionLoop();
            }

            assertThat(gateway.getSubmissions()).hasSize(2);
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(2);
            assertThat(coordinator.getQueuedCount()).isEqualTo(2);
        }

        @Test
        void testEnqueueFirstJumpsTheQueue() throws IOException {
            TransferCoordinator coordinator = start(1);
            List<TransferJob> jobs = newJobs(3);
            coordinator.enqueueAll(jobs);

            coordinator.enqueueFirst(jobs.get(2));

            assertThat(coordinator.getQueuedJobs()).containsExactly(jobs.get(2), jobs.get(1));
        }

        @Test
        void testEnqueueResetsProgress() throws IOException {
            TransferCoordinator coordinator = start(1);
            TransferJob job = newJob("retry.bin");
            job.setStatus(TransferStatus.FAILED);
            job.onProgress(400, 1000);

            coordinator.enqueue(newJob("blocker.bin"));
            coordinator.enqueue(job);

            assertThat(job.getStatus()).isEqualTo(TransferStatus.QUEUED);
            assertThat(job.getBytesTransferred()).isZero();
            assertThat(job.isIndeterminate()).isTrue();
        }

        @Test
        void testEnqueueValidation() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob uncommitted = new TransferJob(storage, TransferMethod.GET,
                    "https://files.example.com/x", "downloads", "x");
            TransferJob active = newJob("active.bin");
            coordinator.enqueue(active);

            assertThatThrownBy(() -> coordinator.enqueue(uncommitted)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> coordinator.enqueue(active)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> coordinator.enqueueFirst(active)).isInstanceOf(IllegalStateException.class);
            assertThat(gateway.getSubmissions()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Status reports")
    class StatusReports {

        @Test
        void testTransientStatuses() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("a.bin");
            coordinator.enqueue(job);
            String id = requestId(job);

            gateway.report(id, GatewayStatus.TRANSFERRING, 200);
            assertThat(job.getStatus()).isEqualTo(TransferStatus.TRANSFERRING);

            gateway.report(id, GatewayStatus.WAITING, 503);
            assertThat(job.getStatus()).isEqualTo(TransferStatus.WAITING_FOR_RETRY);

            gateway.report(id, GatewayStatus.WAITING, 0);
            assertThat(job.getStatus()).isEqualTo(TransferStatus.WAITING);

            gateway.report(id, GatewayStatus.PAUSED, 0);
            assertThat(job.getStatus()).isEqualTo(TransferStatus.PAUSED);

            gateway.report(id, GatewayStatus.UNKNOWN, 0);
            assertThat(job.getStatus()).isEqualTo(TransferStatus.PAUSED);
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(1);
        }

        @Test
        void testRepeatedStatusIsNotRefired() throws IOException {
            TransferJob job = newJob("a.bin");
            List<TransferStatus> seen = new ArrayList<>();
            job.addStatusChangeListener(event -> seen.add(event.getCurrent()));
            TransferCoordinator coordinator = start(5);
            coordinator.enqueue(job);

            gateway.report(requestId(job), GatewayStatus.TRANSFERRING, 200);
            gateway.report(requestId(job), GatewayStatus.TRANSFERRING, 200);

            assertThat(seen).containsExactly(TransferStatus.QUEUED, TransferStatus.WAITING, TransferStatus.TRANSFERRING);
        }

        @Test
        void testProgressIsForwarded() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("a.bin");
            coordinator.enqueue(job);
            gateway.report(requestId(job), GatewayStatus.TRANSFERRING, 200);

            gateway.progress(requestId(job), 50, 200);

            assertThat(job.getBytesTransferred()).isEqualTo(50);
            assertThat(job.getProgress()).isEqualTo(0.25);
        }

        @Test
        void testClientAndServerFailures() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob notFound = newJob("missing.bin");
            TransferJob unavailable = newJob("busy.bin");
            TransferJob reset = newJob("reset.bin");
            coordinator.enqueueAll(List.of(notFound, unavailable, reset));

            gateway.complete(requestId(notFound), 404, new TransferException("1", "Not Found"));
            gateway.complete(requestId(unavailable), 503, new TransferException("2", "Service Unavailable"));
            gateway.complete(requestId(reset), 0, new IOException("Connection reset"));

            assertThat(notFound.getStatus()).isEqualTo(TransferStatus.FAILED);
            assertThat(unavailable.getStatus()).isEqualTo(TransferStatus.FAILED_SERVER);
            assertThat(reset.getStatus()).isEqualTo(TransferStatus.FAILED);
            assertThat(coordinator.getActiveRequestCount()).isZero();
            assertThat(gateway.getRequestCount()).isZero();
        }

        @Test
        @DisplayName("A cancellation error from the gateway cancels the job and clears its progress")
        void testCancellationErrorResetsProgress() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("a.bin");
            coordinator.enqueue(job);
            String id = requestId(job);
            gateway.report(id, GatewayStatus.TRANSFERRING, 200);
            gateway.progress(id, 600, 1000);

            gateway.complete(id, 200, new RequestCanceledException(id));

            assertThat(job.getStatus()).isEqualTo(TransferStatus.CANCELED);
            assertThat(job.getBytesTransferred()).isZero();
            assertThat(job.getProgress()).isZero();
            assertThat(coordinator.getActiveRequestCount()).isZero();
        }

        @Test
        @DisplayName("Completion without error and with an unexpected code is raised to the reporter")
        void testUnhandledStatusCode() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("a.bin");
            coordinator.enqueue(job);

            assertThatThrownBy(() -> gateway.complete(requestId(job), 204, null))
                    .isInstanceOf(UnhandledStatusCodeException.class)
                    .hasMessageContaining("204");
            assertThat(coordinator.getActiveRequestCount()).isZero();
        }

        @Test
        @DisplayName("A second completion report for a finished job is ignored")
        void testDuplicateCompletionIgnored() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("a.bin");
            coordinator.enqueue(job);
            SimulatedRequest request = gateway.requestForTag(job.getCorrelationTag()).orElseThrow();
            gateway.complete(request.getRequestId(), 404, new TransferException("1", "Not Found"));

            coordinator.processTransfer(request);

            assertThat(job.getStatus()).isEqualTo(TransferStatus.FAILED);
            assertThat(coordinator.getActiveRequestCount()).isZero();
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("A repeated success report while the completion hook runs does not run it again")
        void testDuplicateSuccessRunsHookOnce(VertxTestContext testContext) throws IOException {
            TransferCoordinator coordinator = start(5);
            GatedDownloadJob job = new GatedDownloadJob(storage, "twice.bin");
            repository.insert(job);
            repository.commit();
            coordinator.enqueue(job);
            Files.writeString(storageRoot.resolve("shared/transfers/downloads/twice.bin"), "payload",
                    StandardCharsets.UTF_8);
            List<TransferStatus> seen = new ArrayList<>();
            job.addStatusChangeListener(event -> {
                synchronized (seen) {
                    seen.add(event.getCurrent());
                }
                if (event.getCurrent().isTerminal()) {
                    testContext.verify(() -> {
                        assertThat(event.getCurrent()).isEqualTo(TransferStatus.COMPLETED);
                        assertThat(job.completions.get()).isEqualTo(1);
                        assertThat(Files.exists(storageRoot.resolve("downloads/twice.bin"))).isTrue();
                    });
                    // a report arriving after the hook finished is ignored as well
                    vertx.setTimer(50, id -> {
                        testContext.verify(() -> {
                            assertThat(job.getStatus()).isEqualTo(TransferStatus.COMPLETED);
                            assertThat(job.completions.get()).isEqualTo(1);
                            synchronized (seen) {
                                assertThat(seen).doesNotContain(TransferStatus.FAILED);
                            }
                        });
                        testContext.completeNow();
                    });
                }
            });
            SimulatedRequest request = gateway.requestForTag(job.getCorrelationTag()).orElseThrow();

            gateway.complete(request.getRequestId(), 200, null);
            coordinator.processTransfer(request);
            assertThat(job.completions.get()).isLessThanOrEqualTo(1);
            job.release.countDown();
        }

        @Test
        @DisplayName("Waiting for wifi is reported as NONE, which cannot be canceled")
        void testWaitingForWifiFoldsIntoNone() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("a.bin");
            coordinator.enqueue(job);

            gateway.report(requestId(job), GatewayStatus.WAITING_FOR_WIFI, 0);
            coordinator.cancel(job);

            assertThat(job.getStatus()).isEqualTo(TransferStatus.NONE);
            assertThat(gateway.getRemoveCalls(requestId(job))).isZero();
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(1);
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("Successful completion runs the completion hook off the reporting thread")
        void testSuccessfulCompletion(VertxTestContext testContext) throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("report.pdf");
            coordinator.enqueue(job);
            Files.writeString(storageRoot.resolve("shared/transfers/downloads/report.pdf"), "payload",
                    StandardCharsets.UTF_8);
            job.addStatusChangeListener(event -> {
                if (event.getCurrent() == TransferStatus.COMPLETED) {
                    testContext.verify(() -> {
                        assertThat(Files.readString(storageRoot.resolve("downloads/report.pdf"), StandardCharsets.UTF_8))
                                .isEqualTo("payload");
                        assertThat(job.getBytesTransferred()).isEqualTo(7);
                        assertThat(job.getProgress()).isEqualTo(1.0);
                        assertThat(coordinator.getActiveRequestCount()).isZero();
                    });
                    testContext.completeNow();
                }
            });
            gateway.report(requestId(job), GatewayStatus.TRANSFERRING, 200);
            gateway.progress(requestId(job), 7, 7);

            gateway.complete(requestId(job), 200, null);
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        void testCompletionWithoutStagedFileFails(VertxTestContext testContext) throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("lost.bin");
            coordinator.enqueue(job);
            job.addStatusChangeListener(event -> {
                if (event.getCurrent().isTerminal()) {
                    testContext.verify(() -> assertThat(event.getCurrent()).isEqualTo(TransferStatus.FAILED));
                    testContext.completeNow();
                }
            });

            gateway.complete(requestId(job), 206, null);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        void testCancelQueuedJob() throws IOException {
            TransferCoordinator coordinator = start(1);
            List<TransferJob> jobs = newJobs(2);
            coordinator.enqueueAll(jobs);

            coordinator.cancel(jobs.get(1));

            assertThat(jobs.get(1).getStatus()).isEqualTo(TransferStatus.CANCELED);
            assertThat(coordinator.getQueuedCount()).isZero();
            assertThat(gateway.getSubmissions()).hasSize(1);
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Canceling an active job removes its request once and admits the next job")
        void testCancelActiveJob() throws IOException {
            TransferCoordinator coordinator = start(1);
            List<TransferJob> jobs = newJobs(2);
            coordinator.enqueueAll(jobs);
            String id = requestId(jobs.get(0));
            gateway.report(id, GatewayStatus.TRANSFERRING, 200);
            gateway.progress(id, 10, 100);

            coordinator.cancel(jobs.get(0));

            assertThat(jobs.get(0).getStatus()).isEqualTo(TransferStatus.CANCELED);
            assertThat(jobs.get(0).getBytesTransferred()).isZero();
            assertThat(gateway.getRemoveCalls(id)).isEqualTo(1);
            assertThat(jobs.get(1).getStatus()).isEqualTo(TransferStatus.WAITING);
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(1);
            assertThat(gateway.getRequestCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Canceling an active job the gateway no longer holds cancels it directly")
        void testCancelJobWithoutGatewayRequest() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("a.bin");
            job.setStatus(TransferStatus.TRANSFERRING);
            job.setExternalRequestId("req-unknown-to-gateway");

            coordinator.cancel(job);

            assertThat(job.getStatus()).isEqualTo(TransferStatus.CANCELED);
            assertThat(requestId(job)).isEmpty();
            assertThat(gateway.getRemoveCalls("req-unknown-to-gateway")).isZero();
            assertThat(coordinator.getActiveRequestCount()).isZero();
        }

        @Test
        void testCancelTerminalJobIsNoOp() throws IOException {
            TransferCoordinator coordinator = start(5);
            TransferJob job = newJob("a.bin");
            coordinator.enqueue(job);
            gateway.complete(requestId(job), 404, new TransferException("1", "Not Found"));

            coordinator.cancel(job);

            assertThat(job.getStatus()).isEqualTo(TransferStatus.FAILED);
            assertThat(gateway.getRemoveCalls(requestId(job))).isEqualTo(1);
        }

        @Test
        void testCancelAll() throws IOException {
            TransferCoordinator coordinator = start(2);
            List<TransferJob> jobs = newJobs(4);
            coordinator.enqueueAll(jobs);
            gateway.preload("orphan", GatewayStatus.WAITING, 0, null);

            coordinator.cancelAll();

            assertThat(jobs).allSatisfy(job -> assertThat(job.getStatus()).isEqualTo(TransferStatus.CANCELED));
            assertThat(gateway.getRequestCount()).isZero();
            assertThat(coordinator.getQueuedCount()).isZero();
            assertThat(coordinator.getActiveRequestCount()).isZero();
        }

        @Test
        void testRemovingUnknownRequestReleasesNothing() throws IOException {
            TransferCoordinator coordinator = start(5);
            coordinator.enqueue(newJob("a.bin"));

            assertThat(coordinator.removeExternalRequest("req-unknown")).isFalse();
            assertThat(coordinator.removeExternalRequest("")).isFalse();
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Startup reconciliation")
    class StartupReconciliation {

        @Test
        @DisplayName("Known requests are reattached, orphans removed, queued jobs admitted")
        void testReconcile() throws IOException {
            TransferJob running = newJob("running.bin");
            running.setStatus(TransferStatus.WAITING);
            SimulatedRequest runningRequest = gateway.preload(running.getCorrelationTag(),
                    GatewayStatus.TRANSFERRING, 200, null);
            running.setExternalRequestId(runningRequest.getRequestId());

            TransferJob finishedWhileDown = newJob("gone.bin");
            finishedWhileDown.setStatus(TransferStatus.TRANSFERRING);
            SimulatedRequest finishedRequest = gateway.preload(finishedWhileDown.getCorrelationTag(),
                    GatewayStatus.COMPLETED, 404, new TransferException("2", "Not Found"));
            finishedWhileDown.setExternalRequestId(finishedRequest.getRequestId());

            SimulatedRequest unknownId = gateway.preload("999", GatewayStatus.WAITING, 0, null);
            SimulatedRequest notAnId = gateway.preload("legacy-tag", GatewayStatus.WAITING, 0, null);

            TransferJob queued = newJob("queued.bin");
            queued.setStatus(TransferStatus.QUEUED);

            TransferCoordinator coordinator = start(2);

            assertThat(running.getStatus()).isEqualTo(TransferStatus.TRANSFERRING);
            assertThat(runningRequest.getListenerCount()).isEqualTo(1);
            assertThat(finishedWhileDown.getStatus()).isEqualTo(TransferStatus.FAILED);
            assertThat(gateway.getRemoveCalls(unknownId.getRequestId())).isEqualTo(1);
            assertThat(gateway.getRemoveCalls(notAnId.getRequestId())).isEqualTo(1);
            assertThat(queued.getStatus()).isEqualTo(TransferStatus.WAITING);
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(2);
            assertThat(gateway.getRequestCount()).isEqualTo(2);
        }

        @Test
        void testStartWithMoreRequestsThanTheCeiling() throws IOException {
            List<TransferJob> jobs = newJobs(3);
            for (TransferJob job : jobs) {
                job.setStatus(TransferStatus.WAITING);
                job.setExternalRequestId(gateway.preload(job.getCorrelationTag(), GatewayStatus.WAITING, 0, null)
                        .getRequestId());
            }
            TransferJob queued = newJob("queued.bin");
            queued.setStatus(TransferStatus.QUEUED);

            TransferCoordinator coordinator = start(2);

            assertThat(coordinator.getActiveRequestCount()).isEqualTo(3);
            assertThat(queued.getStatus()).isEqualTo(TransferStatus.QUEUED);

            gateway.complete(requestId(jobs.get(0)), 404, new TransferException("1", "Not Found"));
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(2);
            assertThat(queued.getStatus()).isEqualTo(TransferStatus.QUEUED);

            gateway.complete(requestId(jobs.get(1)), 404, new TransferException("2", "Not Found"));
            assertThat(queued.getStatus()).isEqualTo(TransferStatus.WAITING);
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("An active job whose request did not survive a restart is failed and can be enqueued again")
        void testJobWithLostRequestIsFailed() throws IOException {
            TransferJob lost = newJob("lost.bin");
            lost.setStatus(TransferStatus.TRANSFERRING);
            lost.setExternalRequestId("req-lost-across-restart");

            TransferCoordinator coordinator = start(5);

            assertThat(lost.getStatus()).isEqualTo(TransferStatus.FAILED);
            assertThat(requestId(lost)).isEmpty();
            assertThat(coordinator.getActiveRequestCount()).isZero();
            assertThat(coordinator.getQueuedCount()).isZero();

            coordinator.enqueue(lost);

            assertThat(lost.getStatus()).isEqualTo(TransferStatus.WAITING);
            assertThat(requestId(lost)).isNotEmpty();
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("A stale request only releases its slot")
        void testStaleRequest() throws IOException {
            TransferJob job = newJob("a.bin");
            job.setStatus(TransferStatus.QUEUED);
            job.setExternalRequestId("req-from-earlier-attempt");
            SimulatedRequest stale = gateway.preload(job.getCorrelationTag(), GatewayStatus.TRANSFERRING, 200, null);

            TransferCoordinator coordinator = start(5);

            assertThat(job.getStatus()).isEqualTo(TransferStatus.WAITING);
            assertThat(requestId(job)).isNotEqualTo(stale.getRequestId());
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(2);

            gateway.complete(stale.getRequestId(), 404, new TransferException("1", "Not Found"));

            assertThat(job.getStatus()).isEqualTo(TransferStatus.WAITING);
            assertThat(coordinator.getActiveRequestCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @Timeout(value = 30, unit = TimeUnit.SECONDS)
        @DisplayName("Concurrent completions never push the gateway past the ceiling")
        void testSlotInvariantUnderConcurrentReports() throws Exception {
            TransferCoordinator coordinator = start(3);
            List<TransferJob> jobs = newJobs(50);
            coordinator.enqueueAll(jobs);

            ExecutorService reporters = Executors.newFixedThreadPool(4);
            try {
                for (int t = 0; t < 4; t++) {
                    reporters.submit(() -> {
                        while (!jobs.stream().allMatch(job -> job.getStatus().isTerminal())) {
                            for (GatewayRequest request : gateway.listActiveRequests()) {
                                try {
                                    gateway.complete(request.getRequestId(), 404,
                                            new TransferException(request.getTag(), "Not Found"));
                                } catch (IllegalArgumentException e) {
                                    // completed by another reporter
                                }
                            }
                            Thread.onSpinWait();
                        }
                        return null;
                    });
                }
                reporters.shutdown();
                assertThat(reporters.awaitTermination(20, TimeUnit.SECONDS)).isTrue();
            } finally {
                reporters.shutdownNow();
            }

            assertThat(jobs).allSatisfy(job -> assertThat(job.getStatus()).isEqualTo(TransferStatus.FAILED));
            assertThat(gateway.getHighWaterMark()).isLessThanOrEqualTo(3);
            assertThat(gateway.getSubmissions()).hasSize(50);
            assertThat(coordinator.getActiveRequestCount()).isZero();
            assertThat(coordinator.getQueuedCount()).isZero();
        }
    }
}

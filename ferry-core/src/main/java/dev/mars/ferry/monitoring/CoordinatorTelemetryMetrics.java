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

package dev.mars.ferry.monitoring;

import dev.mars.ferry.config.FerryConfiguration;
import dev.mars.ferry.core.TransferStatus;
import dev.mars.ferry.core.exceptions.SubmissionFailure;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the transfer coordinator.
 *
 * Provides:
 * - ferry.coordinator.admitted (counter) - Jobs handed to the gateway
 * - ferry.coordinator.admission.failed (counter) - Jobs demoted to FAILED at admission, by reason
 * - ferry.coordinator.completed (counter) - Jobs whose gateway exchange succeeded
 * - ferry.coordinator.failed (counter) - Jobs classified FAILED or FAILED_SERVER, by status
 * - ferry.coordinator.canceled (counter) - Jobs canceled, queued or admitted
 * - ferry.coordinator.orphans.removed (counter) - Gateway requests removed for lack of a job
 * - ferry.coordinator.active (gauge) - Gateway slots in use
 * - ferry.coordinator.queued (gauge) - Jobs waiting in the internal queue
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0 (OpenTelemetry)
 */
public class CoordinatorTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(CoordinatorTelemetryMetrics.class);
    private static final String METER_NAME = "ferry-core";

    // Counters
    private final LongCounter admitted;
    private final LongCounter admissionFailed;
    private final LongCounter completed;
    private final LongCounter failed;
    private final LongCounter canceled;
    private final LongCounter orphansRemoved;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeRequests = new AtomicLong(0);
    private final AtomicLong queuedJobs = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> REASON_KEY = AttributeKey.stringKey("reason");
    private static final AttributeKey<String> STATUS_KEY = AttributeKey.stringKey("status");

    public CoordinatorTelemetryMetrics(Meter meter) {
        admitted = meter.counterBuilder("ferry.coordinator.admitted")
                .setDescription("Number of jobs submitted to the transfer gateway")
                .setUnit("1")
                .build();

        admissionFailed = meter.counterBuilder("ferry.coordinator.admission.failed")
                .setDescription("Number of jobs that could not be admitted")
                .setUnit("1")
                .build();

        completed = meter.counterBuilder("ferry.coordinator.completed")
                .setDescription("Number of transfers reported successful by the gateway")
                .setUnit("1")
                .build();

        failed = meter.counterBuilder("ferry.coordinator.failed")
                .setDescription("Number of transfers that ended in a failure status")
                .setUnit("1")
                .build();

        canceled = meter.counterBuilder("ferry.coordinator.canceled")
                .setDescription("Number of canceled transfers")
                .setUnit("1")
                .build();

        orphansRemoved = meter.counterBuilder("ferry.coordinator.orphans.removed")
                .setDescription("Number of gateway requests removed because no job matched them")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("ferry.coordinator.active")
                .setDescription("Number of gateway slots in use")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeRequests.get()));

        meter.gaugeBuilder("ferry.coordinator.queued")
                .setDescription("Number of jobs waiting in the coordinator queue")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(queuedJobs.get()));

        logger.info("CoordinatorTelemetryMetrics initialized");
    }

    /**
     * Creates metrics on the global OpenTelemetry instance, or on a no-op meter when metrics
     * are disabled in the configuration.
     */
    public static CoordinatorTelemetryMetrics create(FerryConfiguration configuration) {
        Meter meter = configuration.isMetricsEnabled()
                ? GlobalOpenTelemetry.getMeter(METER_NAME)
                : OpenTelemetry.noop().getMeter(METER_NAME);
        return new CoordinatorTelemetryMetrics(meter);
    }

    public void recordAdmitted() {
        admitted.add(1);
    }

    public void recordAdmissionFailed(String reason) {
        admissionFailed.add(1, Attributes.of(REASON_KEY, reason != null ? reason : "unknown"));
    }

    public void recordAdmissionFailed(SubmissionFailure failure) {
        recordAdmissionFailed(failure.name());
    }

    public void recordCompleted() {
        completed.add(1);
    }

    public void recordFailed(TransferStatus status) {
        failed.add(1, Attributes.of(STATUS_KEY, status.name()));
    }

    public void recordCanceled() {
        canceled.add(1);
    }

    public void recordOrphanRemoved() {
        orphansRemoved.add(1);
    }

    public void updateActiveRequests(long count) {
        activeRequests.set(count);
    }

    public void updateQueuedJobs(long count) {
        queuedJobs.set(count);
    }
}

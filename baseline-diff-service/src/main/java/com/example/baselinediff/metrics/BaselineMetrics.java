package com.example.baselinediff.metrics;

import com.example.baselinediff.entity.ScanJob;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - scan_jobs_total: scan jobs by final status
 * - scan_duration_seconds / classify_duration_seconds
 * - commits_ingested_total, malformed_records_skipped_total
 * - project_read_failures_total: projects whose log could not be read or stored
 * - lock_contention_total: runs refused because another instance holds the lock
 * - scan_tasks_rejected_total: log reads rejected by a full executor queue
 *
 * Access metrics: http://localhost:8090/actuator/prometheus
 */
@Component
@Slf4j
public class BaselineMetrics {

    private final MeterRegistry meterRegistry;

    private final Map<ScanJob.JobStatus, Counter> scanJobCounters = new EnumMap<>(ScanJob.JobStatus.class);
    private final Counter commitsIngestedCounter;
    private final Counter malformedSkippedCounter;
    private final Counter projectReadFailureCounter;
    private final Counter scanTasksRejectedCounter;
    private final Timer scanTimer;
    private final Timer classifyTimer;

    public BaselineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        for (ScanJob.JobStatus status : ScanJob.JobStatus.values()) {
            scanJobCounters.put(status, Counter.builder("scan_jobs_total")
                    .description("Scan jobs by status")
                    .tag("status", status.name().toLowerCase())
                    .register(meterRegistry));
        }

        this.commitsIngestedCounter = Counter.builder("commits_ingested_total")
                .description("Commits newly inserted into the store")
                .register(meterRegistry);

        this.malformedSkippedCounter = Counter.builder("malformed_records_skipped_total")
                .description("Input records skipped because a required field was missing or invalid")
                .register(meterRegistry);

        this.projectReadFailureCounter = Counter.builder("project_read_failures_total")
                .description("Projects whose commit log could not be read or stored")
                .register(meterRegistry);

        this.scanTasksRejectedCounter = Counter.builder("scan_tasks_rejected_total")
                .description("Log read tasks rejected because the executor queue was full")
                .register(meterRegistry);

        this.scanTimer = Timer.builder("scan_duration_seconds")
                .description("Duration of full scans")
                .register(meterRegistry);

        this.classifyTimer = Timer.builder("classify_duration_seconds")
                .description("Duration of classification runs")
                .register(meterRegistry);
    }

    public void recordScanFinished(ScanJob.JobStatus status, long durationMs) {
        scanJobCounters.get(status).increment();
        scanTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordClassification(long durationMs) {
        classifyTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordIngest(int inserted, int skippedMalformed) {
        commitsIngestedCounter.increment(inserted);
        if (skippedMalformed > 0) {
            malformedSkippedCounter.increment(skippedMalformed);
        }
    }

    public void recordProjectReadFailure() {
        projectReadFailureCounter.increment();
    }

    public void recordTaskRejection() {
        scanTasksRejectedCounter.increment();
        log.error("Log read task rejected - scanTaskExecutor queue full");
    }

    /**
     * Tagged by lock name; registered lazily since lock names are few and fixed.
     */
    public void recordLockContention(String lockName) {
        Counter.builder("lock_contention_total")
                .description("Runs refused because the named lock was held elsewhere")
                .tag("lock", lockName)
                .register(meterRegistry)
                .increment();
    }
}

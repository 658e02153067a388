package com.example.baselinediff.service;

import com.example.baselinediff.client.git.RawCommit;
import com.example.baselinediff.client.manifest.ManifestProject;
import com.example.baselinediff.client.manifest.ManifestReader;
import com.example.baselinediff.config.BaselineProperties;
import com.example.baselinediff.dto.response.ClassificationSummary;
import com.example.baselinediff.dto.response.IngestResult;
import com.example.baselinediff.entity.ScanJob;
import com.example.baselinediff.exception.BaseException;
import com.example.baselinediff.exception.ConflictException;
import com.example.baselinediff.metrics.BaselineMetrics;
import com.example.baselinediff.service.progress.ProgressEvent;
import com.example.baselinediff.service.progress.ProgressListener;
import com.example.baselinediff.service.progress.ScanStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a full scan: clear the store, read both manifests, read every project
 * log in parallel, ingest, classify.
 *
 * CRITICAL DESIGN:
 * - Filesystem and git reads happen OUTSIDE transactions
 * - Database writes go through short transactions (ScanDataService, CommitIngestService)
 * - A project whose log cannot be read or stored is recorded and skipped; the
 *   scan finishes as PARTIAL_FAILURE
 * - Classification starts only after every project has been ingested
 * - Holds the {@value #LOCK_NAME} lock for the whole run
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScanOrchestrator {

    public static final String LOCK_NAME = "scanTrees";

    private final ManifestReader manifestReader;
    private final ProjectLogCollector projectLogCollector;
    private final CommitIngestService commitIngestService;
    private final DiffClassifier diffClassifier;
    private final ScanDataService scanDataService;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final BaselineProperties properties;
    private final BaselineMetrics metrics;

    @Async("scanJobExecutor")
    public CompletableFuture<ScanJob> runScanAsync(Long scanJobId, Path upstreamRoot, Path vendorRoot,
                                                   ProgressListener listener) {
        return CompletableFuture.completedFuture(runScan(scanJobId, upstreamRoot, vendorRoot, listener));
    }

    /**
     * Runs the scan on the calling thread and returns the finished job.
     * Never throws for scan failures; they are recorded on the job.
     */
    public ScanJob runScan(Long scanJobId, Path upstreamRoot, Path vendorRoot, ProgressListener listener) {
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;
        long startTime = System.currentTimeMillis();
        ScanJob job = scanDataService.getScanJob(scanJobId);
        String previousCorrelationId = MDC.get("correlationId");
        MDC.put("correlationId", job.getCorrelationId());

        try {
            LockConfiguration lock = new LockConfiguration(
                    Instant.now(), LOCK_NAME, properties.getScan().getLockAtMostFor(), Duration.ZERO);
            LockingTaskExecutor.TaskResult<ScanJob> result = lockingTaskExecutor.executeWithLock(
                    () -> scanUnderLock(scanJobId, upstreamRoot, vendorRoot, progress), lock);

            if (!result.wasExecuted()) {
                metrics.recordLockContention(LOCK_NAME);
                throw ConflictException.scanInProgress();
            }

            ScanJob finished = result.getResult();
            progress.onProgress(ProgressEvent.of(ScanStage.COMPLETED, 1, 1, "Scan " + finished.getStatus()));
            metrics.recordScanFinished(finished.getStatus(), System.currentTimeMillis() - startTime);
            return finished;
        } catch (Throwable t) {
            String message = t instanceof BaseException base
                    ? base.getCode() + ": " + base.getMessage()
                    : t.getClass().getSimpleName() + ": " + t.getMessage();
            log.error("Scan job id={} failed: {}", scanJobId, message, t);
            progress.onProgress(ProgressEvent.of(ScanStage.FAILED, 0, 0, message));
            metrics.recordScanFinished(ScanJob.JobStatus.FAILED, System.currentTimeMillis() - startTime);
            return scanDataService.failScanJob(scanJobId, message);
        } finally {
            if (previousCorrelationId != null) {
                MDC.put("correlationId", previousCorrelationId);
            } else {
                MDC.remove("correlationId");
            }
        }
    }

    private ScanJob scanUnderLock(Long scanJobId, Path upstreamRoot, Path vendorRoot,
                                  ProgressListener progress) throws Exception {
        log.info("Starting scan job id={}: upstream={}, vendor={}", scanJobId, upstreamRoot, vendorRoot);

        progress.onProgress(ProgressEvent.of(ScanStage.CLEARING, 0, 1, "Clearing previous scan data"));
        scanDataService.clearAll();

        progress.onProgress(ProgressEvent.of(ScanStage.MANIFEST, 0, 2, "Reading upstream manifest"));
        List<ManifestProject> upstreamProjects = manifestReader.read(upstreamRoot);
        progress.onProgress(ProgressEvent.of(ScanStage.MANIFEST, 1, 2, "Reading vendor manifest"));
        List<ManifestProject> vendorProjects = manifestReader.read(vendorRoot);
        progress.onProgress(ProgressEvent.of(ScanStage.MANIFEST, 2, 2,
                upstreamProjects.size() + " upstream and " + vendorProjects.size() + " vendor projects"));

        List<ManifestProject> allProjects = new ArrayList<>(upstreamProjects);
        allProjects.addAll(vendorProjects);
        scanDataService.saveProjects(allProjects);
        scanDataService.recordProjectCounts(scanJobId, upstreamProjects.size(), vendorProjects.size());

        ScanTotals totals = readAndIngest(allProjects, progress);

        ClassificationSummary summary = diffClassifier.classify(
                names(upstreamProjects), names(vendorProjects), progress);

        return scanDataService.completeScanJob(scanJobId, totals, summary);
    }

    /**
     * Reads project logs in parallel and ingests them one project at a time in
     * manifest order. At most {@code reads-in-flight} logs are read or held in
     * memory at once; a project's commits are released once ingested.
     * Failures stay confined to their project.
     */
    private ScanTotals readAndIngest(List<ManifestProject> projects, ProgressListener progress) {
        int maxCommits = properties.getScan().getMaxCommitsPerProject();
        int window = Math.max(1, properties.getScan().getReadsInFlight());
        Iterator<ManifestProject> pending = projects.iterator();
        Deque<Map.Entry<ManifestProject, CompletableFuture<List<RawCommit>>>> inFlight = new ArrayDeque<>();
        ScanTotals totals = new ScanTotals();

        int done = 0;
        int total = projects.size();
        while (pending.hasNext() || !inFlight.isEmpty()) {
            while (inFlight.size() < window && pending.hasNext()) {
                ManifestProject project = pending.next();
                try {
                    inFlight.addLast(Map.entry(project, projectLogCollector.collect(project, maxCommits)));
                } catch (RejectedExecutionException e) {
                    log.error("Log read for project {} rejected - executor queue full", project.getName());
                    metrics.recordTaskRejection();
                    metrics.recordProjectReadFailure();
                    totals.fail(project.getName());
                    done++;
                }
            }
            if (inFlight.isEmpty()) {
                continue;
            }

            Map.Entry<ManifestProject, CompletableFuture<List<RawCommit>>> entry = inFlight.removeFirst();
            String name = entry.getKey().getName();
            try {
                List<RawCommit> commits = entry.getValue().join();
                IngestResult result = commitIngestService.ingestProject(name, commits);
                totals.add(commits.size(), result.getInserted(), result.getSkippedMalformed());
            } catch (CompletionException | BaseException e) {
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                log.warn("Project {} skipped: {}", name, cause.getMessage());
                metrics.recordProjectReadFailure();
                totals.fail(name);
            }
            done++;
            progress.onProgress(ProgressEvent.builder()
                    .stage(ScanStage.LOG_READ)
                    .current(done)
                    .total(total)
                    .item(name)
                    .message("Read " + done + "/" + total + " projects")
                    .build());
        }

        log.info("Read {} projects: fetched={}, saved={}, malformed={}, failed={}",
                total, totals.getFetched(), totals.getSaved(), totals.getMalformed(), totals.getFailedProjects().size());
        return totals;
    }

    private static Set<String> names(List<ManifestProject> projects) {
        Set<String> names = new LinkedHashSet<>();
        projects.forEach(project -> names.add(project.getName()));
        return names;
    }
}

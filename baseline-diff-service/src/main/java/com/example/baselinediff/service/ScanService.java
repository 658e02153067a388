package com.example.baselinediff.service;

import com.example.baselinediff.dto.request.ScanRequest;
import com.example.baselinediff.dto.response.ScanJobResponse;
import com.example.baselinediff.entity.ScanJob;
import com.example.baselinediff.exception.ResourceNotFoundException;
import com.example.baselinediff.metrics.BaselineMetrics;
import com.example.baselinediff.service.progress.ProgressEvent;
import com.example.baselinediff.service.progress.ProgressListener;
import com.example.baselinediff.service.progress.ScanProgressRegistry;
import com.example.baselinediff.service.progress.ScanStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for scan requests: validates the tree roots, records the job
 * and hands it to the {@link ScanOrchestrator}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScanService {

    private final ScanOrchestrator scanOrchestrator;
    private final ScanDataService scanDataService;
    private final ScanProgressRegistry progressRegistry;
    private final BaselineMetrics metrics;

    /**
     * Starts a scan in the background and returns the RUNNING job.
     *
     * @throws ResourceNotFoundException when a root is not an existing directory
     */
    public ScanJobResponse startScan(ScanRequest request) {
        Path upstreamRoot = resolveRoot(request.getUpstreamRoot());
        Path vendorRoot = resolveRoot(request.getVendorRoot());

        ScanJob job = scanDataService.createScanJob(
                upstreamRoot.toString(), vendorRoot.toString(), newCorrelationId());
        ProgressListener listener = progressRegistry.listenerFor(job.getId());

        try {
            scanOrchestrator.runScanAsync(job.getId(), upstreamRoot, vendorRoot, listener);
        } catch (RejectedExecutionException e) {
            log.error("Scan job id={} rejected - scanJobExecutor queue full", job.getId());
            listener.onProgress(ProgressEvent.of(ScanStage.FAILED, 0, 0, "Scan queue full"));
            metrics.recordScanFinished(ScanJob.JobStatus.FAILED, 0);
            job = scanDataService.failScanJob(job.getId(), "Scan queue full, retry later");
        }
        return toResponse(job);
    }

    /**
     * Runs a scan on the calling thread. Used by the scheduled rescan.
     */
    public ScanJobResponse runScanNow(ScanRequest request) {
        Path upstreamRoot = resolveRoot(request.getUpstreamRoot());
        Path vendorRoot = resolveRoot(request.getVendorRoot());

        ScanJob job = scanDataService.createScanJob(
                upstreamRoot.toString(), vendorRoot.toString(), newCorrelationId());
        ScanJob finished = scanOrchestrator.runScan(
                job.getId(), upstreamRoot, vendorRoot, progressRegistry.listenerFor(job.getId()));
        return toResponse(finished);
    }

    public ScanJobResponse getScan(Long scanJobId) {
        return toResponse(scanDataService.getScanJob(scanJobId));
    }

    private Path resolveRoot(String root) {
        Path path;
        try {
            path = Paths.get(root).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw ResourceNotFoundException.rootNotFound(root);
        }
        if (!Files.isDirectory(path)) {
            throw ResourceNotFoundException.rootNotFound(root);
        }
        return path;
    }

    private static String newCorrelationId() {
        return "SCAN-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private ScanJobResponse toResponse(ScanJob job) {
        List<String> failed = job.getFailedProjects() == null || job.getFailedProjects().isEmpty()
                ? List.of()
                : Arrays.asList(job.getFailedProjects().split(","));
        return ScanJobResponse.builder()
                .id(job.getId())
                .status(job.getStatus().name())
                .upstreamRoot(job.getUpstreamRoot())
                .vendorRoot(job.getVendorRoot())
                .upstreamProjects(job.getUpstreamProjects())
                .vendorProjects(job.getVendorProjects())
                .commitsFetched(job.getCommitsFetched())
                .commitsSaved(job.getCommitsSaved())
                .malformedSkipped(job.getMalformedSkipped())
                .failedProjects(failed)
                .sharedCount(job.getSharedCount())
                .upstreamOnlyCount(job.getUpstreamOnlyCount())
                .vendorOnlyCount(job.getVendorOnlyCount())
                .errorMessage(job.getErrorMessage())
                .correlationId(job.getCorrelationId())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .durationMs(job.getDurationMs())
                .progress(progressRegistry.snapshot(job.getId()).orElse(null))
                .build();
    }
}

package com.example.baselinediff.service;

import com.example.baselinediff.client.manifest.ManifestProject;
import com.example.baselinediff.dto.response.ClassificationSummary;
import com.example.baselinediff.entity.ProjectRecord;
import com.example.baselinediff.entity.ScanJob;
import com.example.baselinediff.exception.ResourceNotFoundException;
import com.example.baselinediff.repository.CommitLabelLinkRepository;
import com.example.baselinediff.repository.CommitRecordRepository;
import com.example.baselinediff.repository.ProjectRecordRepository;
import com.example.baselinediff.repository.ScanJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Short transactional steps of a scan. No filesystem or git access happens
 * inside these methods.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScanDataService {

    private final ScanJobRepository scanJobRepository;
    private final CommitRecordRepository commitRecordRepository;
    private final ProjectRecordRepository projectRecordRepository;
    private final CommitLabelLinkRepository commitLabelLinkRepository;

    @Transactional
    public ScanJob createScanJob(String upstreamRoot, String vendorRoot, String correlationId) {
        ScanJob job = ScanJob.builder()
                .upstreamRoot(upstreamRoot)
                .vendorRoot(vendorRoot)
                .status(ScanJob.JobStatus.RUNNING)
                .build();
        job.markAsStarted(correlationId);

        ScanJob saved = scanJobRepository.save(job);
        log.debug("Created scan job id={}", saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public ScanJob getScanJob(Long scanJobId) {
        return scanJobRepository.findById(scanJobId)
                .orElseThrow(() -> ResourceNotFoundException.scanJobNotFound(scanJobId));
    }

    /**
     * Deletes every commit, project and label link. Labels themselves survive.
     */
    @Transactional
    public void clearAll() {
        int links = commitLabelLinkRepository.deleteAllLinks();
        int commits = commitRecordRepository.deleteAllCommits();
        int projects = projectRecordRepository.deleteAllProjects();
        log.info("Cleared store: commits={}, projects={}, labelLinks={}", commits, projects, links);
    }

    public int saveProjects(List<ManifestProject> projects) {
        List<ProjectRecord> records = projects.stream()
                .map(project -> ProjectRecord.builder()
                        .project(project.getName())
                        .remoteUrl(project.getRemoteUrl())
                        .path(project.getDirectory().toString())
                        .build())
                .toList();
        return projectRecordRepository.upsertAll(records);
    }

    @Transactional
    public void recordProjectCounts(Long scanJobId, int upstreamProjects, int vendorProjects) {
        ScanJob job = getScanJob(scanJobId);
        job.recordProjectCounts(upstreamProjects, vendorProjects);
        scanJobRepository.save(job);
    }

    @Transactional
    public ScanJob completeScanJob(Long scanJobId, ScanTotals totals, ClassificationSummary summary) {
        ScanJob job = getScanJob(scanJobId);
        job.recordIngest(totals.getFetched(), totals.getSaved(), totals.getMalformed());
        job.recordSummary(summary.getShared(), summary.getAOnly(), summary.getBOnly());

        if (totals.getFailedProjects().isEmpty()) {
            job.markAsCompleted();
            log.info("Scan job id={} completed: fetched={}, saved={}, duration={}ms",
                    scanJobId, totals.getFetched(), totals.getSaved(), job.getDurationMs());
        } else {
            job.markAsPartialFailure(String.join(",", totals.getFailedProjects()),
                    totals.getFailedProjects().size() + " project(s) could not be read or stored");
            log.warn("Scan job id={} partial failure: failedProjects={}", scanJobId, totals.getFailedProjects());
        }
        return scanJobRepository.save(job);
    }

    @Transactional
    public ScanJob failScanJob(Long scanJobId, String errorMessage) {
        ScanJob job = getScanJob(scanJobId);
        job.markAsFailed(errorMessage);
        log.error("Scan job id={} failed: {}", scanJobId, errorMessage);
        return scanJobRepository.save(job);
    }
}

package com.example.baselinediff.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * One scan request: clear, read both manifests, read every project log, ingest, classify.
 */
@Entity
@Table(name = "scan_jobs", indexes = {
        @Index(name = "idx_scan_jobs_status", columnList = "status"),
        @Index(name = "idx_scan_jobs_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScanJob extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "upstream_root", nullable = false, columnDefinition = "TEXT")
    private String upstreamRoot;

    @Column(name = "vendor_root", nullable = false, columnDefinition = "TEXT")
    private String vendorRoot;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "upstream_projects")
    private Integer upstreamProjects;

    @Column(name = "vendor_projects")
    private Integer vendorProjects;

    @Column(name = "commits_fetched")
    private Integer commitsFetched;

    @Column(name = "commits_saved")
    private Integer commitsSaved;

    @Column(name = "malformed_skipped")
    private Integer malformedSkipped;

    /**
     * Comma-separated names of projects whose log could not be read or stored.
     */
    @Column(name = "failed_projects", columnDefinition = "TEXT")
    private String failedProjects;

    @Column(name = "shared_count")
    private Integer sharedCount;

    @Column(name = "upstream_only_count")
    private Integer upstreamOnlyCount;

    @Column(name = "vendor_only_count")
    private Integer vendorOnlyCount;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    public Long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }

    public void markAsStarted(String correlationId) {
        this.status = JobStatus.RUNNING;
        this.startedAt = LocalDateTime.now();
        this.correlationId = correlationId;
    }

    public void recordProjectCounts(int upstreamProjects, int vendorProjects) {
        this.upstreamProjects = upstreamProjects;
        this.vendorProjects = vendorProjects;
    }

    public void recordIngest(int commitsFetched, int commitsSaved, int malformedSkipped) {
        this.commitsFetched = commitsFetched;
        this.commitsSaved = commitsSaved;
        this.malformedSkipped = malformedSkipped;
    }

    public void recordSummary(int shared, int upstreamOnly, int vendorOnly) {
        this.sharedCount = shared;
        this.upstreamOnlyCount = upstreamOnly;
        this.vendorOnlyCount = vendorOnly;
    }

    public void markAsCompleted() {
        this.status = JobStatus.COMPLETED;
        this.completedAt = LocalDateTime.now();
    }

    /**
     * Scan finished but some projects could not be read or stored.
     */
    public void markAsPartialFailure(String failedProjects, String errorMessage) {
        this.status = JobStatus.PARTIAL_FAILURE;
        this.completedAt = LocalDateTime.now();
        this.failedProjects = failedProjects;
        this.errorMessage = errorMessage;
    }

    public void markAsFailed(String errorMessage) {
        this.status = JobStatus.FAILED;
        this.completedAt = LocalDateTime.now();
        this.errorMessage = errorMessage;
    }

    public boolean isFinished() {
        return status != null && status != JobStatus.RUNNING;
    }

    public enum JobStatus {
        RUNNING,
        COMPLETED,
        PARTIAL_FAILURE,
        FAILED
    }
}

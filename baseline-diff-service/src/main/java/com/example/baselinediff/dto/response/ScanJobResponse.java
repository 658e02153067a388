package com.example.baselinediff.dto.response;

import com.example.baselinediff.service.progress.ProgressSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanJobResponse {

    private Long id;
    private String status;
    private String upstreamRoot;
    private String vendorRoot;
    private Integer upstreamProjects;
    private Integer vendorProjects;
    private Integer commitsFetched;
    private Integer commitsSaved;
    private Integer malformedSkipped;
    private List<String> failedProjects;
    private Integer sharedCount;
    private Integer upstreamOnlyCount;
    private Integer vendorOnlyCount;
    private String errorMessage;
    private String correlationId;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Long durationMs;
    private ProgressSnapshot progress;
}

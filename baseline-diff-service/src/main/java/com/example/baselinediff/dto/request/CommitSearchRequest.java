package com.example.baselinediff.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;

/**
 * Query parameters of {@code GET /api/commits}. Absent fields impose no constraint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitSearchRequest {

    private String classification;
    private String project;
    private String author;
    private String search;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate dateFrom;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate dateTo;

    private Long labelId;
    private Integer limit;
    private Integer offset;
    private boolean unbounded;
}

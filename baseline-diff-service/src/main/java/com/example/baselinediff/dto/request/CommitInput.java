package com.example.baselinediff.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One commit in a bulk ingest request. Field checks happen during ingest so a
 * bad record is skipped rather than failing the whole request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitInput {

    private String project;
    private String hash;
    private String changeId;
    private String author;

    /**
     * ISO-8601 date-time; normalized to a UTC instant on ingest.
     */
    private String date;

    private String subject;
    private String message;
    private String reviewUrl;
}

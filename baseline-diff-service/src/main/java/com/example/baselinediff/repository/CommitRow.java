package com.example.baselinediff.repository;

import com.example.baselinediff.entity.Classification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Flat read model for a commit joined with its project's remote URL.
 */
@Getter
@Builder
@AllArgsConstructor
public class CommitRow {

    private final String project;
    private final String contentHash;
    private final String changeIdentifier;
    private final String author;
    private final String timestamp;
    private final String subject;
    private final String body;
    private final Classification classification;
    private final String reviewUrl;
    private final String remoteUrl;
}

package com.example.baselinediff.client.git;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A commit as read from a project's log, before validation and storage.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString(exclude = "body")
public class RawCommit {

    private final String project;
    private final String contentHash;
    private final String changeIdentifier;
    private final String author;
    private final String timestamp;
    private final String subject;
    private final String body;
    private final String reviewUrl;
}

package com.example.baselinediff.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One commit object, keyed by its content hash.
 * Immutable once written except for {@link #classification}.
 * {@code project} is a logical reference to {@link ProjectRecord}; orphans are tolerated.
 */
@Entity
@Table(name = "commits",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_commits_content_hash", columnNames = {"content_hash"})
        },
        indexes = {
                @Index(name = "idx_commits_project", columnList = "project"),
                @Index(name = "idx_commits_classification", columnList = "classification"),
                @Index(name = "idx_commits_change_id", columnList = "change_id"),
                @Index(name = "idx_commits_author", columnList = "author"),
                @Index(name = "idx_commits_committed_at", columnList = "committed_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CommitRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project", nullable = false)
    private String project;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "change_id")
    private String changeIdentifier;

    @Column(name = "author")
    private String author;

    /**
     * Author date as an ISO-8601 UTC instant, so lexical order is chronological order.
     */
    @Column(name = "committed_at", length = 40)
    private String timestamp;

    @Column(name = "subject", columnDefinition = "TEXT")
    private String subject;

    @Column(name = "body", columnDefinition = "TEXT")
    private String body;

    @Convert(converter = ClassificationConverter.class)
    @Column(name = "classification", length = 20)
    private Classification classification;

    @Column(name = "review_url", columnDefinition = "TEXT")
    private String reviewUrl;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}

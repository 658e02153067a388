package com.example.baselinediff.repository;

/**
 * Label attached to a commit, as read alongside a page of commits.
 */
public record LabelRef(String commitHash, Long labelId, String name) {
}

package com.example.baselinediff.service;

import com.example.baselinediff.client.git.CommitLogReader;
import com.example.baselinediff.client.git.RawCommit;
import com.example.baselinediff.client.manifest.ManifestProject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Reads one project's log on the scan task executor.
 * A read failure completes the future exceptionally; callers isolate it to that project.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectLogCollector {

    private final CommitLogReader commitLogReader;

    @Async("scanTaskExecutor")
    public CompletableFuture<List<RawCommit>> collect(ManifestProject project, int maxCommits) {
        try {
            return CompletableFuture.completedFuture(
                    commitLogReader.read(project.getName(), project.getDirectory(), maxCommits));
        } catch (IOException | RuntimeException e) {
            log.error("Failed to read log of project {}: {}", project.getName(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }
}

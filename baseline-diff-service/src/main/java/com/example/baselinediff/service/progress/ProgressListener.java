package com.example.baselinediff.service.progress;

/**
 * Receives progress from scans and classification runs. Passed explicitly
 * into the operation; implementations must be thread-safe since log reads
 * report from worker threads.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> {
    };

    void onProgress(ProgressEvent event);
}

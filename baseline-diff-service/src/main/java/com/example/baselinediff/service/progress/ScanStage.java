package com.example.baselinediff.service.progress;

public enum ScanStage {
    QUEUED,
    CLEARING,
    MANIFEST,
    LOG_READ,
    CLASSIFY,
    COMPLETED,
    FAILED
}

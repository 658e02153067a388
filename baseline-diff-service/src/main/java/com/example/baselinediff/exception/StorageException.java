package com.example.baselinediff.exception;

import org.springframework.http.HttpStatus;

/**
 * Storage engine failure (HTTP 503). The caller may retry; partially written
 * classifications are left unlabeled and a rerun rewrites them.
 */
public class StorageException extends BaseException {

    public static final String CODE = "STORAGE_ERROR";

    public StorageException(String message, Throwable cause) {
        super(CODE, message, HttpStatus.SERVICE_UNAVAILABLE, cause);
    }

    public static StorageException classifyFailed(Throwable cause) {
        return new StorageException("Storage failure while classifying commits: " + cause.getMessage(), cause);
    }

    public static StorageException ingestFailed(String project, Throwable cause) {
        return new StorageException(
            String.format("Storage failure while ingesting commits for project %s: %s", project, cause.getMessage()),
            cause);
    }
}

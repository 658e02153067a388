package com.example.baselinediff.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for conflict errors (HTTP 409).
 */
public class ConflictException extends BaseException {

    public ConflictException(String code, String message) {
        super(code, message, HttpStatus.CONFLICT);
    }

    /**
     * Another classify run holds the {@code classifyCommits} lock.
     */
    public static ConflictException classificationInProgress() {
        return new ConflictException(
            "CLASSIFICATION_IN_PROGRESS",
            "A classification run is already in progress"
        );
    }

    /**
     * Another scan holds the {@code scanTrees} lock.
     */
    public static ConflictException scanInProgress() {
        return new ConflictException(
            "SCAN_IN_PROGRESS",
            "A scan is already in progress"
        );
    }

    public static ConflictException labelNameDuplicate(String name) {
        return new ConflictException(
            "LABEL_NAME_DUPLICATE",
            String.format("Label %s already exists", name)
        );
    }
}

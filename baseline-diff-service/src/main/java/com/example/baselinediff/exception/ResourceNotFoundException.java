package com.example.baselinediff.exception;

import org.springframework.http.HttpStatus;

import java.nio.file.Path;

/**
 * Exception for resource not found errors (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    /**
     * Tree root passed to a scan does not exist or is not a directory.
     */
    public static ResourceNotFoundException rootNotFound(String root) {
        return new ResourceNotFoundException(
            "ROOT_NOT_FOUND",
            String.format("Tree root %s does not exist or is not a directory", root)
        );
    }

    /**
     * Tree root has no {@code .repo/manifest.xml}, or an include points nowhere.
     */
    public static ResourceNotFoundException manifestNotFound(Path manifest) {
        return new ResourceNotFoundException(
            "MANIFEST_NOT_FOUND",
            String.format("Manifest %s not found", manifest)
        );
    }

    public static ResourceNotFoundException scanJobNotFound(Long scanJobId) {
        return new ResourceNotFoundException(
            "SCAN_JOB_NOT_FOUND",
            String.format("Scan job %d not found", scanJobId)
        );
    }

    public static ResourceNotFoundException labelNotFound(Long labelId) {
        return new ResourceNotFoundException(
            "LABEL_NOT_FOUND",
            String.format("Label %d not found", labelId)
        );
    }

    public static ResourceNotFoundException commitNotFound(String contentHash) {
        return new ResourceNotFoundException(
            "COMMIT_NOT_FOUND",
            String.format("Commit %s not found", contentHash)
        );
    }
}

package com.example.baselinediff.exception;

import org.springframework.http.HttpStatus;

/**
 * Input record missing a required field or carrying an invalid one (HTTP 400).
 * During bulk ingestion the offending record is skipped and counted instead.
 */
public class MalformedInputException extends BaseException {

    public MalformedInputException(String message) {
        super("MALFORMED_INPUT", message, HttpStatus.BAD_REQUEST);
    }

    public static MalformedInputException missingField(String field) {
        return new MalformedInputException(String.format("Required field %s is missing", field));
    }

    public static MalformedInputException invalidHash(String hash) {
        return new MalformedInputException(
            String.format("Content hash '%s' is not a 40 or 64 character hex string", hash));
    }

    public static MalformedInputException invalidTimestamp(String timestamp) {
        return new MalformedInputException(
            String.format("Timestamp '%s' is not an ISO-8601 date-time", timestamp));
    }

    public static MalformedInputException fieldTooLong(String field, int max) {
        return new MalformedInputException(
            String.format("Field %s is longer than %d characters", field, max));
    }
}

package com.example.baselinediff.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for bad request errors (HTTP 400).
 */
public class BadRequestException extends BaseException {

    public BadRequestException(String code, String message) {
        super(code, message, HttpStatus.BAD_REQUEST);
    }

    public static BadRequestException negativePaging(String field, int value) {
        return new BadRequestException(
            "INVALID_PAGING",
            String.format("%s must not be negative, got %d", field, value)
        );
    }

    public static BadRequestException unknownClassification(String value) {
        return new BadRequestException(
            "INVALID_CLASSIFICATION",
            String.format("Unknown classification '%s', expected shared, upstream_only or vendor_only", value)
        );
    }

    public static BadRequestException invalidDateRange(String from, String to) {
        return new BadRequestException(
            "INVALID_DATE_RANGE",
            String.format("Date range %s..%s is invalid", from, to)
        );
    }
}

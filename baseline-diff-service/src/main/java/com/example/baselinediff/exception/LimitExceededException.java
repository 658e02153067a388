package com.example.baselinediff.exception;

import org.springframework.http.HttpStatus;

/**
 * Requested page size is above the configured maximum and the caller did not opt into an unbounded read.
 */
public class LimitExceededException extends BaseException {

    public LimitExceededException(int requested, int max) {
        super("LIMIT_EXCEEDED",
              String.format("limit %d exceeds the maximum page size %d; pass unbounded=true to read more", requested, max),
              HttpStatus.BAD_REQUEST);
    }
}

package com.example.baselinediff.service.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A step reported by a long-running operation. {@code total} is 0 when unknown.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class ProgressEvent {

    private final ScanStage stage;
    private final int current;
    private final int total;
    private final String item;
    private final String message;

    public static ProgressEvent of(ScanStage stage, int current, int total, String message) {
        return new ProgressEvent(stage, current, total, null, message);
    }
}

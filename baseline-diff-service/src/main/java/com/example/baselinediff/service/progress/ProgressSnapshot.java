package com.example.baselinediff.service.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
@AllArgsConstructor
public class ProgressSnapshot {

    private final ScanStage stage;
    private final int current;
    private final int total;
    private final String currentItem;
    private final String message;
    private final int percentage;
    private final Instant updatedAt;

    static ProgressSnapshot from(ProgressEvent event) {
        int percentage = event.getTotal() > 0
                ? (int) Math.min(100, Math.round(event.getCurrent() * 100.0 / event.getTotal()))
                : (event.getStage() == ScanStage.COMPLETED ? 100 : 0);
        return ProgressSnapshot.builder()
                .stage(event.getStage())
                .current(event.getCurrent())
                .total(event.getTotal())
                .currentItem(event.getItem())
                .message(event.getMessage())
                .percentage(percentage)
                .updatedAt(Instant.now())
                .build();
    }
}

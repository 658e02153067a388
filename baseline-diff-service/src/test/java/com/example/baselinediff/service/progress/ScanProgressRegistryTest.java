package com.example.baselinediff.service.progress;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScanProgressRegistryTest {

    private final ScanProgressRegistry registry = new ScanProgressRegistry();

    @Test
    void listener_RecordsQueuedThenLatestEvent() {
        ProgressListener listener = registry.listenerFor(1L);
        assertThat(registry.snapshot(1L)).get().extracting(ProgressSnapshot::getStage).isEqualTo(ScanStage.QUEUED);

        listener.onProgress(ProgressEvent.builder()
                .stage(ScanStage.LOG_READ).current(3).total(4).item("vendor/core").message("Reading").build());

        ProgressSnapshot snapshot = registry.snapshot(1L).orElseThrow();
        assertThat(snapshot.getStage()).isEqualTo(ScanStage.LOG_READ);
        assertThat(snapshot.getPercentage()).isEqualTo(75);
        assertThat(snapshot.getCurrentItem()).isEqualTo("vendor/core");
    }

    @Test
    void completedWithoutTotal_IsFullPercentage() {
        registry.listenerFor(2L).onProgress(ProgressEvent.of(ScanStage.COMPLETED, 0, 0, "done"));

        assertThat(registry.snapshot(2L).orElseThrow().getPercentage()).isEqualTo(100);
    }

    @Test
    void onlyMostRecentJobsAreRetained() {
        for (long id = 1; id <= ScanProgressRegistry.MAX_TRACKED_JOBS + 5; id++) {
            registry.listenerFor(id);
        }

        assertThat(registry.snapshot(1L)).isEmpty();
        assertThat(registry.snapshot(5L)).isEmpty();
        assertThat(registry.snapshot(6L)).isPresent();
        assertThat(registry.snapshot((long) ScanProgressRegistry.MAX_TRACKED_JOBS + 5)).isPresent();
    }

    @Test
    void unknownJob_HasNoSnapshot() {
        assertThat(registry.snapshot(99L)).isEmpty();
    }
}

package com.example.baselinediff.service.progress;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Latest progress snapshot per scan job, kept in memory for polling.
 * Only the most recent {@value #MAX_TRACKED_JOBS} jobs are retained.
 */
@Component
public class ScanProgressRegistry {

    static final int MAX_TRACKED_JOBS = 50;

    private final ConcurrentSkipListMap<Long, ProgressSnapshot> snapshots = new ConcurrentSkipListMap<>();

    /**
     * Listener that records every event as the job's current snapshot.
     */
    public ProgressListener listenerFor(Long scanJobId) {
        record(scanJobId, ProgressEvent.of(ScanStage.QUEUED, 0, 0, "Scan queued"));
        return event -> record(scanJobId, event);
    }

    public Optional<ProgressSnapshot> snapshot(Long scanJobId) {
        return Optional.ofNullable(snapshots.get(scanJobId));
    }

    private void record(Long scanJobId, ProgressEvent event) {
        snapshots.put(scanJobId, ProgressSnapshot.from(event));
        while (snapshots.size() > MAX_TRACKED_JOBS) {
            Map.Entry<Long, ProgressSnapshot> oldest = snapshots.pollFirstEntry();
            if (oldest == null) {
                break;
            }
        }
    }
}

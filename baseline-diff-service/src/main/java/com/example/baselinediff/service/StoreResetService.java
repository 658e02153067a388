package com.example.baselinediff.service;

import com.example.baselinediff.config.BaselineProperties;
import com.example.baselinediff.exception.ConflictException;
import com.example.baselinediff.metrics.BaselineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import net.javacrumbs.shedlock.core.LockingTaskExecutor.TaskResult;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Clears the store on request. Takes the scan lock and then the classify lock,
 * the same order a scan takes them, so a reset never runs beside either.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoreResetService {

    private final ScanDataService scanDataService;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final BaselineProperties properties;
    private final BaselineMetrics metrics;

    /**
     * @throws ConflictException when a scan or a classification run is in progress
     */
    public void reset() {
        Duration lockAtMostFor = properties.getClassifier().getLockAtMostFor();
        try {
            TaskResult<Boolean> scanLock = lockingTaskExecutor.executeWithLock(
                    () -> clearUnderClassifyLock(lockAtMostFor),
                    new LockConfiguration(Instant.now(), ScanOrchestrator.LOCK_NAME, lockAtMostFor, Duration.ZERO));
            if (!scanLock.wasExecuted()) {
                metrics.recordLockContention(ScanOrchestrator.LOCK_NAME);
                throw ConflictException.scanInProgress();
            }
            if (!scanLock.getResult()) {
                metrics.recordLockContention(DiffClassifier.LOCK_NAME);
                throw ConflictException.classificationInProgress();
            }
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("Store reset failed", t);
        }
    }

    private boolean clearUnderClassifyLock(Duration lockAtMostFor) throws Throwable {
        TaskResult<Boolean> classifyLock = lockingTaskExecutor.executeWithLock(
                () -> {
                    log.warn("Resetting store: deleting all commits, projects and label links");
                    scanDataService.clearAll();
                    return Boolean.TRUE;
                },
                new LockConfiguration(Instant.now(), DiffClassifier.LOCK_NAME, lockAtMostFor, Duration.ZERO));
        return classifyLock.wasExecuted();
    }
}

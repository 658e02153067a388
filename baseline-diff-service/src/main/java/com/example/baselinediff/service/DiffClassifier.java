package com.example.baselinediff.service;

import com.example.baselinediff.config.BaselineProperties;
import com.example.baselinediff.dto.response.ClassificationSummary;
import com.example.baselinediff.entity.Classification;
import com.example.baselinediff.exception.ConflictException;
import com.example.baselinediff.exception.StorageException;
import com.example.baselinediff.metrics.BaselineMetrics;
import com.example.baselinediff.repository.CommitRecordRepository;
import com.example.baselinediff.service.progress.ProgressEvent;
import com.example.baselinediff.service.progress.ProgressListener;
import com.example.baselinediff.service.progress.ScanStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import net.javacrumbs.shedlock.core.LockingTaskExecutor.TaskResult;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Classifies every stored commit as shared, upstream-only or vendor-only.
 *
 * FLOW:
 * 1. Load distinct change identifiers of tree A (upstream) and tree B (vendor) projects
 * 2. Split them into shared / A-only / B-only
 * 3. Clear all labels, then write each partition back in its own transaction
 * 4. Label identifier-less commits by project membership; commits of projects
 *    claimed by both trees, or by neither, fall back to shared
 *
 * Runs hold the {@value #LOCK_NAME} lock so write-backs of two runs never interleave.
 * A failure part-way leaves some commits unlabeled; rerunning repairs that.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiffClassifier {

    public static final String LOCK_NAME = "classifyCommits";

    private static final int TOTAL_STEPS = 6;

    private final CommitRecordRepository commitRecordRepository;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final BaselineProperties properties;
    private final BaselineMetrics metrics;

    /**
     * @throws ConflictException when another run holds the lock
     * @throws StorageException  when the store fails; the run may be retried
     */
    public ClassificationSummary classify(Collection<String> upstreamProjects,
                                          Collection<String> vendorProjects,
                                          ProgressListener listener) {
        boolean ownsCorrelationId = MDC.get("correlationId") == null;
        if (ownsCorrelationId) {
            MDC.put("correlationId", "CLASSIFY-" + UUID.randomUUID().toString().substring(0, 8));
        }
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;

        try {
            LockConfiguration lock = new LockConfiguration(
                    Instant.now(), LOCK_NAME, properties.getClassifier().getLockAtMostFor(), Duration.ZERO);

            TaskResult<ClassificationSummary> result = lockingTaskExecutor.executeWithLock(
                    () -> classifyUnderLock(upstreamProjects, vendorProjects, progress), lock);

            if (!result.wasExecuted()) {
                metrics.recordLockContention(LOCK_NAME);
                log.warn("Classification refused: lock {} is held by another run", LOCK_NAME);
                throw ConflictException.classificationInProgress();
            }
            return result.getResult();
        } catch (DataAccessException e) {
            throw StorageException.classifyFailed(e);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("Classification failed: " + t.getMessage(), t);
        } finally {
            if (ownsCorrelationId) {
                MDC.remove("correlationId");
            }
        }
    }

    private ClassificationSummary classifyUnderLock(Collection<String> upstreamProjects,
                                                    Collection<String> vendorProjects,
                                                    ProgressListener progress) {
        long startTime = System.currentTimeMillis();
        Set<String> treeA = projectSet(upstreamProjects);
        Set<String> treeB = projectSet(vendorProjects);
        log.info("Starting classification: upstreamProjects={}, vendorProjects={}", treeA.size(), treeB.size());

        try {
            progress.onProgress(ProgressEvent.of(ScanStage.CLASSIFY, 0, TOTAL_STEPS, "Loading change identifiers"));
            Set<String> idsA = commitRecordRepository.findDistinctChangeIds(treeA);
            Set<String> idsB = commitRecordRepository.findDistinctChangeIds(treeB);
            ChangeIdPartition partition = ChangeIdPartition.of(idsA, idsB);
            log.debug("Partitioned identifiers: totalA={}, totalB={}, shared={}, aOnly={}, bOnly={}",
                    partition.getTotalA(), partition.getTotalB(), partition.getShared().size(),
                    partition.getAOnly().size(), partition.getBOnly().size());

            progress.onProgress(ProgressEvent.of(ScanStage.CLASSIFY, 1, TOTAL_STEPS, "Clearing previous labels"));
            int cleared = commitRecordRepository.clearClassifications();

            progress.onProgress(ProgressEvent.of(ScanStage.CLASSIFY, 2, TOTAL_STEPS, "Labeling shared changes"));
            int sharedRows = commitRecordRepository.classifyByChangeIds(Classification.SHARED, partition.getShared());

            progress.onProgress(ProgressEvent.of(ScanStage.CLASSIFY, 3, TOTAL_STEPS, "Labeling upstream-only changes"));
            int upstreamRows = commitRecordRepository.classifyByChangeIds(
                    Classification.UPSTREAM_ONLY, partition.getAOnly());

            progress.onProgress(ProgressEvent.of(ScanStage.CLASSIFY, 4, TOTAL_STEPS, "Labeling vendor-only changes"));
            int vendorRows = commitRecordRepository.classifyByChangeIds(
                    Classification.VENDOR_ONLY, partition.getBOnly());

            progress.onProgress(ProgressEvent.of(ScanStage.CLASSIFY, 5, TOTAL_STEPS, "Labeling commits without Change-Id"));
            int unidentified = classifyUnidentified(treeA, treeB);

            progress.onProgress(ProgressEvent.of(ScanStage.CLASSIFY, TOTAL_STEPS, TOTAL_STEPS, "Classification finished"));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordClassification(duration);
            log.info("Classification finished in {}ms: cleared={}, sharedRows={}, upstreamOnlyRows={}, "
                            + "vendorOnlyRows={}, unidentifiedRows={}",
                    duration, cleared, sharedRows, upstreamRows, vendorRows, unidentified);

            return ClassificationSummary.builder()
                    .totalA(partition.getTotalA())
                    .totalB(partition.getTotalB())
                    .shared(partition.getShared().size())
                    .aOnly(partition.getAOnly().size())
                    .bOnly(partition.getBOnly().size())
                    .build();
        } catch (DataAccessException e) {
            log.error("Classification aborted by storage failure; affected commits stay unlabeled: {}",
                    e.getMessage());
            throw StorageException.classifyFailed(e);
        }
    }

    private int classifyUnidentified(Set<String> treeA, Set<String> treeB) {
        Set<String> onlyA = new TreeSet<>(treeA);
        onlyA.removeAll(treeB);
        Set<String> onlyB = new TreeSet<>(treeB);
        onlyB.removeAll(treeA);

        int rows = commitRecordRepository.classifyUnidentified(Classification.UPSTREAM_ONLY, onlyA);
        rows += commitRecordRepository.classifyUnidentified(Classification.VENDOR_ONLY, onlyB);
        rows += commitRecordRepository.classifyRemainingUnidentified(Classification.SHARED);
        return rows;
    }

    private static Set<String> projectSet(Collection<String> projects) {
        Set<String> result = new TreeSet<>();
        if (projects != null) {
            for (String project : projects) {
                if (project != null && !project.isBlank()) {
                    result.add(project);
                }
            }
        }
        return result;
    }
}

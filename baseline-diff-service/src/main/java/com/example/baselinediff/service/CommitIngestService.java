package com.example.baselinediff.service;

import com.example.baselinediff.client.git.RawCommit;
import com.example.baselinediff.dto.request.CommitInput;
import com.example.baselinediff.dto.response.IngestResult;
import com.example.baselinediff.entity.CommitRecord;
import com.example.baselinediff.exception.MalformedInputException;
import com.example.baselinediff.exception.StorageException;
import com.example.baselinediff.metrics.BaselineMetrics;
import com.example.baselinediff.repository.CommitRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Bulk ingestion of commit records with first-write-wins semantics.
 *
 * Malformed records are skipped and counted. Within one batch the first
 * record for a hash wins; against stored rows the stored row wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommitIngestService {

    private final CommitRecordRepository commitRecordRepository;
    private final CommitRecordMapper commitRecordMapper;
    private final BaselineMetrics metrics;

    public IngestResult ingest(List<CommitInput> inputs) {
        return ingest("bulk", inputs, (CommitInput input) -> commitRecordMapper.toEntity(input));
    }

    public IngestResult ingestProject(String project, List<RawCommit> commits) {
        return ingest(project, commits, (RawCommit commit) -> commitRecordMapper.toEntity(commit));
    }

    private <T> IngestResult ingest(String source, List<T> inputs, Function<T, CommitRecord> mapper) {
        if (inputs == null || inputs.isEmpty()) {
            return IngestResult.builder().build();
        }

        Map<String, CommitRecord> byHash = new LinkedHashMap<>();
        int skipped = 0;
        for (T input : inputs) {
            try {
                CommitRecord record = mapper.apply(input);
                byHash.putIfAbsent(record.getContentHash(), record);
            } catch (MalformedInputException e) {
                skipped++;
                log.debug("Skipping malformed commit from {}: {}", source, e.getMessage());
            }
        }

        int inserted;
        try {
            inserted = commitRecordRepository.insertIgnoringDuplicates(new ArrayList<>(byHash.values()));
        } catch (DataAccessException e) {
            throw StorageException.ingestFailed(source, e);
        }

        metrics.recordIngest(inserted, skipped);
        if (skipped > 0) {
            log.warn("Ingest from {}: skipped {} malformed of {} records", source, skipped, inputs.size());
        }
        log.debug("Ingest from {}: received={}, inserted={}, skippedMalformed={}",
                source, inputs.size(), inserted, skipped);

        return IngestResult.builder()
                .received(inputs.size())
                .inserted(inserted)
                .skippedMalformed(skipped)
                .build();
    }
}

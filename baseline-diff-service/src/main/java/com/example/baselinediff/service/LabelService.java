package com.example.baselinediff.service;

import com.example.baselinediff.dto.response.LabelResponse;
import com.example.baselinediff.entity.CommitLabelLink;
import com.example.baselinediff.entity.Label;
import com.example.baselinediff.exception.ConflictException;
import com.example.baselinediff.exception.ResourceNotFoundException;
import com.example.baselinediff.repository.CommitLabelLinkRepository;
import com.example.baselinediff.repository.CommitRecordRepository;
import com.example.baselinediff.repository.LabelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class LabelService {

    private final LabelRepository labelRepository;
    private final CommitLabelLinkRepository commitLabelLinkRepository;
    private final CommitRecordRepository commitRecordRepository;

    @Transactional(readOnly = true)
    public List<LabelResponse> listLabels() {
        return labelRepository.findAllByOrderByIdAsc().stream()
                .map(LabelResponse::from)
                .toList();
    }

    @Transactional
    public LabelResponse createLabel(String name) {
        String trimmed = name.strip();
        if (labelRepository.existsByNameIgnoreCase(trimmed)) {
            throw ConflictException.labelNameDuplicate(trimmed);
        }
        Label saved = labelRepository.save(Label.builder()
                .name(trimmed)
                .defaultLabel(false)
                .build());
        log.info("Created label id={} name={}", saved.getId(), saved.getName());
        return LabelResponse.from(saved);
    }

    /**
     * Removes a label and detaches it from every commit.
     */
    @Transactional
    public void deleteLabel(Long labelId) {
        Label label = labelRepository.findById(labelId)
                .orElseThrow(() -> ResourceNotFoundException.labelNotFound(labelId));
        int detached = commitLabelLinkRepository.deleteByLabelId(labelId);
        labelRepository.delete(label);
        log.info("Deleted label id={} name={}, detached from {} commits", labelId, label.getName(), detached);
    }

    /**
     * Replaces the label set of one commit.
     */
    @Transactional
    public List<LabelResponse> assignLabels(String contentHash, List<Long> labelIds) {
        String hash = contentHash.strip().toLowerCase(Locale.ROOT);
        if (!commitRecordRepository.existsByContentHash(hash)) {
            throw ResourceNotFoundException.commitNotFound(hash);
        }

        Set<Long> unique = new LinkedHashSet<>(labelIds);
        List<Label> labels = labelRepository.findAllById(unique);
        if (labels.size() != unique.size()) {
            Long missing = unique.stream()
                    .filter(id -> labels.stream().noneMatch(label -> label.getId().equals(id)))
                    .findFirst()
                    .orElse(null);
            throw ResourceNotFoundException.labelNotFound(missing);
        }

        commitLabelLinkRepository.deleteByCommitHash(hash);
        commitLabelLinkRepository.saveAll(unique.stream()
                .map(id -> CommitLabelLink.builder().commitHash(hash).labelId(id).build())
                .toList());

        log.debug("Assigned labels {} to commit {}", unique, hash);
        return labels.stream().map(LabelResponse::from).toList();
    }
}

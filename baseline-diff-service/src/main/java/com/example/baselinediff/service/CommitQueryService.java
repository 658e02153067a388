package com.example.baselinediff.service;

import com.example.baselinediff.config.BaselineProperties;
import com.example.baselinediff.dto.request.CommitSearchRequest;
import com.example.baselinediff.dto.response.*;
import com.example.baselinediff.entity.Classification;
import com.example.baselinediff.exception.BadRequestException;
import com.example.baselinediff.exception.LimitExceededException;
import com.example.baselinediff.repository.CommitRecordRepository;
import com.example.baselinediff.repository.CommitRow;
import com.example.baselinediff.repository.LabelRef;
import com.example.baselinediff.repository.query.CommitPredicate;
import com.example.baselinediff.repository.query.CommitPredicates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Filtered, paged reads over classified commits.
 *
 * Rows are ordered newest first, ties by insertion order. Each row gets its
 * derived URL and labels; shared rows also get up to
 * {@code baseline.query.related-limit} other commits with the same change
 * identifier, ordered by content hash.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class CommitQueryService {

    private final CommitRecordRepository commitRecordRepository;
    private final BaselineProperties properties;

    public CommitPageResponse search(CommitSearchRequest request) {
        CommitSearchRequest criteria = request != null ? request : new CommitSearchRequest();
        List<CommitPredicate> predicates = toPredicates(criteria);
        PageWindow window = resolveWindow(criteria);

        long total = commitRecordRepository.countMatching(predicates);
        List<CommitRow> rows = window.limit() > 0
                ? commitRecordRepository.findPage(predicates, window.limit(), window.offset())
                : List.of();

        Map<String, List<CommitLabelResponse>> labels = labelsByHash(rows);
        Map<String, List<CommitRow>> related = relatedByChangeId(rows);
        int relatedLimit = properties.getQuery().getRelatedLimit();

        List<CommitResponse> commits = new ArrayList<>(rows.size());
        for (CommitRow row : rows) {
            commits.add(toResponse(row,
                    labels.getOrDefault(row.getContentHash(), List.of()),
                    relatedFor(row, related, relatedLimit)));
        }

        boolean truncated = window.capped() && total > (long) window.offset() + window.limit();
        if (truncated) {
            log.warn("Unbounded commit query truncated at {} of {} matching rows", window.limit(), total);
        }

        return CommitPageResponse.builder()
                .total(total)
                .commits(commits)
                .truncated(truncated)
                .limit(window.limit())
                .offset(window.offset())
                .build();
    }

    public StatsResponse stats() {
        long shared = commitRecordRepository.countByClassification(Classification.SHARED);
        long upstreamOnly = commitRecordRepository.countByClassification(Classification.UPSTREAM_ONLY);
        long vendorOnly = commitRecordRepository.countByClassification(Classification.VENDOR_ONLY);
        long unclassified = commitRecordRepository.countByClassificationIsNull();
        return StatsResponse.builder()
                .total(shared + upstreamOnly + vendorOnly + unclassified)
                .shared(shared)
                .upstreamOnly(upstreamOnly)
                .vendorOnly(vendorOnly)
                .unclassified(unclassified)
                .build();
    }

    public MetadataResponse metadata() {
        return MetadataResponse.builder()
                .projects(commitRecordRepository.findDistinctProjects())
                .authors(commitRecordRepository.findDistinctAuthors())
                .build();
    }

    List<CommitPredicate> toPredicates(CommitSearchRequest criteria) {
        List<CommitPredicate> predicates = new ArrayList<>();
        if (hasText(criteria.getClassification())) {
            predicates.add(CommitPredicates.classification(Classification.fromValue(criteria.getClassification().strip())));
        }
        if (hasText(criteria.getProject())) {
            predicates.add(CommitPredicates.project(criteria.getProject().strip()));
        }
        if (hasText(criteria.getAuthor())) {
            predicates.add(CommitPredicates.authorContains(criteria.getAuthor().strip()));
        }
        if (hasText(criteria.getSearch())) {
            predicates.add(CommitPredicates.search(criteria.getSearch().strip()));
        }
        if (criteria.getDateFrom() != null || criteria.getDateTo() != null) {
            if (criteria.getDateFrom() != null && criteria.getDateTo() != null
                    && criteria.getDateFrom().isAfter(criteria.getDateTo())) {
                throw BadRequestException.invalidDateRange(
                        criteria.getDateFrom().toString(), criteria.getDateTo().toString());
            }
            predicates.add(CommitPredicates.dateRange(criteria.getDateFrom(), criteria.getDateTo()));
        }
        if (criteria.getLabelId() != null) {
            predicates.add(CommitPredicates.label(criteria.getLabelId()));
        }
        return predicates;
    }

    PageWindow resolveWindow(CommitSearchRequest criteria) {
        BaselineProperties.Query config = properties.getQuery();
        int offset = criteria.getOffset() != null ? criteria.getOffset() : 0;
        if (offset < 0) {
            throw BadRequestException.negativePaging("offset", offset);
        }
        Integer limit = criteria.getLimit();
        if (limit != null && limit < 0) {
            throw BadRequestException.negativePaging("limit", limit);
        }

        if (criteria.isUnbounded()) {
            int ceiling = config.getUnboundedCeiling();
            boolean capped = limit == null || limit > ceiling;
            return new PageWindow(capped ? ceiling : limit, offset, capped);
        }
        if (limit == null) {
            return new PageWindow(config.getDefaultPageSize(), offset, false);
        }
        if (limit > config.getMaxPageSize()) {
            throw new LimitExceededException(limit, config.getMaxPageSize());
        }
        return new PageWindow(limit, offset, false);
    }

    private Map<String, List<CommitLabelResponse>> labelsByHash(List<CommitRow> rows) {
        if (rows.isEmpty()) {
            return Map.of();
        }
        List<String> hashes = rows.stream().map(CommitRow::getContentHash).toList();
        Map<String, List<CommitLabelResponse>> labels = new HashMap<>();
        for (LabelRef ref : commitRecordRepository.findLabels(hashes)) {
            labels.computeIfAbsent(ref.commitHash(), hash -> new ArrayList<>())
                    .add(new CommitLabelResponse(ref.labelId(), ref.name()));
        }
        return labels;
    }

    private Map<String, List<CommitRow>> relatedByChangeId(List<CommitRow> rows) {
        Set<String> changeIds = rows.stream()
                .filter(row -> row.getClassification() == Classification.SHARED)
                .map(CommitRow::getChangeIdentifier)
                .filter(CommitQueryService::hasText)
                .collect(Collectors.toCollection(TreeSet::new));
        if (changeIds.isEmpty()) {
            return Map.of();
        }
        // one extra per identifier since the row itself is among them
        int perIdentifier = properties.getQuery().getRelatedLimit() + 1;
        return commitRecordRepository.findByChangeIds(changeIds, perIdentifier).stream()
                .collect(Collectors.groupingBy(CommitRow::getChangeIdentifier, LinkedHashMap::new, Collectors.toList()));
    }

    private static List<RelatedCommitResponse> relatedFor(CommitRow row, Map<String, List<CommitRow>> related,
                                                          int relatedLimit) {
        if (row.getClassification() != Classification.SHARED || !hasText(row.getChangeIdentifier())) {
            return List.of();
        }
        return related.getOrDefault(row.getChangeIdentifier(), List.of()).stream()
                .filter(other -> !other.getContentHash().equals(row.getContentHash()))
                .limit(relatedLimit)
                .map(other -> RelatedCommitResponse.builder()
                        .project(other.getProject())
                        .hash(other.getContentHash())
                        .subject(other.getSubject())
                        .url(CommitUrls.derive(other.getReviewUrl(), other.getRemoteUrl(),
                                other.getProject(), other.getContentHash()))
                        .build())
                .toList();
    }

    private static CommitResponse toResponse(CommitRow row, List<CommitLabelResponse> labels,
                                             List<RelatedCommitResponse> related) {
        return CommitResponse.builder()
                .project(row.getProject())
                .hash(row.getContentHash())
                .changeId(row.getChangeIdentifier())
                .author(row.getAuthor())
                .date(row.getTimestamp())
                .subject(row.getSubject())
                .message(row.getBody())
                .classification(row.getClassification())
                .reviewUrl(row.getReviewUrl())
                .remoteUrl(row.getRemoteUrl())
                .url(CommitUrls.derive(row.getReviewUrl(), row.getRemoteUrl(), row.getProject(), row.getContentHash()))
                .labels(new ArrayList<>(labels))
                .relatedCommits(new ArrayList<>(related))
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Effective page; {@code capped} marks an unbounded read cut at the hard ceiling.
     */
    record PageWindow(int limit, int offset, boolean capped) {
    }
}

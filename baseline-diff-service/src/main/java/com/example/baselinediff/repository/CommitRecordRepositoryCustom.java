package com.example.baselinediff.repository;

import com.example.baselinediff.entity.Classification;
import com.example.baselinediff.entity.CommitRecord;
import com.example.baselinediff.repository.query.CommitPredicate;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Native-SQL operations on commits that go through the batch planner.
 */
public interface CommitRecordRepositoryCustom {

    /**
     * Inserts records, silently dropping any whose content hash already exists.
     *
     * @return number of rows actually inserted
     */
    int insertIgnoringDuplicates(List<CommitRecord> records);

    /**
     * Distinct non-empty change identifiers among commits of the given projects.
     */
    Set<String> findDistinctChangeIds(Collection<String> projects);

    int clearClassifications();

    /**
     * Labels every commit carrying one of the identifiers, whatever its project.
     * All chunks run in one transaction.
     */
    int classifyByChangeIds(Classification classification, Collection<String> changeIds);

    /**
     * Labels identifier-less commits of the given projects.
     */
    int classifyUnidentified(Classification classification, Collection<String> projects);

    /**
     * Labels identifier-less commits still unlabeled after the project-membership pass.
     */
    int classifyRemainingUnidentified(Classification classification);

    long countMatching(List<CommitPredicate> predicates);

    List<CommitRow> findPage(List<CommitPredicate> predicates, int limit, int offset);

    List<LabelRef> findLabels(Collection<String> contentHashes);

    /**
     * Up to {@code perIdentifier} commits per change identifier, ordered by content hash.
     */
    List<CommitRow> findByChangeIds(Collection<String> changeIds, int perIdentifier);
}

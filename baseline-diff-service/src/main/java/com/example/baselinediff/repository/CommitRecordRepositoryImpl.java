package com.example.baselinediff.repository;

import com.example.baselinediff.entity.Classification;
import com.example.baselinediff.entity.CommitRecord;
import com.example.baselinediff.repository.query.CommitPredicate;
import com.example.baselinediff.repository.query.SqlConditions;
import com.example.baselinediff.repository.support.BatchQueryPlanner;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.query.TypedParameterValue;
import org.hibernate.type.StandardBasicTypes;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Native PostgreSQL implementation of the commit store's bulk operations.
 *
 * Every statement binding a variable-length list goes through the
 * {@link BatchQueryPlanner} so no statement exceeds the parameter ceiling.
 */
@Repository
@Slf4j
public class CommitRecordRepositoryImpl implements CommitRecordRepositoryCustom {

    private static final int INSERT_PARAMS_PER_ROW = 9;

    private static final String ROW_COLUMNS = """
            c.project, c.content_hash, c.change_id, c.author, c.committed_at,
            c.subject, c.body, c.classification, c.review_url, p.remote_url
            """;

    @PersistenceContext
    private EntityManager entityManager;

    private final BatchQueryPlanner planner;

    @Autowired
    public CommitRecordRepositoryImpl(BatchQueryPlanner planner) {
        this.planner = planner;
    }

    @Override
    @Transactional
    public int insertIgnoringDuplicates(List<CommitRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        int rowsPerStatement = planner.elementsPerChunk(INSERT_PARAMS_PER_ROW);
        Timestamp now = Timestamp.valueOf(LocalDateTime.now());
        int inserted = planner.sum(records, rowsPerStatement, batch -> executeInsert(batch, now));

        entityManager.flush();
        entityManager.clear();

        log.debug("Inserted {} of {} commits ({} rows per statement)", inserted, records.size(), rowsPerStatement);
        return inserted;
    }

    private int executeInsert(List<CommitRecord> batch, Timestamp now) {
        StringBuilder sql = new StringBuilder("""
                INSERT INTO commits (
                    project, content_hash, change_id, author, committed_at,
                    subject, body, review_url, created_at
                ) VALUES
                """);

        for (int i = 0; i < batch.size(); i++) {
            sql.append("(?, ?, ?, ?, ?, ?, ?, ?, ?)");
            if (i < batch.size() - 1) {
                sql.append(",\n");
            }
        }
        sql.append("\nON CONFLICT (content_hash) DO NOTHING");

        Query query = entityManager.createNativeQuery(sql.toString());

        int paramIndex = 1;
        for (CommitRecord commit : batch) {
            query.setParameter(paramIndex++, commit.getProject());
            query.setParameter(paramIndex++, commit.getContentHash());
            query.setParameter(paramIndex++, nullableString(commit.getChangeIdentifier()));
            query.setParameter(paramIndex++, nullableString(commit.getAuthor()));
            query.setParameter(paramIndex++, nullableString(commit.getTimestamp()));
            query.setParameter(paramIndex++, nullableString(commit.getSubject()));
            query.setParameter(paramIndex++, nullableString(commit.getBody()));
            query.setParameter(paramIndex++, nullableString(commit.getReviewUrl()));
            query.setParameter(paramIndex++, commit.getCreatedAt() != null
                    ? Timestamp.valueOf(commit.getCreatedAt())
                    : now);
        }

        return query.executeUpdate();
    }

    static TypedParameterValue<String> nullableString(String value) {
        return new TypedParameterValue<>(StandardBasicTypes.STRING, value);
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> findDistinctChangeIds(Collection<String> projects) {
        return planner.union(projects, chunk -> {
            @SuppressWarnings("unchecked")
            List<String> ids = entityManager.createNativeQuery("""
                            SELECT DISTINCT change_id FROM commits
                            WHERE project IN (:projects)
                              AND change_id IS NOT NULL AND change_id <> ''
                            """)
                    .setParameter("projects", chunk)
                    .getResultList();
            return ids;
        });
    }

    @Override
    @Transactional
    public int clearClassifications() {
        return entityManager.createNativeQuery(
                        "UPDATE commits SET classification = NULL WHERE classification IS NOT NULL")
                .executeUpdate();
    }

    @Override
    @Transactional
    public int classifyByChangeIds(Classification classification, Collection<String> changeIds) {
        return planner.sum(changeIds, chunk -> entityManager.createNativeQuery("""
                        UPDATE commits SET classification = :classification
                        WHERE change_id IN (:ids)
                        """)
                .setParameter("classification", classification.getValue())
                .setParameter("ids", chunk)
                .executeUpdate());
    }

    @Override
    @Transactional
    public int classifyUnidentified(Classification classification, Collection<String> projects) {
        return planner.sum(projects, chunk -> entityManager.createNativeQuery("""
                        UPDATE commits SET classification = :classification
                        WHERE (change_id IS NULL OR change_id = '')
                          AND project IN (:projects)
                        """)
                .setParameter("classification", classification.getValue())
                .setParameter("projects", chunk)
                .executeUpdate());
    }

    @Override
    @Transactional
    public int classifyRemainingUnidentified(Classification classification) {
        return entityManager.createNativeQuery("""
                        UPDATE commits SET classification = :classification
                        WHERE (change_id IS NULL OR change_id = '')
                          AND classification IS NULL
                        """)
                .setParameter("classification", classification.getValue())
                .executeUpdate();
    }

    @Override
    @Transactional(readOnly = true)
    public long countMatching(List<CommitPredicate> predicates) {
        SqlConditions conditions = SqlConditions.of(predicates);
        Query query = entityManager.createNativeQuery(
                "SELECT COUNT(*) FROM commits c" + conditions.whereClause());
        conditions.applyTo(query);
        return ((Number) query.getSingleResult()).longValue();
    }

    @Override
    @Transactional(readOnly = true)
    public List<CommitRow> findPage(List<CommitPredicate> predicates, int limit, int offset) {
        SqlConditions conditions = SqlConditions.of(predicates);
        Query query = entityManager.createNativeQuery(
                "SELECT " + ROW_COLUMNS
                        + " FROM commits c LEFT JOIN projects p ON p.project = c.project"
                        + conditions.whereClause()
                        + " ORDER BY c.committed_at DESC NULLS LAST, c.id ASC");
        conditions.applyTo(query);
        query.setFirstResult(offset);
        query.setMaxResults(limit);
        return toRows(query.getResultList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<LabelRef> findLabels(Collection<String> contentHashes) {
        return planner.concat(contentHashes, chunk -> {
            @SuppressWarnings("unchecked")
            List<Object[]> rows = entityManager.createNativeQuery("""
                            SELECT cl.commit_hash, l.id, l.name
                            FROM commit_labels cl JOIN labels l ON l.id = cl.label_id
                            WHERE cl.commit_hash IN (:hashes)
                            ORDER BY l.name
                            """)
                    .setParameter("hashes", chunk)
                    .getResultList();
            List<LabelRef> labels = new ArrayList<>(rows.size());
            for (Object[] row : rows) {
                labels.add(new LabelRef((String) row[0], ((Number) row[1]).longValue(), (String) row[2]));
            }
            return labels;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<CommitRow> findByChangeIds(Collection<String> changeIds, int perIdentifier) {
        return planner.concat(changeIds, chunk -> {
            Query query = entityManager.createNativeQuery("""
                            SELECT project, content_hash, change_id, author, committed_at,
                                   subject, body, classification, review_url, remote_url
                            FROM (
                                SELECT %s,
                                       ROW_NUMBER() OVER (PARTITION BY c.change_id ORDER BY c.content_hash) AS rn
                                FROM commits c LEFT JOIN projects p ON p.project = c.project
                                WHERE c.change_id IN (:ids)
                            ) ranked
                            WHERE ranked.rn <= :perIdentifier
                            ORDER BY change_id, content_hash
                            """.formatted(ROW_COLUMNS))
                    .setParameter("ids", chunk)
                    .setParameter("perIdentifier", perIdentifier);
            return toRows(query.getResultList());
        });
    }

    @SuppressWarnings("unchecked")
    private List<CommitRow> toRows(List<?> resultList) {
        List<CommitRow> rows = new ArrayList<>(resultList.size());
        for (Object[] row : (List<Object[]>) resultList) {
            rows.add(CommitRow.builder()
                    .project((String) row[0])
                    .contentHash((String) row[1])
                    .changeIdentifier((String) row[2])
                    .author((String) row[3])
                    .timestamp((String) row[4])
                    .subject((String) row[5])
                    .body((String) row[6])
                    .classification(row[7] != null ? Classification.fromValue((String) row[7]) : null)
                    .reviewUrl((String) row[8])
                    .remoteUrl((String) row[9])
                    .build());
        }
        return rows;
    }
}

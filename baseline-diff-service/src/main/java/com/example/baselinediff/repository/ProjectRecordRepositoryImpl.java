package com.example.baselinediff.repository;

import com.example.baselinediff.entity.ProjectRecord;
import com.example.baselinediff.repository.support.BatchQueryPlanner;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * UPSERT of manifest projects with native ON CONFLICT.
 */
@Repository
@Slf4j
public class ProjectRecordRepositoryImpl implements ProjectRecordRepositoryCustom {

    private static final int PARAMS_PER_ROW = 5;

    @PersistenceContext
    private EntityManager entityManager;

    private final BatchQueryPlanner planner;

    @Autowired
    public ProjectRecordRepositoryImpl(BatchQueryPlanner planner) {
        this.planner = planner;
    }

    @Override
    @Transactional
    public int upsertAll(List<ProjectRecord> projects) {
        if (projects == null || projects.isEmpty()) {
            return 0;
        }

        // ON CONFLICT DO UPDATE cannot touch the same row twice in one statement; last one wins
        Map<String, ProjectRecord> unique = new LinkedHashMap<>();
        projects.forEach(project -> unique.put(project.getProject(), project));

        Timestamp now = Timestamp.valueOf(LocalDateTime.now());
        int affected = planner.sum(new ArrayList<>(unique.values()), planner.elementsPerChunk(PARAMS_PER_ROW),
                batch -> executeUpsert(batch, now));

        entityManager.flush();
        entityManager.clear();

        log.debug("Upserted {} projects", affected);
        return affected;
    }

    private int executeUpsert(List<ProjectRecord> batch, Timestamp now) {
        StringBuilder sql = new StringBuilder("""
                INSERT INTO projects (project, remote_url, path, created_at, updated_at) VALUES
                """);

        for (int i = 0; i < batch.size(); i++) {
            sql.append("(?, ?, ?, ?, ?)");
            if (i < batch.size() - 1) {
                sql.append(",\n");
            }
        }

        sql.append("""

                ON CONFLICT (project)
                DO UPDATE SET
                    remote_url = EXCLUDED.remote_url,
                    path = EXCLUDED.path,
                    updated_at = EXCLUDED.updated_at
                """);

        Query query = entityManager.createNativeQuery(sql.toString());

        int paramIndex = 1;
        for (ProjectRecord project : batch) {
            query.setParameter(paramIndex++, project.getProject());
            query.setParameter(paramIndex++, CommitRecordRepositoryImpl.nullableString(project.getRemoteUrl()));
            query.setParameter(paramIndex++, CommitRecordRepositoryImpl.nullableString(project.getPath()));
            query.setParameter(paramIndex++, now);
            query.setParameter(paramIndex++, now);
        }

        return query.executeUpdate();
    }
}

package com.example.baselinediff.repository;

import com.example.baselinediff.entity.ProjectRecord;

import java.util.List;

public interface ProjectRecordRepositoryCustom {

    /**
     * Inserts projects, replacing remote URL and path of existing ones.
     *
     * @return number of rows inserted or updated
     */
    int upsertAll(List<ProjectRecord> projects);
}

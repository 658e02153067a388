package com.example.baselinediff.repository;

import com.example.baselinediff.entity.ProjectRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ProjectRecordRepository extends JpaRepository<ProjectRecord, String>, ProjectRecordRepositoryCustom {

    List<ProjectRecord> findByProjectIn(Collection<String> projects);

    @Modifying
    @Query("DELETE FROM ProjectRecord p")
    int deleteAllProjects();
}

package com.example.baselinediff.repository;

import com.example.baselinediff.entity.Classification;
import com.example.baselinediff.entity.CommitRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CommitRecordRepository extends JpaRepository<CommitRecord, Long>, CommitRecordRepositoryCustom {

    Optional<CommitRecord> findByContentHash(String contentHash);

    boolean existsByContentHash(String contentHash);

    long countByClassification(Classification classification);

    long countByClassificationIsNull();

    @Query("SELECT DISTINCT c.project FROM CommitRecord c ORDER BY c.project")
    List<String> findDistinctProjects();

    @Query("SELECT DISTINCT c.author FROM CommitRecord c WHERE c.author IS NOT NULL ORDER BY c.author")
    List<String> findDistinctAuthors();

    @Modifying
    @Query("DELETE FROM CommitRecord c")
    int deleteAllCommits();
}

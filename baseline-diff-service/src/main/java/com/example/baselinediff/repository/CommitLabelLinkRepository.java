package com.example.baselinediff.repository;

import com.example.baselinediff.entity.CommitLabelLink;
import com.example.baselinediff.entity.CommitLabelLinkId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CommitLabelLinkRepository extends JpaRepository<CommitLabelLink, CommitLabelLinkId> {

    List<CommitLabelLink> findByCommitHash(String commitHash);

    @Modifying
    @Query("DELETE FROM CommitLabelLink l WHERE l.commitHash = :commitHash")
    int deleteByCommitHash(@Param("commitHash") String commitHash);

    @Modifying
    @Query("DELETE FROM CommitLabelLink l WHERE l.labelId = :labelId")
    int deleteByLabelId(@Param("labelId") Long labelId);

    @Modifying
    @Query("DELETE FROM CommitLabelLink l")
    int deleteAllLinks();
}

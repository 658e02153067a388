package com.example.baselinediff.repository;

import com.example.baselinediff.entity.ScanJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ScanJobRepository extends JpaRepository<ScanJob, Long> {

    Optional<ScanJob> findTopByOrderByIdDesc();
}

package com.example.baselinediff.repository;

import com.example.baselinediff.entity.Label;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LabelRepository extends JpaRepository<Label, Long> {

    boolean existsByNameIgnoreCase(String name);

    List<Label> findAllByOrderByIdAsc();
}

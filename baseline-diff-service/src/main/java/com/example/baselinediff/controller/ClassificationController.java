package com.example.baselinediff.controller;

import com.example.baselinediff.dto.request.ClassifyRequest;
import com.example.baselinediff.dto.response.ClassificationSummary;
import com.example.baselinediff.service.DiffClassifier;
import com.example.baselinediff.service.progress.ProgressListener;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/classify")
@RequiredArgsConstructor
public class ClassificationController {

    private final DiffClassifier diffClassifier;

    /**
     * Classifies stored commits against the given upstream and vendor project sets.
     * 409 when another classification is running.
     */
    @PostMapping
    public ResponseEntity<ClassificationSummary> classify(@Valid @RequestBody ClassifyRequest request) {
        return ResponseEntity.ok(diffClassifier.classify(
                request.getUpstreamProjects(), request.getVendorProjects(), ProgressListener.NONE));
    }
}

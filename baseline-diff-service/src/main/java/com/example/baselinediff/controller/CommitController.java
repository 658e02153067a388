package com.example.baselinediff.controller;

import com.example.baselinediff.dto.request.AssignLabelsRequest;
import com.example.baselinediff.dto.request.BulkIngestRequest;
import com.example.baselinediff.dto.request.CommitSearchRequest;
import com.example.baselinediff.dto.response.CommitPageResponse;
import com.example.baselinediff.dto.response.IngestResult;
import com.example.baselinediff.dto.response.LabelResponse;
import com.example.baselinediff.service.CommitIngestService;
import com.example.baselinediff.service.CommitQueryService;
import com.example.baselinediff.service.LabelService;
import com.example.baselinediff.service.StoreResetService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for the commit store.
 *
 * - POST   /api/commits/bulk: ingest commits, duplicates ignored
 * - GET    /api/commits: filtered, paged query
 * - DELETE /api/commits: reset commits, projects and label links
 * - PUT    /api/commits/{hash}/labels: replace a commit's labels
 */
@RestController
@RequestMapping("/api/commits")
@RequiredArgsConstructor
@Slf4j
public class CommitController {

    private final CommitIngestService commitIngestService;
    private final CommitQueryService commitQueryService;
    private final LabelService labelService;
    private final StoreResetService storeResetService;

    @PostMapping("/bulk")
    public ResponseEntity<IngestResult> bulkIngest(@Valid @RequestBody BulkIngestRequest request) {
        return ResponseEntity.ok(commitIngestService.ingest(request.getCommits()));
    }

    /**
     * Filters: classification, project, author, search, dateFrom, dateTo, labelId.
     * Paging: limit, offset, unbounded.
     */
    @GetMapping
    public ResponseEntity<CommitPageResponse> searchCommits(@ModelAttribute CommitSearchRequest request) {
        return ResponseEntity.ok(commitQueryService.search(request));
    }

    @DeleteMapping
    public ResponseEntity<Void> resetStore() {
        storeResetService.reset();
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{hash}/labels")
    public ResponseEntity<List<LabelResponse>> assignLabels(
            @PathVariable String hash,
            @Valid @RequestBody AssignLabelsRequest request) {
        return ResponseEntity.ok(labelService.assignLabels(hash, request.getLabelIds()));
    }
}

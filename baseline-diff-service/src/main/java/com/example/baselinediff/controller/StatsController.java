package com.example.baselinediff.controller;

import com.example.baselinediff.dto.response.MetadataResponse;
import com.example.baselinediff.dto.response.StatsResponse;
import com.example.baselinediff.service.CommitQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class StatsController {

    private final CommitQueryService commitQueryService;

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        return ResponseEntity.ok(commitQueryService.stats());
    }

    @GetMapping("/metadata")
    public ResponseEntity<MetadataResponse> metadata() {
        return ResponseEntity.ok(commitQueryService.metadata());
    }
}

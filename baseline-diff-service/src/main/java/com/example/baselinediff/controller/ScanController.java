package com.example.baselinediff.controller;

import com.example.baselinediff.dto.request.ScanRequest;
import com.example.baselinediff.dto.response.ScanJobResponse;
import com.example.baselinediff.service.ScanService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/scans")
@RequiredArgsConstructor
public class ScanController {

    private final ScanService scanService;

    /**
     * Starts a scan of both trees. Poll {@code GET /api/scans/{id}} for progress.
     */
    @PostMapping
    public ResponseEntity<ScanJobResponse> startScan(@Valid @RequestBody ScanRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(scanService.startScan(request));
    }

    @GetMapping("/{scanJobId}")
    public ResponseEntity<ScanJobResponse> getScan(@PathVariable Long scanJobId) {
        return ResponseEntity.ok(scanService.getScan(scanJobId));
    }
}

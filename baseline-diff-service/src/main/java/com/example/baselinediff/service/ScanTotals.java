package com.example.baselinediff.service;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Running ingest counts of one scan. Only touched by the scan job thread.
 */
@Getter
public class ScanTotals {

    private int fetched;
    private int saved;
    private int malformed;
    private final List<String> failedProjects = new ArrayList<>();

    public void add(int fetched, int saved, int malformed) {
        this.fetched += fetched;
        this.saved += saved;
        this.malformed += malformed;
    }

    public void fail(String project) {
        failedProjects.add(project);
    }
}

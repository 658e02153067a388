package com.example.baselinediff.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResult {

    private int received;

    /**
     * Rows newly stored; duplicates of existing hashes are not counted.
     */
    private int inserted;

    private int skippedMalformed;
}

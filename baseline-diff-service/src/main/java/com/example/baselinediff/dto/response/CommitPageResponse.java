package com.example.baselinediff.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitPageResponse {

    /**
     * Rows matching the filters, ignoring limit and offset.
     */
    private long total;

    private List<CommitResponse> commits;

    /**
     * True when an unbounded read hit the hard ceiling and more rows matched.
     */
    private boolean truncated;

    private int limit;
    private int offset;
}

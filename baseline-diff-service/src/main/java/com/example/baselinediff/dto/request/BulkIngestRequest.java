package com.example.baselinediff.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkIngestRequest {

    @NotNull(message = "commits is required")
    private List<CommitInput> commits;
}

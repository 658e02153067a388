package com.example.baselinediff.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Replaces the full label set of a commit.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssignLabelsRequest {

    @NotNull(message = "labelIds is required")
    private List<Long> labelIds;
}

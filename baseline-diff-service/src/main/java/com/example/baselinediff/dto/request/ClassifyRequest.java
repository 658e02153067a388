package com.example.baselinediff.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Project names of the upstream (A) and vendor (B) trees. Either set may be empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifyRequest {

    @NotNull(message = "upstreamProjects is required")
    private Set<String> upstreamProjects;

    @NotNull(message = "vendorProjects is required")
    private Set<String> vendorProjects;
}

package com.example.baselinediff.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequest {

    @NotBlank(message = "upstreamRoot is required")
    private String upstreamRoot;

    @NotBlank(message = "vendorRoot is required")
    private String vendorRoot;
}

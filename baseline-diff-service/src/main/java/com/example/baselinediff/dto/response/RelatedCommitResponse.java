package com.example.baselinediff.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Another commit carrying the same change identifier as the row it is attached to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelatedCommitResponse {

    private String project;
    private String hash;
    private String subject;
    private String url;
}

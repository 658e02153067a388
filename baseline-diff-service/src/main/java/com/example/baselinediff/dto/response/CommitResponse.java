package com.example.baselinediff.dto.response;

import com.example.baselinediff.entity.Classification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitResponse {

    private String project;
    private String hash;
    private String changeId;
    private String author;
    private String date;
    private String subject;
    private String message;
    private Classification classification;
    private String reviewUrl;
    private String remoteUrl;

    /**
     * Review URL if present, else a commit link derived from the project remote.
     */
    private String url;

    @Builder.Default
    private List<CommitLabelResponse> labels = new ArrayList<>();

    @Builder.Default
    private List<RelatedCommitResponse> relatedCommits = new ArrayList<>();
}

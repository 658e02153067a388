package com.example.baselinediff.entity;

import lombok.*;

import java.io.Serializable;

/**
 * Composite primary key for CommitLabelLink.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class CommitLabelLinkId implements Serializable {

    private String commitHash;

    private Long labelId;
}

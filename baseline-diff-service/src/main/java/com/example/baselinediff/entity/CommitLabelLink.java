package com.example.baselinediff.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Junction row between a commit (by content hash) and a label.
 */
@Entity
@Table(name = "commit_labels", indexes = {
        @Index(name = "idx_commit_labels_label", columnList = "label_id")
})
@IdClass(CommitLabelLinkId.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CommitLabelLink {

    @Id
    @Column(name = "commit_hash", nullable = false, length = 64)
    private String commitHash;

    @Id
    @Column(name = "label_id", nullable = false)
    private Long labelId;
}

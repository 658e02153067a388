package com.example.baselinediff.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * A project listed in a repo manifest. Replaced on every manifest read.
 */
@Entity
@Table(name = "projects")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProjectRecord extends BaseEntity {

    @Id
    @Column(name = "project", nullable = false)
    private String project;

    /**
     * Base fetch URL of the project's remote; null when the manifest names none.
     */
    @Column(name = "remote_url", columnDefinition = "TEXT")
    private String remoteUrl;

    @Column(name = "path", columnDefinition = "TEXT")
    private String path;
}

package com.example.baselinediff.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Free-form category that can be attached to commits.
 */
@Entity
@Table(name = "labels",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_labels_name", columnNames = {"name"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Label {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "is_default", nullable = false)
    private boolean defaultLabel;
}

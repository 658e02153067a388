package com.example.baselinediff.client.manifest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * A {@code <project>} entry of a repo manifest with its remote resolved.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class ManifestProject {

    private final String name;

    /**
     * Checkout path relative to the tree root; defaults to the project name.
     */
    private final String path;

    private final Path directory;

    /**
     * Fetch URL of the project's remote without trailing slash, or null.
     */
    private final String remoteUrl;
}

package com.example.baselinediff.client.git;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the commit history of one project checkout, most recent first.
 */
public interface CommitLogReader {

    /**
     * @param project    project name stamped on every returned commit
     * @param repository checkout directory of the project
     * @param maxCount   maximum commits to read; 0 or less reads everything
     * @return commits, or an empty list when the directory is missing or not a repository
     * @throws IOException when the repository exists but cannot be read
     */
    List<RawCommit> read(String project, Path repository, int maxCount) throws IOException;
}

package com.example.baselinediff.client.git;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.PersonIdent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JGitCommitLogReaderTest {

    private final JGitCommitLogReader reader = new JGitCommitLogReader();

    @TempDir
    Path tempDir;

    @Test
    void readsCommitsNewestFirst_WithTrailersAndUtcTimestamps() throws Exception {
        Path repoDir = tempDir.resolve("core");
        try (Git git = Git.init().setDirectory(repoDir.toFile()).call()) {
            commit(git, repoDir, "a.txt", "Initial import\n\nChange-Id: I000aaa\n",
                    Instant.parse("2024-01-01T10:00:00Z"));
            commit(git, repoDir, "b.txt", "Fix build\n\nDetails here.\n\nChange-Id: I000bbb\n"
                            + "Reviewed-on: https://review.example.com/c/core/+/42\n",
                    Instant.parse("2024-01-02T10:00:00Z"));
        }

        List<RawCommit> commits = reader.read("up/core", repoDir, 0);

        assertThat(commits).hasSize(2);
        RawCommit newest = commits.get(0);
        assertThat(newest.getProject()).isEqualTo("up/core");
        assertThat(newest.getContentHash()).hasSize(40).matches("[0-9a-f]+");
        assertThat(newest.getChangeIdentifier()).isEqualTo("I000bbb");
        assertThat(newest.getReviewUrl()).isEqualTo("https://review.example.com/c/core/+/42");
        assertThat(newest.getSubject()).isEqualTo("Fix build");
        assertThat(newest.getBody()).startsWith("Details here.");
        assertThat(newest.getAuthor()).isEqualTo("Alice Example");
        // author date was +08:00 local time; stored as UTC
        assertThat(newest.getTimestamp()).isEqualTo("2024-01-02T10:00:00Z");
        assertThat(commits.get(1).getChangeIdentifier()).isEqualTo("I000aaa");
        assertThat(commits.get(1).getReviewUrl()).isNull();
    }

    @Test
    void maxCount_LimitsCommitsRead() throws Exception {
        Path repoDir = tempDir.resolve("limited");
        try (Git git = Git.init().setDirectory(repoDir.toFile()).call()) {
            for (int i = 0; i < 3; i++) {
                commit(git, repoDir, "f" + i + ".txt", "Commit " + i, Instant.parse("2024-02-0" + (i + 1) + "T00:00:00Z"));
            }
        }

        assertThat(reader.read("limited", repoDir, 2)).hasSize(2);
    }

    @Test
    void missingDirectory_YieldsEmptyList() throws Exception {
        assertThat(reader.read("ghost", tempDir.resolve("does-not-exist"), 0)).isEmpty();
    }

    @Test
    void directoryWithoutRepository_YieldsEmptyList() throws Exception {
        Path plain = Files.createDirectories(tempDir.resolve("plain"));

        assertThat(reader.read("plain", plain, 0)).isEmpty();
    }

    @Test
    void repositoryWithoutCommits_YieldsEmptyList() throws Exception {
        Path repoDir = tempDir.resolve("empty");
        Git.init().setDirectory(repoDir.toFile()).call().close();

        assertThat(reader.read("empty", repoDir, 0)).isEmpty();
    }

    private static void commit(Git git, Path repoDir, String file, String message, Instant when) throws Exception {
        Files.writeString(repoDir.resolve(file), message);
        git.add().addFilepattern(file).call();
        PersonIdent ident = new PersonIdent("Alice Example", "alice@example.com", when, ZoneId.of("+08:00"));
        git.commit()
                .setMessage(message)
                .setAuthor(ident)
                .setCommitter(ident)
                .setSign(false)
                .call();
    }
}

package com.example.baselinediff.client.git;

import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.LogCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.NoHeadException;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.revwalk.RevCommit;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link CommitLogReader} backed by JGit, walking from HEAD.
 */
@Component
@Slf4j
public class JGitCommitLogReader implements CommitLogReader {

    @Override
    public List<RawCommit> read(String project, Path repository, int maxCount) throws IOException {
        if (!Files.isDirectory(repository)) {
            log.warn("Project {} checkout {} does not exist, skipping", project, repository);
            return Collections.emptyList();
        }

        try (Git git = Git.open(repository.toFile())) {
            LogCommand logCommand = git.log();
            if (maxCount > 0) {
                logCommand.setMaxCount(maxCount);
            }

            List<RawCommit> commits = new ArrayList<>();
            for (RevCommit commit : logCommand.call()) {
                commits.add(toRawCommit(project, commit));
            }
            log.debug("Read {} commits from project {}", commits.size(), project);
            return commits;
        } catch (RepositoryNotFoundException e) {
            log.warn("Project {} checkout {} is not a git repository, skipping", project, repository);
            return Collections.emptyList();
        } catch (NoHeadException e) {
            log.warn("Project {} has no HEAD commit, skipping", project);
            return Collections.emptyList();
        } catch (GitAPIException e) {
            throw new IOException("Cannot read log of project " + project + ": " + e.getMessage(), e);
        }
    }

    private RawCommit toRawCommit(String project, RevCommit commit) {
        String message = commit.getFullMessage();
        PersonIdent author = commit.getAuthorIdent();
        return RawCommit.builder()
                .project(project)
                .contentHash(commit.getId().name())
                .changeIdentifier(CommitTrailers.changeId(message))
                .author(author != null ? author.getName() : null)
                .timestamp(author != null
                        ? DateTimeFormatter.ISO_INSTANT.format(author.getWhenAsInstant())
                        : DateTimeFormatter.ISO_INSTANT.format(commit.getCommitterIdent().getWhenAsInstant()))
                .subject(CommitTrailers.subject(message))
                .body(CommitTrailers.body(message))
                .reviewUrl(CommitTrailers.reviewedOn(message))
                .build();
    }
}

package com.example.baselinediff.service;

import com.example.baselinediff.client.git.RawCommit;
import com.example.baselinediff.dto.request.CommitInput;
import com.example.baselinediff.entity.CommitRecord;
import com.example.baselinediff.exception.MalformedInputException;
import org.springframework.stereotype.Component;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates raw commit input and maps it to {@link CommitRecord}.
 *
 * Content hashes are lowercased and must be 40 (SHA-1) or 64 (SHA-256) hex
 * characters. Timestamps are normalized to UTC ISO-8601 instants at second
 * precision so that string order matches chronological order. Values longer
 * than their storage column are rejected as malformed.
 */
@Component
public class CommitRecordMapper {

    static final int MAX_PROJECT_LENGTH = 255;
    static final int MAX_CHANGE_ID_LENGTH = 255;
    static final int MAX_AUTHOR_LENGTH = 255;

    private static final Pattern HASH = Pattern.compile("[0-9a-f]{40}|[0-9a-f]{64}");

    // git log --date=iso output, e.g. "2024-03-01 10:15:30 +0800"
    private static final DateTimeFormatter GIT_ISO = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z", Locale.ROOT);

    /**
     * @throws MalformedInputException when project or hash is missing, or a field is invalid
     */
    public CommitRecord toEntity(CommitInput input) {
        if (input == null) {
            throw MalformedInputException.missingField("commit");
        }
        return build(input.getProject(), input.getHash(), input.getChangeId(), input.getAuthor(),
                input.getDate(), input.getSubject(), input.getMessage(), input.getReviewUrl());
    }

    public CommitRecord toEntity(RawCommit raw) {
        return build(raw.getProject(), raw.getContentHash(), raw.getChangeIdentifier(), raw.getAuthor(),
                raw.getTimestamp(), raw.getSubject(), raw.getBody(), raw.getReviewUrl());
    }

    private CommitRecord build(String project, String hash, String changeId, String author, String timestamp,
                               String subject, String body, String reviewUrl) {
        if (project == null || project.isBlank()) {
            throw MalformedInputException.missingField("project");
        }
        if (hash == null || hash.isBlank()) {
            throw MalformedInputException.missingField("hash");
        }
        String normalizedProject = checkLength("project", project.strip(), MAX_PROJECT_LENGTH);
        String normalizedChangeId = checkLength("changeId", blankToNull(changeId), MAX_CHANGE_ID_LENGTH);
        return CommitRecord.builder()
                .project(normalizedProject)
                .contentHash(normalizeHash(hash))
                .changeIdentifier(normalizedChangeId)
                .author(checkLength("author", author, MAX_AUTHOR_LENGTH))
                .timestamp(normalizeTimestamp(timestamp))
                .subject(subject != null ? subject : "")
                .body(body != null ? body : "")
                .reviewUrl(blankToNull(reviewUrl))
                .build();
    }

    static String normalizeHash(String hash) {
        String normalized = hash.strip().toLowerCase(Locale.ROOT);
        if (!HASH.matcher(normalized).matches()) {
            throw MalformedInputException.invalidHash(hash);
        }
        return normalized;
    }

    /**
     * Accepts ISO instants, offset date-times, git's {@code --date=iso} form and
     * zone-less date-times (read as UTC). Fractions of a second are dropped.
     * Returns null for a blank value.
     */
    static String normalizeTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return null;
        }
        String value = timestamp.strip();
        Instant instant;
        try {
            instant = OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException notOffset) {
            try {
                instant = OffsetDateTime.parse(value, GIT_ISO).toInstant();
            } catch (DateTimeParseException notGitIso) {
                try {
                    instant = LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException notLocal) {
                    throw MalformedInputException.invalidTimestamp(timestamp);
                }
            }
        }
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    private static String checkLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw MalformedInputException.fieldTooLong(field, max);
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}

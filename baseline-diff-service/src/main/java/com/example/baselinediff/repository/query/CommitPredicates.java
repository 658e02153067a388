package com.example.baselinediff.repository.query;

import com.example.baselinediff.entity.Classification;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory for the supported {@link CommitPredicate} variants.
 */
public final class CommitPredicates {

    private static final char LIKE_ESCAPE = '!';

    private CommitPredicates() {
    }

    public static CommitPredicate classification(Classification classification) {
        return new ClassificationEquals(Objects.requireNonNull(classification, "classification"));
    }

    public static CommitPredicate project(String project) {
        return new ProjectEquals(Objects.requireNonNull(project, "project"));
    }

    public static CommitPredicate authorContains(String fragment) {
        return new AuthorContains(Objects.requireNonNull(fragment, "fragment"));
    }

    public static CommitPredicate search(String text) {
        return new SearchText(Objects.requireNonNull(text, "text"));
    }

    /**
     * Inclusive range over the calendar date of the commit timestamp; either bound may be null.
     */
    public static CommitPredicate dateRange(LocalDate from, LocalDate to) {
        if (from == null && to == null) {
            throw new IllegalArgumentException("date range needs at least one bound");
        }
        return new DateRange(from, to);
    }

    public static CommitPredicate label(Long labelId) {
        return new HasLabel(Objects.requireNonNull(labelId, "labelId"));
    }

    /**
     * Lowercases the fragment and escapes LIKE wildcards so user input matches literally.
     */
    static String containsPattern(String fragment) {
        String lowered = fragment.toLowerCase(Locale.ROOT);
        StringBuilder pattern = new StringBuilder(lowered.length() + 2).append('%');
        for (char ch : lowered.toCharArray()) {
            if (ch == '%' || ch == '_' || ch == LIKE_ESCAPE) {
                pattern.append(LIKE_ESCAPE);
            }
            pattern.append(ch);
        }
        return pattern.append('%').toString();
    }

    record ClassificationEquals(Classification classification) implements CommitPredicate {
        @Override
        public Kind kind() {
            return Kind.CLASSIFICATION;
        }

        @Override
        public void compile(SqlConditions conditions) {
            conditions.add("c.classification = :" + conditions.bind(classification.getValue()));
        }
    }

    record ProjectEquals(String project) implements CommitPredicate {
        @Override
        public Kind kind() {
            return Kind.PROJECT;
        }

        @Override
        public void compile(SqlConditions conditions) {
            conditions.add("c.project = :" + conditions.bind(project));
        }
    }

    record AuthorContains(String fragment) implements CommitPredicate {
        @Override
        public Kind kind() {
            return Kind.AUTHOR;
        }

        @Override
        public void compile(SqlConditions conditions) {
            String name = conditions.bind(containsPattern(fragment));
            conditions.add("LOWER(c.author) LIKE :" + name + " ESCAPE '" + LIKE_ESCAPE + "'");
        }
    }

    record SearchText(String text) implements CommitPredicate {
        @Override
        public Kind kind() {
            return Kind.SEARCH;
        }

        @Override
        public void compile(SqlConditions conditions) {
            String name = conditions.bind(containsPattern(text));
            conditions.add("(LOWER(c.subject) LIKE :" + name + " ESCAPE '" + LIKE_ESCAPE + "'"
                    + " OR LOWER(c.body) LIKE :" + name + " ESCAPE '" + LIKE_ESCAPE + "')");
        }
    }

    // Timestamps are stored as ISO-8601 UTC strings, so the first ten characters are the date
    record DateRange(LocalDate from, LocalDate to) implements CommitPredicate {
        @Override
        public Kind kind() {
            return Kind.DATE_RANGE;
        }

        @Override
        public void compile(SqlConditions conditions) {
            if (from != null) {
                conditions.add("SUBSTRING(c.committed_at, 1, 10) >= :" + conditions.bind(from.toString()));
            }
            if (to != null) {
                conditions.add("SUBSTRING(c.committed_at, 1, 10) <= :" + conditions.bind(to.toString()));
            }
        }
    }

    record HasLabel(Long labelId) implements CommitPredicate {
        @Override
        public Kind kind() {
            return Kind.LABEL;
        }

        @Override
        public void compile(SqlConditions conditions) {
            conditions.add("EXISTS (SELECT 1 FROM commit_labels cl WHERE cl.commit_hash = c.content_hash"
                    + " AND cl.label_id = :" + conditions.bind(labelId) + ")");
        }
    }
}

package com.example.baselinediff.repository.query;

/**
 * One conjunctive filter over the {@code commits} table (alias {@code c}).
 * Implementations append a parameterized clause to the supplied conditions;
 * values are never concatenated into SQL text.
 */
public interface CommitPredicate {

    Kind kind();

    void compile(SqlConditions conditions);

    enum Kind {
        CLASSIFICATION,
        PROJECT,
        AUTHOR,
        SEARCH,
        DATE_RANGE,
        LABEL
    }
}

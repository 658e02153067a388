package com.example.baselinediff.repository.query;

import jakarta.persistence.Query;

import java.util.*;

/**
 * Accumulates WHERE clauses and their named parameters.
 */
public class SqlConditions {

    private final List<String> clauses = new ArrayList<>();
    private final Map<String, Object> parameters = new LinkedHashMap<>();

    /**
     * Registers a value under a fresh parameter name and returns the name, without the colon.
     */
    public String bind(Object value) {
        String name = "p" + parameters.size();
        parameters.put(name, value);
        return name;
    }

    public SqlConditions add(String clause) {
        clauses.add(clause);
        return this;
    }

    public static SqlConditions of(Collection<? extends CommitPredicate> predicates) {
        SqlConditions conditions = new SqlConditions();
        if (predicates != null) {
            predicates.forEach(predicate -> predicate.compile(conditions));
        }
        return conditions;
    }

    /**
     * Renders {@code " WHERE a AND b"}, or an empty string when unconstrained.
     */
    public String whereClause() {
        if (clauses.isEmpty()) {
            return "";
        }
        return " WHERE " + String.join(" AND ", clauses);
    }

    public void applyTo(Query query) {
        parameters.forEach(query::setParameter);
    }

    public List<String> getClauses() {
        return Collections.unmodifiableList(clauses);
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }
}

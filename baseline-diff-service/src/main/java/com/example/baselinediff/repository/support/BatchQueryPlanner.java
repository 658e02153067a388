package com.example.baselinediff.repository.support;

import java.util.*;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Splits parameter lists into chunks no larger than the storage engine's
 * bound-parameter ceiling, runs an operation per chunk in index order and
 * aggregates the results.
 *
 * Empty input never invokes the operation. Input no larger than the ceiling
 * invokes it exactly once.
 */
public class BatchQueryPlanner {

    public static final int DEFAULT_CEILING = 500;

    private final int ceiling;

    public BatchQueryPlanner() {
        this(DEFAULT_CEILING);
    }

    public BatchQueryPlanner(int ceiling) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("batch ceiling must be >= 1, got " + ceiling);
        }
        this.ceiling = ceiling;
    }

    public int getCeiling() {
        return ceiling;
    }

    /**
     * Union of per-chunk read results.
     */
    public <T, R> Set<R> union(Collection<T> params, Function<List<T>, ? extends Collection<R>> operation) {
        Set<R> identity = new LinkedHashSet<>();
        return this.<T, Collection<R>, Set<R>>execute(params, ceiling, chunk -> operation.apply(chunk), identity,
                (acc, rows) -> {
                    acc.addAll(rows);
                    return acc;
                });
    }

    /**
     * Sum of per-chunk affected-row counts.
     */
    public <T> int sum(Collection<T> params, ToIntFunction<List<T>> operation) {
        return sum(params, ceiling, operation);
    }

    /**
     * Same as {@link #sum(Collection, ToIntFunction)} with an explicit chunk size,
     * for statements that bind several parameters per element (multi-row inserts).
     */
    public <T> int sum(Collection<T> params, int chunkSize, ToIntFunction<List<T>> operation) {
        return this.<T, Integer, Integer>execute(params, chunkSize, operation::applyAsInt, 0, Integer::sum);
    }

    /**
     * Concatenation of per-chunk row fetches, in chunk order.
     */
    public <T, R> List<R> concat(Collection<T> params, Function<List<T>, ? extends List<R>> operation) {
        List<R> identity = new ArrayList<>();
        return this.<T, List<R>, List<R>>execute(params, ceiling, chunk -> operation.apply(chunk), identity,
                (acc, rows) -> {
                    acc.addAll(rows);
                    return acc;
                });
    }

    /**
     * Elements per chunk for a statement binding {@code paramsPerElement} values per element.
     */
    public int elementsPerChunk(int paramsPerElement) {
        return Math.max(1, ceiling / Math.max(1, paramsPerElement));
    }

    public <T, R, A> A execute(Collection<T> params, int chunkSize, Function<List<T>, R> operation,
                               A identity, BiFunction<A, R, A> accumulator) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunk size must be >= 1, got " + chunkSize);
        }
        A result = identity;
        if (params == null || params.isEmpty()) {
            return result;
        }
        List<T> ordered = params instanceof List<T> list ? list : new ArrayList<>(params);
        for (int start = 0; start < ordered.size(); start += chunkSize) {
            int end = Math.min(start + chunkSize, ordered.size());
            result = accumulator.apply(result, operation.apply(ordered.subList(start, end)));
        }
        return result;
    }
}

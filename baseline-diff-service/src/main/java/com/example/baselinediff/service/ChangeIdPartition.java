package com.example.baselinediff.service;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Three-way split of the change identifiers seen in tree A and tree B.
 * Sets are sorted so write-back order is stable across runs.
 */
public final class ChangeIdPartition {

    private final SortedSet<String> shared;
    private final SortedSet<String> aOnly;
    private final SortedSet<String> bOnly;
    private final int totalA;
    private final int totalB;

    private ChangeIdPartition(SortedSet<String> shared, SortedSet<String> aOnly, SortedSet<String> bOnly,
                              int totalA, int totalB) {
        this.shared = Collections.unmodifiableSortedSet(shared);
        this.aOnly = Collections.unmodifiableSortedSet(aOnly);
        this.bOnly = Collections.unmodifiableSortedSet(bOnly);
        this.totalA = totalA;
        this.totalB = totalB;
    }

    public static ChangeIdPartition of(Collection<String> idsA, Collection<String> idsB) {
        SortedSet<String> a = nonEmpty(idsA);
        SortedSet<String> b = nonEmpty(idsB);

        SortedSet<String> shared = new TreeSet<>(a);
        shared.retainAll(b);
        SortedSet<String> aOnly = new TreeSet<>(a);
        aOnly.removeAll(b);
        SortedSet<String> bOnly = new TreeSet<>(b);
        bOnly.removeAll(a);

        return new ChangeIdPartition(shared, aOnly, bOnly, a.size(), b.size());
    }

    private static SortedSet<String> nonEmpty(Collection<String> ids) {
        SortedSet<String> result = new TreeSet<>();
        if (ids != null) {
            for (String id : ids) {
                if (id != null && !id.isEmpty()) {
                    result.add(id);
                }
            }
        }
        return result;
    }

    public SortedSet<String> getShared() {
        return shared;
    }

    public SortedSet<String> getAOnly() {
        return aOnly;
    }

    public SortedSet<String> getBOnly() {
        return bOnly;
    }

    public int getTotalA() {
        return totalA;
    }

    public int getTotalB() {
        return totalB;
    }
}

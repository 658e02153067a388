package com.example.baselinediff.repository.support;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchQueryPlannerTest {

    private static final int CEILING = 500;

    private final BatchQueryPlanner planner = new BatchQueryPlanner(CEILING);

    /**
     * Chunked union must equal the unchunked result for 0, 1, ceiling and 3x ceiling inputs.
     */
    @Test
    void union_MatchesSingleQuery_ForBoundarySizes() {
        for (int size : new int[]{0, 1, CEILING, 3 * CEILING}) {
            List<String> params = values(size);
            List<List<String>> chunks = new ArrayList<>();

            Set<String> result = planner.<String, String>union(params, chunk -> {
                chunks.add(List.copyOf(chunk));
                return chunk.stream().map(v -> "id-" + v).collect(Collectors.toList());
            });

            Set<String> expected = params.stream().map(v -> "id-" + v).collect(Collectors.toSet());
            assertThat(result).as("size %d", size).isEqualTo(expected);
            assertThat(chunks).as("size %d", size).hasSize((size + CEILING - 1) / CEILING);
            assertThat(chunks).allSatisfy(chunk -> assertThat(chunk).hasSizeLessThanOrEqualTo(CEILING));
        }
    }

    @Test
    void emptyInput_NeverInvokesOperation() {
        int[] calls = {0};

        int affected = planner.sum(List.<String>of(), chunk -> {
            calls[0]++;
            return chunk.size();
        });

        assertThat(affected).isZero();
        assertThat(calls[0]).isZero();
    }

    @Test
    void inputWithinCeiling_InvokesOperationExactlyOnce() {
        int[] calls = {0};

        int affected = planner.sum(values(CEILING), chunk -> {
            calls[0]++;
            return chunk.size();
        });

        assertThat(affected).isEqualTo(CEILING);
        assertThat(calls[0]).isEqualTo(1);
    }

    @Test
    void sum_AddsRowCountsAcrossChunks() {
        int affected = planner.sum(values(3 * CEILING + 7), List::size);

        assertThat(affected).isEqualTo(3 * CEILING + 7);
    }

    @Test
    void concat_PreservesIndexOrder() {
        BatchQueryPlanner small = new BatchQueryPlanner(2);
        List<String> params = values(5);

        List<String> rows = small.<String, String>concat(params, chunk -> new ArrayList<>(chunk));

        assertThat(rows).containsExactlyElementsOf(params);
    }

    @Test
    void elementsPerChunk_DividesCeilingByParamsPerElement() {
        assertThat(planner.elementsPerChunk(9)).isEqualTo(55);
        assertThat(new BatchQueryPlanner(3).elementsPerChunk(9)).isEqualTo(1);
    }

    @Test
    void ceilingBelowOne_IsRejected() {
        assertThatThrownBy(() -> new BatchQueryPlanner(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<String> values(int size) {
        return IntStream.range(0, size).mapToObj(i -> String.format("v%05d", i)).collect(Collectors.toList());
    }
}

package com.circuitinsight.core.metrics;

import com.circuitinsight.core.model.FunctionMetric;

import java.util.Comparator;
import java.util.List;

/**
 * Top-K selection over function metrics, the function-level counterpart of
 * {@link HotspotSelector}.
 */
public final class FunctionRanking {

    /** Most expensive first; equal costs keep declaration order (the sort is stable). */
    public static final Comparator<FunctionMetric> BY_COST_DESCENDING =
        Comparator.comparingLong(FunctionMetric::totalCost).reversed();

    private FunctionRanking() {
        // Utility class
    }

    /**
     * Returns the {@code k} most expensive functions.
     *
     * @param functions function metrics in any order
     * @param k maximum number of functions
     * @return at most {@code k} functions, most expensive first
     */
    public static List<FunctionMetric> top(List<FunctionMetric> functions, int k) {
        if (functions == null || k <= 0) {
            return List.of();
        }
        return functions.stream()
            .sorted(BY_COST_DESCENDING)
            .limit(k)
            .toList();
    }
}

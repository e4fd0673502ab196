package com.circuitinsight.core.metrics;

import com.circuitinsight.core.model.MetricType;

import java.util.Objects;

/**
 * Criteria for selecting hotspot lines.
 *
 * @param metricType metric compared against the threshold when sorting by {@link SortKey#ABSOLUTE}
 * @param minimumThreshold fraction of the circuit (0.05 = 5%) for {@link SortKey#PERCENTAGE},
 *                         or a minimum metric value for {@link SortKey#ABSOLUTE}
 * @param sortBy filter and sort key
 * @param maxResults maximum number of hotspots returned
 */
public record HotspotCriteria(
    MetricType metricType,
    double minimumThreshold,
    SortKey sortBy,
    int maxResults
) {
    /**
     * What hotspots are filtered and sorted by.
     */
    public enum SortKey {
        /** Share of the circuit total */
        PERCENTAGE,
        /** Absolute value of the selected metric */
        ABSOLUTE
    }

    public HotspotCriteria {
        Objects.requireNonNull(metricType, "metricType must not be null");
        Objects.requireNonNull(sortBy, "sortBy must not be null");
        if (minimumThreshold < 0) {
            throw new IllegalArgumentException("minimumThreshold must be >= 0");
        }
        if (maxResults < 0) {
            throw new IllegalArgumentException("maxResults must be >= 0");
        }
    }

    /**
     * Lines using at least 5% of the circuit, by percentage, at most 10.
     *
     * @return default criteria
     */
    public static HotspotCriteria defaults() {
        return new HotspotCriteria(MetricType.TOTAL, 0.05, SortKey.PERCENTAGE, 10);
    }
}

package com.circuitinsight.core.metrics;

import com.circuitinsight.core.model.MetricType;

import java.util.Objects;

/**
 * Which lines a heatmap shows.
 *
 * @param metricType metric shown in badges
 * @param thresholdPercent minimum share of the circuit, in percent
 * @param fileName file to render; null for the primary file
 * @param topN maximum number of entries, 0 for no limit
 */
public record HeatmapFilter(
    MetricType metricType,
    double thresholdPercent,
    String fileName,
    int topN
) {
    public HeatmapFilter {
        Objects.requireNonNull(metricType, "metricType must not be null");
        if (topN < 0) {
            throw new IllegalArgumentException("topN must be >= 0");
        }
    }

    /**
     * Every line of the primary file, showing the given metric.
     *
     * @param metricType metric shown in badges
     * @return filter without threshold or limit
     */
    public static HeatmapFilter all(MetricType metricType) {
        return new HeatmapFilter(metricType, 0.0, null, 0);
    }
}

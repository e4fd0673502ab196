package com.circuitinsight.core.model;

/**
 * Display data for one line of a cost heatmap.
 *
 * <p>Carries only the numbers and labels; colouring and placement are up to the renderer.
 *
 * @param lineNumber line number
 * @param heatValue normalized heat in {@code [0, 1]}
 * @param primaryMetric value of the selected metric
 * @param metricType selected metric
 * @param badgeText compact label such as {@code 12ops} or {@code 40g}
 * @param tooltipText per-domain breakdown
 */
public record HeatmapEntry(
    int lineNumber,
    double heatValue,
    long primaryMetric,
    MetricType metricType,
    String badgeText,
    String tooltipText
) {
}

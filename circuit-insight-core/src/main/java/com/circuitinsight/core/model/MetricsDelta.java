package com.circuitinsight.core.model;

/**
 * Change of one line's metric between two runs.
 *
 * @param file file of the line
 * @param lineNumber line number
 * @param previousValue metric value in the baseline run
 * @param currentValue metric value in the current run
 * @param delta {@code currentValue - previousValue}
 * @param deltaPercent delta relative to the baseline value, 0 when the baseline is 0
 */
public record MetricsDelta(
    String file,
    int lineNumber,
    long previousValue,
    long currentValue,
    long delta,
    double deltaPercent
) {
    public boolean isImprovement() {
        return delta < 0;
    }

    public boolean isRegression() {
        return delta > 0;
    }
}

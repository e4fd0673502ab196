package com.circuitinsight.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Comparison of a report against a baseline run.
 *
 * @param metricType metric that was compared
 * @param deltas per-line changes; lines whose value did not change are omitted
 * @param overallChange change of the circuit-wide total
 * @param overallChangePercent overall change relative to the baseline total
 * @param comparedAt when the comparison was made
 * @param baselineLabel human-readable name of the baseline
 */
public record MetricsComparison(
    MetricType metricType,
    List<MetricsDelta> deltas,
    long overallChange,
    double overallChangePercent,
    Instant comparedAt,
    String baselineLabel
) {
    public MetricsComparison {
        Objects.requireNonNull(metricType, "metricType must not be null");
        deltas = deltas == null ? List.of() : List.copyOf(deltas);
        Objects.requireNonNull(comparedAt, "comparedAt must not be null");
    }

    /**
     * Returns true when the circuit-wide total went down.
     *
     * @return true if {@code overallChange < 0}
     */
    public boolean isImprovement() {
        return overallChange < 0;
    }

    public List<MetricsDelta> regressions() {
        return deltas.stream().filter(MetricsDelta::isRegression).toList();
    }

    public List<MetricsDelta> improvements() {
        return deltas.stream().filter(MetricsDelta::isImprovement).toList();
    }
}

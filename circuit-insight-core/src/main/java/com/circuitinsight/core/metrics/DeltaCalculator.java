package com.circuitinsight.core.metrics;

import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.LineMetric;
import com.circuitinsight.core.model.MetricType;
import com.circuitinsight.core.model.MetricsComparison;
import com.circuitinsight.core.model.MetricsDelta;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes per-line and circuit-wide changes between two reports.
 */
public final class DeltaCalculator {

    /** Label of the baseline used by run-to-run comparisons. */
    public static final String PREVIOUS_RUN = "Previous Run";

    private DeltaCalculator() {
        // Utility class
    }

    /**
     * Compares {@code current} with {@code previous}.
     *
     * <p>Only lines present in both reports (same file and line number) are compared, and lines
     * whose value did not change are omitted.
     *
     * @param current current report
     * @param previous baseline report
     * @param metricType metric to compare
     * @param comparedAt comparison timestamp
     * @return comparison
     */
    public static MetricsComparison compare(
        ComplexityReport current,
        ComplexityReport previous,
        MetricType metricType,
        Instant comparedAt
    ) {
        Objects.requireNonNull(current, "current must not be null");
        Objects.requireNonNull(previous, "previous must not be null");
        MetricType metric = metricType == null ? MetricType.TOTAL : metricType;

        Map<LineKey, LineMetric> previousLines = new HashMap<>();
        for (LineMetric line : previous.lines()) {
            previousLines.put(new LineKey(line.file(), line.lineNumber()), line);
        }

        List<MetricsDelta> deltas = new ArrayList<>();
        for (LineMetric line : current.lines()) {
            LineMetric before = previousLines.get(new LineKey(line.file(), line.lineNumber()));
            if (before == null) {
                continue;
            }
            long currentValue = metric.extract(line);
            long previousValue = metric.extract(before);
            long delta = currentValue - previousValue;
            if (delta != 0) {
                deltas.add(new MetricsDelta(
                    line.file(),
                    line.lineNumber(),
                    previousValue,
                    currentValue,
                    delta,
                    percentChange(delta, previousValue)
                ));
            }
        }

        long previousTotal = metric.total(previous);
        long overallChange = metric.total(current) - previousTotal;

        return new MetricsComparison(
            metric,
            deltas,
            overallChange,
            percentChange(overallChange, previousTotal),
            comparedAt,
            PREVIOUS_RUN
        );
    }

    private static double percentChange(long delta, long baseline) {
        return baseline > 0 ? 100.0 * delta / baseline : 0.0;
    }

    private record LineKey(String file, int lineNumber) {
    }
}

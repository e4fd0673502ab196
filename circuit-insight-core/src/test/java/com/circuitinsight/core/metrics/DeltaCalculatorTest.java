package com.circuitinsight.core.metrics;

import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.FileMetric;
import com.circuitinsight.core.model.LineMetric;
import com.circuitinsight.core.model.MetricType;
import com.circuitinsight.core.model.MetricsComparison;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link DeltaCalculator}.
 */
class DeltaCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void compare_identicalReports_hasNoChange() {
        ComplexityReport report = report(line(3, 10, 100), line(4, 5, 0));

        MetricsComparison comparison = DeltaCalculator.compare(report, report, MetricType.TOTAL, NOW);

        assertThat(comparison.deltas()).isEmpty();
        assertThat(comparison.overallChange()).isZero();
        assertThat(comparison.overallChangePercent()).isZero();
        assertThat(comparison.isImprovement()).isFalse();
    }

    @Test
    void compare_changedLines_reportsSignedDeltas() {
        ComplexityReport previous = report(line(3, 10, 100), line(4, 5, 0), line(9, 1, 1));
        ComplexityReport current = report(line(3, 10, 60), line(4, 5, 20), line(10, 1, 1));

        MetricsComparison comparison = DeltaCalculator.compare(current, previous, MetricType.GATES, NOW);

        assertThat(comparison.deltas()).hasSize(2);
        assertThat(comparison.improvements()).singleElement().satisfies(delta -> {
            assertThat(delta.lineNumber()).isEqualTo(3);
            assertThat(delta.delta()).isEqualTo(-40);
            assertThat(delta.deltaPercent()).isCloseTo(-40.0, within(1e-9));
        });
        assertThat(comparison.regressions()).singleElement().satisfies(delta -> {
            assertThat(delta.lineNumber()).isEqualTo(4);
            assertThat(delta.previousValue()).isZero();
            assertThat(delta.deltaPercent()).isZero();
        });
        assertThat(comparison.overallChange()).isEqualTo(-20);
        assertThat(comparison.isImprovement()).isTrue();
        assertThat(comparison.comparedAt()).isEqualTo(NOW);
    }

    @Test
    void compare_nullMetric_defaultsToTotal() {
        ComplexityReport previous = report(line(3, 10, 100));
        ComplexityReport current = report(line(3, 20, 100));

        MetricsComparison comparison = DeltaCalculator.compare(current, previous, null, NOW);

        assertThat(comparison.metricType()).isEqualTo(MetricType.TOTAL);
        assertThat(comparison.overallChange()).isEqualTo(10);
    }

    private static LineMetric line(int lineNumber, long constrained, long gates) {
        return new LineMetric(lineNumber, "main.nr", List.of(), constrained, 0, gates, constrained + gates, 0.0, 0.0);
    }

    private static ComplexityReport report(LineMetric... lines) {
        List<LineMetric> list = List.of(lines);
        long constrained = list.stream().mapToLong(LineMetric::constrainedOps).sum();
        long gates = list.stream().mapToLong(LineMetric::gateCount).sum();
        FileMetric file = new FileMetric("main.nr", list, List.of(), constrained, 0, gates);
        return new ComplexityReport(List.of(file), constrained, 0, gates, List.of(), List.of(), NOW);
    }
}

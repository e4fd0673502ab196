package com.circuitinsight.core.metrics;

import com.circuitinsight.core.model.LineMetric;
import com.circuitinsight.core.model.MetricType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ThresholdHotspotSelector}.
 */
class ThresholdHotspotSelectorTest {

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 10, 50})
    void select_randomLines_respectsBoundThresholdAndOrder(int maxResults) {
        HotspotCriteria criteria = new HotspotCriteria(MetricType.TOTAL, 0.02, HotspotCriteria.SortKey.PERCENTAGE, maxResults);
        List<LineMetric> lines = randomLines(40, 7L);

        List<LineMetric> hotspots = new ThresholdHotspotSelector(criteria).select(lines);

        assertThat(hotspots).hasSizeLessThanOrEqualTo(maxResults);
        assertThat(hotspots).allSatisfy(line -> assertThat(line.percentOfCircuit()).isGreaterThanOrEqualTo(2.0));
        for (int i = 1; i < hotspots.size(); i++) {
            assertThat(hotspots.get(i).percentOfCircuit()).isLessThanOrEqualTo(hotspots.get(i - 1).percentOfCircuit());
        }
    }

    @Test
    void select_absoluteCriteria_usesMetricValue() {
        HotspotCriteria criteria = new HotspotCriteria(MetricType.GATES, 100, HotspotCriteria.SortKey.ABSOLUTE, 10);
        List<LineMetric> lines = List.of(
            line(1, 5, 50, 5.0),
            line(2, 0, 300, 30.0),
            line(3, 900, 100, 60.0)
        );

        List<LineMetric> hotspots = new ThresholdHotspotSelector(criteria).select(lines);

        assertThat(hotspots).extracting(LineMetric::lineNumber).containsExactly(2, 3);
    }

    @Test
    void select_defaults_dropLinesBelowFivePercent() {
        List<LineMetric> lines = List.of(line(1, 0, 5, 5.5), line(2, 0, 4, 4.99), line(3, 0, 91, 90.01));

        List<LineMetric> hotspots = new ThresholdHotspotSelector(HotspotCriteria.defaults()).select(lines);

        assertThat(hotspots).extracting(LineMetric::lineNumber).containsExactly(3, 1);
    }

    @Test
    void select_emptyInputOrZeroLimit_returnsEmpty() {
        HotspotCriteria none = new HotspotCriteria(MetricType.TOTAL, 0.0, HotspotCriteria.SortKey.PERCENTAGE, 0);

        assertThat(new ThresholdHotspotSelector(HotspotCriteria.defaults()).select(List.of())).isEmpty();
        assertThat(new ThresholdHotspotSelector(none).select(List.of(line(1, 0, 5, 100.0)))).isEmpty();
    }

    private static List<LineMetric> randomLines(int count, long seed) {
        Random random = new Random(seed);
        List<LineMetric> lines = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            lines.add(line(i, random.nextInt(100), random.nextInt(1000), random.nextDouble() * 10));
        }
        return lines;
    }

    static LineMetric line(int lineNumber, long constrained, long gates, double percent) {
        return new LineMetric(lineNumber, "main.nr", List.of(), constrained, 0, gates, constrained + gates, 0.5, percent);
    }
}

package com.circuitinsight.core.metrics;

import com.circuitinsight.core.model.LineMetric;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Hotspot selector that filters lines by a threshold and keeps the top results.
 *
 * <p>With {@link HotspotCriteria.SortKey#PERCENTAGE} a line qualifies when
 * {@code percentOfCircuit >= minimumThreshold * 100}; with
 * {@link HotspotCriteria.SortKey#ABSOLUTE} when the selected metric is at least
 * {@code minimumThreshold}. Qualifying lines are sorted descending by the same key (ties keep
 * line order) and truncated to {@code maxResults}.
 */
public class ThresholdHotspotSelector implements HotspotSelector {

    private final HotspotCriteria criteria;

    public ThresholdHotspotSelector(HotspotCriteria criteria) {
        this.criteria = Objects.requireNonNull(criteria, "criteria must not be null");
    }

    public HotspotCriteria getCriteria() {
        return criteria;
    }

    @Override
    public List<LineMetric> select(List<LineMetric> lines) {
        if (lines == null || lines.isEmpty() || criteria.maxResults() == 0) {
            return List.of();
        }
        return lines.stream()
            .filter(this::qualifies)
            .sorted(Comparator.comparingDouble(this::sortValue).reversed())
            .limit(criteria.maxResults())
            .toList();
    }

    private boolean qualifies(LineMetric line) {
        return switch (criteria.sortBy()) {
            case PERCENTAGE -> line.percentOfCircuit() >= criteria.minimumThreshold() * 100.0;
            case ABSOLUTE -> criteria.metricType().extract(line) >= criteria.minimumThreshold();
        };
    }

    private double sortValue(LineMetric line) {
        return switch (criteria.sortBy()) {
            case PERCENTAGE -> line.percentOfCircuit();
            case ABSOLUTE -> criteria.metricType().extract(line);
        };
    }
}

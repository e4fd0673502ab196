package com.circuitinsight.core.metrics;

import com.circuitinsight.core.model.LineMetric;

import java.util.List;

/**
 * Selects the hotspot lines of a report.
 *
 * <p>Kept separate from the aggregation fold so that the selection criteria can be swapped
 * without touching how line metrics are computed.
 *
 * @see ThresholdHotspotSelector
 */
@FunctionalInterface
public interface HotspotSelector {

    /**
     * Selects hotspots from fully normalized line metrics.
     *
     * @param lines all line metrics of a report
     * @return bounded, sorted subset of {@code lines}
     */
    List<LineMetric> select(List<LineMetric> lines);
}

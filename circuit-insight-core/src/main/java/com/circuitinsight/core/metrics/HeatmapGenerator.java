package com.circuitinsight.core.metrics;

import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.FileMetric;
import com.circuitinsight.core.model.HeatmapEntry;
import com.circuitinsight.core.model.LineMetric;
import com.circuitinsight.core.model.MetricType;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Turns line metrics into heatmap rows for an editor overlay or a text report.
 */
public final class HeatmapGenerator {

    private HeatmapGenerator() {
        // Utility class
    }

    /**
     * Generates heatmap entries for one file, hottest first.
     *
     * @param report complexity report
     * @param filter line filter
     * @return heatmap entries, empty if the file is not in the report
     */
    public static List<HeatmapEntry> generate(ComplexityReport report, HeatmapFilter filter) {
        Optional<FileMetric> file = filter.fileName() == null
            ? report.primaryFile()
            : report.file(filter.fileName());
        if (file.isEmpty()) {
            return List.of();
        }

        Stream<HeatmapEntry> entries = file.get().lines().stream()
            .filter(line -> line.percentOfCircuit() >= filter.thresholdPercent())
            .map(line -> toEntry(line, filter.metricType()))
            .sorted(Comparator.comparingDouble(HeatmapEntry::heatValue).reversed());
        if (filter.topN() > 0) {
            entries = entries.limit(filter.topN());
        }
        return entries.toList();
    }

    /**
     * Builds the heatmap row of one line.
     *
     * @param line line metric
     * @param metricType metric shown in the badge
     * @return heatmap entry
     */
    public static HeatmapEntry toEntry(LineMetric line, MetricType metricType) {
        long value = metricType.extract(line);
        return new HeatmapEntry(
            line.lineNumber(),
            line.normalizedHeat(),
            value,
            metricType,
            value + metricType.badgeSuffix(),
            tooltip(line)
        );
    }

    /**
     * Per-domain breakdown, e.g. {@code ACIR: 4 ops | Brillig: 0 ops | Gates: 12 | 8.70%}.
     *
     * @param line line metric
     * @return tooltip text
     */
    public static String tooltip(LineMetric line) {
        return String.format(Locale.ROOT, "ACIR: %d ops | Brillig: %d ops | Gates: %d | %.2f%%",
            line.constrainedOps(), line.unconstrainedOps(), line.gateCount(), line.percentOfCircuit());
    }
}

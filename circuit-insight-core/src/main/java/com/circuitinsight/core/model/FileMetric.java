package com.circuitinsight.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Metrics of one source file.
 *
 * @param fileName file name as reported by the profiler
 * @param lines line metrics, sorted by line number
 * @param functions detected functions, most expensive first
 * @param totalConstrainedOps constrained opcodes in this file
 * @param totalUnconstrainedOps unconstrained opcodes in this file
 * @param totalGates gates in this file
 */
public record FileMetric(
    String fileName,
    List<LineMetric> lines,
    List<FunctionMetric> functions,
    long totalConstrainedOps,
    long totalUnconstrainedOps,
    long totalGates
) {
    public FileMetric {
        Objects.requireNonNull(fileName, "fileName must not be null");
        lines = lines == null ? List.of() : List.copyOf(lines);
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public long totalCost() {
        return totalConstrainedOps + totalUnconstrainedOps + totalGates;
    }

    /**
     * Finds the metric of a line in this file.
     *
     * @param lineNumber line number
     * @return line metric, or empty if the line carries no cost
     */
    public Optional<LineMetric> line(int lineNumber) {
        return lines.stream()
            .filter(line -> line.lineNumber() == lineNumber)
            .findFirst();
    }
}

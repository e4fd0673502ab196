package com.circuitinsight.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured complexity model of a profiled circuit.
 *
 * <p>The first entry of {@code files} is the primary file whose source text was supplied;
 * further entries come from other files named in the profiler output.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ComplexityReport report = engine.generateComplexityReport(output);
 * report.hotspots().forEach(line ->
 *     System.out.printf("line %d: %.1f%%%n", line.lineNumber(), line.percentOfCircuit()));
 * }</pre>
 *
 * @param files per-file metrics, primary file first
 * @param totalConstrainedOps circuit-wide constrained opcodes
 * @param totalUnconstrainedOps circuit-wide unconstrained opcodes
 * @param totalGates circuit-wide gates
 * @param hotspots most expensive lines, bounded and sorted
 * @param topFunctions most expensive functions, bounded and sorted
 * @param generatedAt when the report was computed
 */
public record ComplexityReport(
    List<FileMetric> files,
    long totalConstrainedOps,
    long totalUnconstrainedOps,
    long totalGates,
    List<LineMetric> hotspots,
    List<FunctionMetric> topFunctions,
    Instant generatedAt
) {
    public ComplexityReport {
        files = files == null ? List.of() : List.copyOf(files);
        hotspots = hotspots == null ? List.of() : List.copyOf(hotspots);
        topFunctions = topFunctions == null ? List.of() : List.copyOf(topFunctions);
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
    }

    /**
     * Sum of the three circuit-wide domain totals.
     *
     * @return total circuit cost
     */
    public long totalCost() {
        return totalConstrainedOps + totalUnconstrainedOps + totalGates;
    }

    /**
     * Returns the primary file, if the report has any file.
     *
     * @return primary file metrics
     */
    public Optional<FileMetric> primaryFile() {
        return files.isEmpty() ? Optional.empty() : Optional.of(files.get(0));
    }

    /**
     * Looks up a file by name.
     *
     * @param fileName file name
     * @return file metrics, or empty if the report has no such file
     */
    public Optional<FileMetric> file(String fileName) {
        return files.stream()
            .filter(file -> file.fileName().equals(fileName))
            .findFirst();
    }

    /**
     * All line metrics across every file, in file then line order.
     *
     * @return flattened line metrics
     */
    public List<LineMetric> lines() {
        return files.stream()
            .flatMap(file -> file.lines().stream())
            .toList();
    }

    /**
     * Checks whether the report carries no cost at all.
     *
     * @return true if every domain total is zero
     */
    public boolean isEmpty() {
        return totalCost() == 0;
    }
}

package com.circuitinsight.core.model;

import java.util.Objects;

/**
 * A single line-level cost annotation read from profiler output.
 *
 * <p>Several records may share one line when the profiler attributes cost to distinct
 * expressions (or sub-expressions) on that line.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * // <title>main.nr:3:12::x != 0 (2 opcodes, 4.35%)</title>
 * CostRecord record = new CostRecord("main.nr", 3, 12, "x != 0", 2, 4.35);
 * }</pre>
 *
 * @param file source file the cost is attributed to (e.g. {@code main.nr}, {@code src/lib.nr})
 * @param line 1-based line number
 * @param column 1-based column number
 * @param expression source expression text, already HTML-unescaped
 * @param cost opcode or gate count
 * @param sharePercent share of the profiled total as reported by the producer (informational only)
 */
public record CostRecord(
    String file,
    int line,
    int column,
    String expression,
    long cost,
    double sharePercent
) {
    /**
     * Compact constructor with validation.
     */
    public CostRecord {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1");
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be >= 1");
        }
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be >= 0");
        }
    }
}

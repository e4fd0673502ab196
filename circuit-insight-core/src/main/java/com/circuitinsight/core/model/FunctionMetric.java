package com.circuitinsight.core.model;

import java.util.Objects;

/**
 * Aggregated cost of a lexically detected function.
 *
 * <p>Heat and percentage are relative to the most expensive function and to the total of all
 * functions, independently of the line-level normalization.
 *
 * @param name function name
 * @param startLine declaration line (inclusive)
 * @param endLine first line after the function (exclusive)
 * @param constrainedOps constrained opcodes within the range
 * @param unconstrainedOps unconstrained opcodes within the range
 * @param gateCount gates within the range
 * @param normalizedHeat cost relative to the most expensive function
 * @param percentOfCircuit share of the total cost of all functions
 */
public record FunctionMetric(
    String name,
    int startLine,
    int endLine,
    long constrainedOps,
    long unconstrainedOps,
    long gateCount,
    double normalizedHeat,
    double percentOfCircuit
) {
    public FunctionMetric {
        Objects.requireNonNull(name, "name must not be null");
        if (endLine < startLine) {
            throw new IllegalArgumentException("endLine must be >= startLine");
        }
    }

    public long totalCost() {
        return constrainedOps + unconstrainedOps + gateCount;
    }

    /**
     * Number of source lines the function spans.
     *
     * @return line span
     */
    public int lineSpan() {
        return endLine - startLine;
    }

    /**
     * Checks whether a line lies inside the half-open range of this function.
     *
     * @param lineNumber line number
     * @return true if {@code startLine <= lineNumber < endLine}
     */
    public boolean contains(int lineNumber) {
        return lineNumber >= startLine && lineNumber < endLine;
    }
}

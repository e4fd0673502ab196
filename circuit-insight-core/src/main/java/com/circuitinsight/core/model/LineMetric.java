package com.circuitinsight.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated cost of one source line across all cost domains.
 *
 * <p>{@code totalCost} always equals {@code constrainedOps + unconstrainedOps + gateCount};
 * the compact constructor rejects any other value.
 *
 * @param lineNumber 1-based line number
 * @param file file the line belongs to
 * @param expressions per-expression breakdown, in the order the profiler reported them
 * @param constrainedOps constrained opcodes on this line
 * @param unconstrainedOps unconstrained opcodes on this line
 * @param gateCount backend gates on this line
 * @param totalCost sum of the three domain costs
 * @param normalizedHeat cost relative to the most expensive line of the report, in {@code [0, 1]}
 * @param percentOfCircuit share of the circuit-wide total, in {@code [0, 100]}
 */
public record LineMetric(
    int lineNumber,
    String file,
    List<ExpressionMetric> expressions,
    long constrainedOps,
    long unconstrainedOps,
    long gateCount,
    long totalCost,
    double normalizedHeat,
    double percentOfCircuit
) {
    public LineMetric {
        Objects.requireNonNull(file, "file must not be null");
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
        if (totalCost != constrainedOps + unconstrainedOps + gateCount) {
            throw new IllegalArgumentException("totalCost must equal the sum of the domain costs");
        }
        if (normalizedHeat < 0.0 || normalizedHeat > 1.0) {
            throw new IllegalArgumentException("normalizedHeat must be within [0, 1]");
        }
    }

    /**
     * Returns the cost of this line in one domain.
     *
     * @param domain cost domain
     * @return cost in that domain
     */
    public long cost(CostDomain domain) {
        return switch (domain) {
            case CONSTRAINED -> constrainedOps;
            case UNCONSTRAINED -> unconstrainedOps;
            case GATES -> gateCount;
        };
    }
}

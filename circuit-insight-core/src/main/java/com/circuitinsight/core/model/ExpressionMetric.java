package com.circuitinsight.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Cost attributed to one expression on a line.
 *
 * <p>A record read from a single profiler pass sets exactly one slot of the cost triple. When
 * the same {@code (line, column, expression)} appears in several domains the contributions
 * are merged into one instance via {@link #plus(CostDomain, long)}.
 *
 * @param expression expression text
 * @param column 1-based column
 * @param constrainedOps constrained opcode count
 * @param unconstrainedOps unconstrained opcode count
 * @param gateCount backend gate count
 * @param domains domains that contributed to this expression
 */
public record ExpressionMetric(
    String expression,
    int column,
    long constrainedOps,
    long unconstrainedOps,
    long gateCount,
    Set<CostDomain> domains
) {
    public ExpressionMetric {
        Objects.requireNonNull(expression, "expression must not be null");
        domains = domains == null || domains.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(domains));
    }

    /**
     * Creates an expression metric carrying cost in a single domain.
     *
     * @param expression expression text
     * @param column column
     * @param domain contributing domain
     * @param cost cost in that domain
     * @return new expression metric
     */
    public static ExpressionMetric of(String expression, int column, CostDomain domain, long cost) {
        return new ExpressionMetric(expression, column, 0, 0, 0, Set.of()).plus(domain, cost);
    }

    /**
     * Returns a copy with {@code cost} added to the slot of {@code domain}.
     *
     * @param domain domain to accumulate
     * @param cost cost to add
     * @return merged expression metric
     */
    public ExpressionMetric plus(CostDomain domain, long cost) {
        EnumSet<CostDomain> merged = domains.isEmpty() ? EnumSet.noneOf(CostDomain.class) : EnumSet.copyOf(domains);
        merged.add(domain);
        return switch (domain) {
            case CONSTRAINED -> new ExpressionMetric(expression, column,
                constrainedOps + cost, unconstrainedOps, gateCount, merged);
            case UNCONSTRAINED -> new ExpressionMetric(expression, column,
                constrainedOps, unconstrainedOps + cost, gateCount, merged);
            case GATES -> new ExpressionMetric(expression, column,
                constrainedOps, unconstrainedOps, gateCount + cost, merged);
        };
    }

    /**
     * Sum of the three domain costs.
     *
     * @return total cost
     */
    public long totalCost() {
        return constrainedOps + unconstrainedOps + gateCount;
    }
}

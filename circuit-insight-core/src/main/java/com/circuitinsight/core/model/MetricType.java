package com.circuitinsight.core.model;

/**
 * Metric used to rank, compare and display line costs.
 *
 * <p>The three domain values select one slot of the cost triple; {@link #TOTAL} selects the
 * sum of all three.
 *
 * @since 1.0.0
 */
public enum MetricType {
    CONSTRAINED,
    UNCONSTRAINED,
    GATES,
    TOTAL;

    /**
     * Extracts this metric from a line.
     *
     * @param line line metric
     * @return metric value
     */
    public long extract(LineMetric line) {
        return switch (this) {
            case CONSTRAINED -> line.constrainedOps();
            case UNCONSTRAINED -> line.unconstrainedOps();
            case GATES -> line.gateCount();
            case TOTAL -> line.totalCost();
        };
    }

    /**
     * Extracts this metric's circuit-wide total from a report.
     *
     * @param report complexity report
     * @return circuit-wide total
     */
    public long total(ComplexityReport report) {
        return switch (this) {
            case CONSTRAINED -> report.totalConstrainedOps();
            case UNCONSTRAINED -> report.totalUnconstrainedOps();
            case GATES -> report.totalGates();
            case TOTAL -> report.totalCost();
        };
    }

    /**
     * Returns the unit suffix used in compact badges ({@code g} for gates, {@code ops} otherwise).
     *
     * @return badge suffix
     */
    public String badgeSuffix() {
        return this == GATES ? "g" : "ops";
    }
}

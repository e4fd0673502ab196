package com.circuitinsight.core.model;

/**
 * Independent cost domains reported by the circuit profiler.
 *
 * <p>Each profiler pass produces records for exactly one domain. The aggregator folds every
 * domain through the same accumulation routine, using this enum to pick the slot of the
 * cost triple that a record contributes to.
 *
 * @since 1.0.0
 */
public enum CostDomain {
    /**
     * Constrained (ACIR) opcodes, the main driver of proof size and proving time.
     */
    CONSTRAINED("acir"),

    /**
     * Unconstrained (Brillig) opcodes executed outside the constraint system.
     */
    UNCONSTRAINED("brillig"),

    /**
     * Gates of the proving backend's arithmetization.
     */
    GATES("gates");

    private final String label;

    CostDomain(String label) {
        this.label = label;
    }

    /**
     * Returns the short label used in tooltips and expression tags.
     *
     * @return lower-case domain label
     */
    public String label() {
        return label;
    }
}

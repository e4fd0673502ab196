package com.circuitinsight.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall circuit complexity classification derived from the gate count.
 */
public enum ComplexityClass {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Classifies a gate count against two ascending thresholds.
     *
     * @param totalGates circuit-wide gate count
     * @param lowBelow counts below this are {@link #LOW}
     * @param mediumBelow counts below this (and not low) are {@link #MEDIUM}
     * @return complexity class
     */
    public static ComplexityClass classify(long totalGates, long lowBelow, long mediumBelow) {
        if (totalGates < lowBelow) {
            return LOW;
        }
        if (totalGates < mediumBelow) {
            return MEDIUM;
        }
        return HIGH;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase();
    }
}

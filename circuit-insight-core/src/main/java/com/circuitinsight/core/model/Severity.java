package com.circuitinsight.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of an optimization suggestion.
 *
 * <p>Declaration order is the sort order of suggestions: {@code HIGH} first.
 */
public enum Severity {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String id() {
        return name().toLowerCase();
    }
}

package com.circuitinsight.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of an optimization suggestion.
 */
public enum SuggestionCategory {
    /** Loop unrolling, loop bounds and nesting */
    LOOP("loop"),
    /** Expensive field arithmetic such as division */
    ARITHMETIC("arithmetic"),
    /** Array and storage layout */
    STORAGE("storage"),
    /** Algorithmic restructuring, e.g. hashing strategy */
    ALGORITHM("algorithm"),
    /** Generic hotspot advice */
    GENERAL("general"),
    /** Circuit-wide best practices */
    BEST_PRACTICE("best-practice");

    private final String id;

    SuggestionCategory(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}

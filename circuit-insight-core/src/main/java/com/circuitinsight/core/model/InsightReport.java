package com.circuitinsight.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of running the optimization analyzer over a complexity report.
 *
 * @param suggestions suggestions sorted by {@link Suggestion#PRIORITY_ORDER}
 * @param totalPotentialSavings sum of all estimated savings
 * @param totalPotentialSavingsPercent sum of all savings percentages, clamped to 100
 * @param complexityClass gate-count classification of the circuit
 * @param totalGates circuit-wide gates of the analyzed report
 * @param totalConstrainedOps circuit-wide constrained opcodes of the analyzed report
 * @param totalUnconstrainedOps circuit-wide unconstrained opcodes of the analyzed report
 * @param analyzedAt when the analysis ran
 */
public record InsightReport(
    List<Suggestion> suggestions,
    long totalPotentialSavings,
    double totalPotentialSavingsPercent,
    ComplexityClass complexityClass,
    long totalGates,
    long totalConstrainedOps,
    long totalUnconstrainedOps,
    Instant analyzedAt
) {
    public InsightReport {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        Objects.requireNonNull(complexityClass, "complexityClass must not be null");
        Objects.requireNonNull(analyzedAt, "analyzedAt must not be null");
        if (totalPotentialSavingsPercent > 100.0) {
            throw new IllegalArgumentException("totalPotentialSavingsPercent must be <= 100");
        }
    }

    /**
     * Get suggestions of one severity, preserving order.
     *
     * @param severity the severity
     * @return matching suggestions
     */
    public List<Suggestion> suggestionsBySeverity(Severity severity) {
        return suggestions.stream()
            .filter(suggestion -> suggestion.severity() == severity)
            .toList();
    }

    public boolean hasSuggestions() {
        return !suggestions.isEmpty();
    }
}

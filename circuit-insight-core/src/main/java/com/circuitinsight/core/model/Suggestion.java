package com.circuitinsight.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single optimization suggestion produced by an analyzer rule.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Suggestion suggestion = Suggestion.builder("loop-large-4", 4)
 *     .severity(Severity.HIGH)
 *     .category(SuggestionCategory.LOOP)
 *     .title("Loop: 20 iterations")
 *     .description("Loop unrolls 20 times")
 *     .impact(200, 0.0)
 *     .build();
 * }</pre>
 *
 * @param id identifier, unique within one analysis (e.g. {@code hotspot-12})
 * @param lineNumber line the suggestion refers to, {@code 0} for circuit-wide advice
 * @param severity severity
 * @param category category
 * @param title short summary
 * @param description detailed explanation
 * @param impact estimated savings
 * @param codeSnippet offending source line, trimmed (optional)
 * @param suggestedFix alternative approach (optional)
 * @param learnMoreUrl documentation link (optional)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Suggestion(
    String id,
    int lineNumber,
    Severity severity,
    SuggestionCategory category,
    String title,
    String description,
    Impact impact,
    String codeSnippet,
    String suggestedFix,
    String learnMoreUrl
) {
    /**
     * Severity first ({@code HIGH} before {@code LOW}), then estimated savings descending.
     */
    public static final Comparator<Suggestion> PRIORITY_ORDER = Comparator
        .comparing(Suggestion::severity)
        .thenComparing(Comparator.comparingLong((Suggestion s) -> s.impact().estimatedSavings()).reversed());

    public Suggestion {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(impact, "impact must not be null");
        if (lineNumber < 0) {
            throw new IllegalArgumentException("lineNumber must be >= 0");
        }
    }

    /**
     * Returns true when the suggestion applies to the circuit as a whole.
     *
     * @return true if {@code lineNumber == 0}
     */
    public boolean isCircuitWide() {
        return lineNumber == 0;
    }

    public static Builder builder(String id, int lineNumber) {
        return new Builder(id, lineNumber);
    }

    /**
     * Estimated effect of applying a suggestion.
     *
     * @param estimatedSavings estimated opcode/gate reduction
     * @param savingsPercent estimated reduction as a percentage of the circuit
     */
    public record Impact(long estimatedSavings, double savingsPercent) {
        public Impact {
            if (estimatedSavings < 0) {
                throw new IllegalArgumentException("estimatedSavings must be >= 0");
            }
        }
    }

    /**
     * Builder for suggestions; rules fill in the optional fields they know about.
     */
    public static final class Builder {
        private final String id;
        private final int lineNumber;
        private Severity severity = Severity.MEDIUM;
        private SuggestionCategory category = SuggestionCategory.GENERAL;
        private String title;
        private String description;
        private Impact impact = new Impact(0, 0.0);
        private String codeSnippet;
        private String suggestedFix;
        private String learnMoreUrl;

        private Builder(String id, int lineNumber) {
            this.id = id;
            this.lineNumber = lineNumber;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder category(SuggestionCategory category) {
            this.category = category;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder impact(long estimatedSavings, double savingsPercent) {
            this.impact = new Impact(estimatedSavings, savingsPercent);
            return this;
        }

        public Builder codeSnippet(String codeSnippet) {
            this.codeSnippet = codeSnippet;
            return this;
        }

        public Builder suggestedFix(String suggestedFix) {
            this.suggestedFix = suggestedFix;
            return this;
        }

        public Builder learnMoreUrl(String learnMoreUrl) {
            this.learnMoreUrl = learnMoreUrl;
            return this;
        }

        public Suggestion build() {
            return new Suggestion(id, lineNumber, severity, category, title, description,
                impact, codeSnippet, suggestedFix, learnMoreUrl);
        }
    }
}

package com.circuitinsight.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Suggestion}.
 */
class SuggestionTest {

    @Test
    void priorityOrder_sortsSeverityThenSavings() {
        List<Suggestion> suggestions = new ArrayList<>(List.of(
            suggestion("a", Severity.MEDIUM, 500),
            suggestion("b", Severity.HIGH, 10),
            suggestion("c", Severity.LOW, 900),
            suggestion("d", Severity.HIGH, 300),
            suggestion("e", Severity.MEDIUM, 500)
        ));

        suggestions.sort(Suggestion.PRIORITY_ORDER);

        assertThat(suggestions).extracting(Suggestion::id).containsExactly("d", "b", "a", "e", "c");
    }

    @Test
    void builder_optionalFieldsDefaultToNull() {
        Suggestion suggestion = suggestion("best-practice-high-acir", Severity.MEDIUM, 1);

        assertThat(suggestion.codeSnippet()).isNull();
        assertThat(suggestion.learnMoreUrl()).isNull();
        assertThat(suggestion.isCircuitWide()).isTrue();
    }

    @Test
    void impact_negativeSavings_isRejected() {
        assertThatThrownBy(() -> new Suggestion.Impact(-1, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_nullSeverity_isRejected() {
        assertThatThrownBy(() -> Suggestion.builder("x", 1)
                .severity(null)
                .category(SuggestionCategory.LOOP)
                .title("t")
                .description("d")
                .impact(1, 1.0)
                .build())
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("severity");
    }

    @Test
    void jsonIds_areLowercase() {
        assertThat(Severity.HIGH.id()).isEqualTo("high");
        assertThat(SuggestionCategory.BEST_PRACTICE.id()).isEqualTo("best-practice");
        assertThat(ComplexityClass.MEDIUM.id()).isEqualTo("medium");
    }

    private static Suggestion suggestion(String id, Severity severity, long savings) {
        return Suggestion.builder(id, 0)
            .severity(severity)
            .category(SuggestionCategory.GENERAL)
            .title(id)
            .description(id)
            .impact(savings, 0.0)
            .build();
    }
}

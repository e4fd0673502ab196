package com.circuitinsight.core.analyzer.impl;

import com.circuitinsight.core.model.Severity;
import com.circuitinsight.core.model.Suggestion;
import com.circuitinsight.core.model.SuggestionCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.context;
import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.hotspot;
import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.lines;
import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.report;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ArithmeticRule}.
 */
class ArithmeticRuleTest {

    private final ArithmeticRule rule = new ArithmeticRule();

    @Test
    void analyze_division_isMediumWithFallback() {
        List<Suggestion> suggestions = rule.analyze(context(lines("fn f(a: Field) -> Field {", "    a / 3", "}")));

        assertThat(suggestions).singleElement().satisfies(s -> {
            assertThat(s.id()).isEqualTo("arithmetic-division-2");
            assertThat(s.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(s.category()).isEqualTo(SuggestionCategory.ARITHMETIC);
            assertThat(s.impact().estimatedSavings()).isEqualTo(20);
            assertThat(s.codeSnippet()).isEqualTo("a / 3");
        });
    }

    @Test
    void analyze_hotspotDivision_scalesByGates() {
        List<Suggestion> suggestions = rule.analyze(context("let q = a / b;",
            report(List.of(hotspot(1, 250, 12.0)), List.of(), 0, 250)));

        assertThat(suggestions).singleElement()
            .satisfies(s -> assertThat(s.impact().estimatedSavings()).isEqualTo(100));
    }

    @Test
    void analyze_commentsOnly_areIgnored() {
        List<Suggestion> suggestions = rule.analyze(context(lines(
            "// a / b",
            "/* ratio */",
            "let x = a * b; // not a / division",
            "let y = a /* half */ * 2;")));

        assertThat(suggestions).isEmpty();
    }

    @Test
    void analyze_dereferenceWrite_isCode() {
        List<Suggestion> suggestions = rule.analyze(context(lines(
            "fn halve(out: &mut Field, a: Field, b: Field) {",
            "    *out = a / b;",
            "}")));

        assertThat(suggestions).extracting(Suggestion::id).containsExactly("arithmetic-division-2");
        assertThat(suggestions.get(0).codeSnippet()).isEqualTo("*out = a / b;");
    }

    @Test
    void analyze_multiLineBlockComment_isIgnored() {
        List<Suggestion> suggestions = rule.analyze(context(lines(
            "let x = 1; /* ratio a",
            " * of c / d",
            " */",
            "let y = c / d;")));

        assertThat(suggestions).extracting(Suggestion::id).containsExactly("arithmetic-division-4");
    }
}

package com.circuitinsight.core.analyzer.impl;

import com.circuitinsight.core.model.Severity;
import com.circuitinsight.core.model.Suggestion;
import com.circuitinsight.core.model.SuggestionCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.context;
import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.hotspot;
import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.lines;
import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.report;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link HotspotRule}.
 */
class HotspotRuleTest {

    private final HotspotRule rule = new HotspotRule();

    @Test
    void analyze_hotspot_estimatesThirtyPercent() {
        String source = lines("fn main(x: Field) {", "    let h = poseidon(x);", "}");

        List<Suggestion> suggestions = rule.analyze(context(source,
            report(List.of(hotspot(2, 1001, 25.0)), List.of(), 0, 4004)));

        assertThat(suggestions).singleElement().satisfies(s -> {
            assertThat(s.id()).isEqualTo("hotspot-2");
            assertThat(s.severity()).isEqualTo(Severity.HIGH);
            assertThat(s.category()).isEqualTo(SuggestionCategory.GENERAL);
            assertThat(s.title()).isEqualTo("Hotspot: 25.0% of circuit");
            assertThat(s.impact().estimatedSavings()).isEqualTo(300);
            assertThat(s.impact().savingsPercent()).isCloseTo(7.5, within(1e-9));
            assertThat(s.codeSnippet()).isEqualTo("let h = poseidon(x);");
        });
    }

    @ParameterizedTest
    @CsvSource({
        "20.0, HIGH",
        "19.9, MEDIUM",
        "10.0, MEDIUM",
        "9.99, LOW",
        "5.0, LOW"
    })
    void severityOf_followsShare(double percent, Severity expected) {
        assertThat(HotspotRule.severityOf(percent)).isEqualTo(expected);
    }

    @Test
    void analyze_zeroGateOrBelowThreshold_isSkipped() {
        List<Suggestion> suggestions = rule.analyze(context("a\nb\nc",
            report(List.of(hotspot(1, 0, 50.0), hotspot(2, 10, 4.0)), List.of(), 0, 10)));

        assertThat(suggestions).isEmpty();
    }
}

package com.circuitinsight.core.analyzer.impl;

import com.circuitinsight.core.model.Severity;
import com.circuitinsight.core.model.Suggestion;
import com.circuitinsight.core.model.SuggestionCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.context;
import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.lines;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link HashInLoopRule}.
 */
class HashInLoopRuleTest {

    private final HashInLoopRule rule = new HashInLoopRule();

    @Test
    void analyze_hashInsideLoop_isHighSeverity() {
        List<Suggestion> suggestions = rule.analyze(context(lines(
            "fn main(leaves: [Field; 8]) {",
            "    let mut acc = 0;",
            "    for i in 0..8 {",
            "        acc = std::hash::Pedersen_hash([acc, leaves[i]]);",
            "    }",
            "}")));

        assertThat(suggestions).singleElement().satisfies(s -> {
            assertThat(s.id()).isEqualTo("hash-in-loop-4");
            assertThat(s.severity()).isEqualTo(Severity.HIGH);
            assertThat(s.category()).isEqualTo(SuggestionCategory.ALGORITHM);
            assertThat(s.impact().estimatedSavings()).isEqualTo(100);
            assertThat(s.learnMoreUrl()).isEqualTo(HashInLoopRule.LEARN_MORE_URL);
        });
    }

    @Test
    void analyze_hashOutsideLookback_isIgnored() {
        List<Suggestion> suggestions = rule.analyze(context(lines(
            "for i in 0..8 {",
            "}",
            "", "", "", "", "", "", "", "", "",
            "let h = sha256(bytes);")));

        assertThat(suggestions).isEmpty();
    }

    @Test
    void analyze_hashWithoutLoop_isIgnored() {
        assertThat(rule.analyze(context("let h = keccak256(bytes, 32);"))).isEmpty();
    }
}

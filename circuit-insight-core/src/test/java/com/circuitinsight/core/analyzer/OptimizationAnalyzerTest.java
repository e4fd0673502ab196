package com.circuitinsight.core.analyzer;

import com.circuitinsight.core.CircuitInsightEngine;
import com.circuitinsight.core.ProfileFixtures;
import com.circuitinsight.core.analyzer.impl.ArithmeticRule;
import com.circuitinsight.core.config.InsightConfig;
import com.circuitinsight.core.config.InsightConfig.AnalyzerSettings;
import com.circuitinsight.core.model.ComplexityClass;
import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.InsightReport;
import com.circuitinsight.core.model.Severity;
import com.circuitinsight.core.model.Suggestion;
import com.circuitinsight.core.profiler.ProfilerOutput;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.NOW;
import static com.circuitinsight.core.analyzer.AnalyzerTestSupport.report;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link OptimizationAnalyzer}.
 */
class OptimizationAnalyzerTest {

    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static ComplexityReport fixtureReport;

    @BeforeAll
    static void generateFixtureReport() {
        try (CircuitInsightEngine engine = new CircuitInsightEngine(InsightConfig.defaults(), null, CLOCK)) {
            fixtureReport = engine.generateComplexityReport(new ProfilerOutput(
                ProfileFixtures.mainAcir(), null, ProfileFixtures.mainGates(),
                ProfileFixtures.mainSource(), ProfileFixtures.MAIN_FILE));
        }
    }

    @Test
    void analyze_fixture_ordersSuggestionsBySeverityThenSavings() {
        InsightReport insights = analyzer(AnalyzerSettings.defaults())
            .analyze(fixtureReport, ProfileFixtures.mainSource());

        assertThat(insights.suggestions()).extracting(Suggestion::id).containsExactly(
            "hash-in-loop-8",
            "loop-large-5",
            "hotspot-8",
            "hotspot-5",
            "arithmetic-division-13",
            "hotspot-13"
        );
        assertThat(insights.suggestions()).extracting(s -> s.impact().estimatedSavings())
            .containsExactly(250L, 160L, 150L, 120L, 40L, 30L);
    }

    @Test
    void analyze_fixture_summarizesTotals() {
        InsightReport insights = analyzer(AnalyzerSettings.defaults())
            .analyze(fixtureReport, ProfileFixtures.mainSource());

        assertThat(insights.totalPotentialSavings()).isEqualTo(750);
        assertThat(insights.totalPotentialSavingsPercent()).isCloseTo(73.5, within(0.1));
        assertThat(insights.complexityClass()).isEqualTo(ComplexityClass.MEDIUM);
        assertThat(insights.totalGates()).isEqualTo(1000);
        assertThat(insights.totalConstrainedOps()).isEqualTo(100);
        assertThat(insights.analyzedAt()).isEqualTo(NOW);
        assertThat(insights.suggestionsBySeverity(Severity.HIGH)).hasSize(4);
    }

    @Test
    void analyze_severityAlwaysPrecedesSavings() {
        InsightReport insights = analyzer(AnalyzerSettings.defaults())
            .analyze(fixtureReport, ProfileFixtures.mainSource());

        List<Suggestion> suggestions = insights.suggestions();
        for (int i = 1; i < suggestions.size(); i++) {
            Suggestion before = suggestions.get(i - 1);
            Suggestion after = suggestions.get(i);
            assertThat(before.severity()).isLessThanOrEqualTo(after.severity());
            if (before.severity() == after.severity()) {
                assertThat(before.impact().estimatedSavings()).isGreaterThanOrEqualTo(after.impact().estimatedSavings());
            }
        }
    }

    @Test
    void analyze_disabledRule_isSkipped() {
        AnalyzerSettings settings = InsightConfig.defaults().merge(new InsightConfig(null, null,
            new AnalyzerSettings(null, null, null, null, null, null, null, null, null, null, null,
                Map.of("hash-operations", false, "hotspots", false), null))).analyzer();

        InsightReport insights = analyzer(settings).analyze(fixtureReport, ProfileFixtures.mainSource());

        assertThat(insights.suggestions()).extracting(Suggestion::id)
            .containsExactly("loop-large-5", "arithmetic-division-13");
    }

    @Test
    void analyze_failingRule_contributesNothing() {
        AnalyzerRule failing = new AnalyzerRule() {
            @Override
            public String getId() {
                return "failing";
            }

            @Override
            public String getDisplayName() {
                return "Failing";
            }

            @Override
            public int getPriority() {
                return 1;
            }

            @Override
            public List<Suggestion> analyze(AnalysisContext context) {
                throw new IllegalStateException("boom");
            }
        };
        OptimizationAnalyzer analyzer = new OptimizationAnalyzer(
            List.of(failing, new ArithmeticRule()),
            AnalyzerSettings.defaults(), CLOCK);

        InsightReport insights = analyzer.analyze(fixtureReport, ProfileFixtures.mainSource());

        assertThat(insights.suggestions()).extracting(Suggestion::id).containsExactly("arithmetic-division-13");
    }

    @Test
    void analyze_savingsPercent_isCappedAtHundred() {
        AnalyzerRule generous = fixedRule("generous", 60.0, 70.0);
        OptimizationAnalyzer analyzer = new OptimizationAnalyzer(List.of(generous), AnalyzerSettings.defaults(), CLOCK);

        InsightReport insights = analyzer.analyze(report(List.of(), List.of(), 0, 0), "");

        assertThat(insights.totalPotentialSavingsPercent()).isEqualTo(100.0);
        assertThat(insights.totalPotentialSavings()).isEqualTo(2);
        assertThat(insights.complexityClass()).isEqualTo(ComplexityClass.LOW);
    }

    @Test
    void analyze_hugeLoops_saturateTotalSavings() {
        String source = String.join("\n",
            "for i in 0..99999999999999999999 {",
            "}",
            "",
            "",
            "",
            "",
            "for j in 0..99999999999999999999 {",
            "}");

        InsightReport insights = analyzer(AnalyzerSettings.defaults())
            .analyze(report(List.of(), List.of(), 0, 0), source);

        assertThat(insights.suggestions()).extracting(Suggestion::id)
            .containsExactlyInAnyOrder("loop-large-1", "loop-large-7");
        assertThat(insights.totalPotentialSavings()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void analyze_emptySource_onlyReportsTotals() {
        InsightReport insights = analyzer(AnalyzerSettings.defaults()).analyze(report(List.of(), List.of(), 0, 0), null);

        assertThat(insights.hasSuggestions()).isFalse();
        assertThat(insights.totalPotentialSavings()).isZero();
    }

    @Test
    void constructor_ordersRulesByPriority() {
        OptimizationAnalyzer analyzer = analyzer(AnalyzerSettings.defaults());

        assertThat(analyzer.getRules()).extracting(AnalyzerRule::getPriority).isSorted();
    }

    private static OptimizationAnalyzer analyzer(AnalyzerSettings settings) {
        return new OptimizationAnalyzer(OptimizationAnalyzer.discoverRules(), settings, CLOCK);
    }

    private static AnalyzerRule fixedRule(String id, double... percents) {
        return new AbstractAnalyzerRule() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public String getDisplayName() {
                return id;
            }

            @Override
            public List<Suggestion> analyze(AnalysisContext context) {
                List<Suggestion> suggestions = suggestions();
                for (int i = 0; i < percents.length; i++) {
                    suggestions.add(Suggestion.builder(id + "-" + i, 0).impact(1, percents[i]).build());
                }
                return suggestions;
            }
        };
    }
}

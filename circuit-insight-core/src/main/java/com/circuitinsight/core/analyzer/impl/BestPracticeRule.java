package com.circuitinsight.core.analyzer.impl;

import com.circuitinsight.core.analyzer.AbstractAnalyzerRule;
import com.circuitinsight.core.analyzer.AnalysisContext;
import com.circuitinsight.core.config.InsightConfig.AnalyzerSettings;
import com.circuitinsight.core.config.InsightConfig.SavingsFactors;
import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.FunctionMetric;
import com.circuitinsight.core.model.Severity;
import com.circuitinsight.core.model.Suggestion;
import com.circuitinsight.core.model.SuggestionCategory;

import java.util.List;
import java.util.Locale;

/**
 * Circuit-wide checks on the report totals.
 *
 * <ul>
 *   <li>very large circuit (gate count)</li>
 *   <li>large circuit that does not use recursive composition</li>
 *   <li>one non-entry function dominating the cost</li>
 *   <li>high constrained opcode count</li>
 * </ul>
 */
public class BestPracticeRule extends AbstractAnalyzerRule {

    public static final String RULE_ID = "best-practices";

    static final String DATA_TYPES_URL = "https://noir-lang.org/docs/noir/concepts/data_types";
    static final String RECURSION_URL = "https://noir-lang.org/docs/noir/concepts/recursion";
    static final String DOCS_URL = "https://noir-lang.org/docs/";

    @Override
    public String getId() {
        return RULE_ID;
    }

    @Override
    public String getDisplayName() {
        return "Best Practices";
    }

    @Override
    public int getPriority() {
        return 60;
    }

    @Override
    public List<Suggestion> analyze(AnalysisContext context) {
        List<Suggestion> suggestions = suggestions();
        ComplexityReport report = context.report();
        AnalyzerSettings settings = context.settings();
        SavingsFactors savings = context.savings();
        long gates = report.totalGates();

        if (gates > settings.largeCircuitGates()) {
            suggestions.add(Suggestion.builder("best-practice-large-circuit", 0)
                .severity(Severity.HIGH)
                .category(SuggestionCategory.BEST_PRACTICE)
                .title("Very large circuit")
                .description("Circuit has " + grouped(gates)
                    + " gates - break into sub-circuits or use recursion to reduce proving time")
                .impact((long) Math.floor(gates * savings.largeCircuit()), savings.largeCircuit() * 100)
                .learnMoreUrl(DATA_TYPES_URL)
                .build());
        }

        if (gates > settings.recursionGates() && !context.sourceCode().contains(settings.recursiveMarker())) {
            suggestions.add(Suggestion.builder("best-practice-missing-recursive", 0)
                .severity(Severity.MEDIUM)
                .category(SuggestionCategory.BEST_PRACTICE)
                .title("Large circuit without recursive composition")
                .description("Circuit has " + grouped(gates) + " gates without " + settings.recursiveMarker()
                    + " attribute - consider using recursive proof composition to split into sub-circuits")
                .impact((long) Math.floor(gates * savings.missingRecursion()), savings.missingRecursion() * 100)
                .learnMoreUrl(RECURSION_URL)
                .build());
        }

        if (!report.topFunctions().isEmpty()) {
            FunctionMetric largest = report.topFunctions().get(0);
            if (largest.percentOfCircuit() > settings.functionDominancePercent()
                && !largest.name().equals(settings.entryPoint())) {
                String percent = String.format(Locale.ROOT, "%.1f", largest.percentOfCircuit());
                suggestions.add(Suggestion.builder("best-practice-large-function", largest.startLine())
                    .severity(Severity.MEDIUM)
                    .category(SuggestionCategory.BEST_PRACTICE)
                    .title("Function dominates: " + largest.name())
                    .description("\"" + largest.name() + "\" uses " + percent
                        + "% of circuit - split into smaller functions or optimize logic")
                    .impact(
                        (long) Math.floor(largest.gateCount() * savings.dominantFunction()),
                        largest.percentOfCircuit() * savings.dominantFunction())
                    .build());
            }
        }

        long constrained = report.totalConstrainedOps();
        if (constrained > settings.constrainedOpsThreshold()) {
            suggestions.add(Suggestion.builder("best-practice-high-acir", 0)
                .severity(Severity.MEDIUM)
                .category(SuggestionCategory.BEST_PRACTICE)
                .title("High ACIR opcode count")
                .description("Circuit has " + grouped(constrained)
                    + " ACIR opcodes - optimize hotspots to reduce proving time")
                .impact((long) Math.floor(constrained * savings.constrainedOps()), savings.constrainedOps() * 100)
                .learnMoreUrl(DOCS_URL)
                .build());
        }
        return suggestions;
    }

    private static String grouped(long value) {
        return String.format(Locale.US, "%,d", value);
    }
}

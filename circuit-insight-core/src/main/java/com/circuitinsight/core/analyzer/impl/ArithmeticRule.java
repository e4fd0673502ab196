package com.circuitinsight.core.analyzer.impl;

import com.circuitinsight.core.analyzer.AbstractAnalyzerRule;
import com.circuitinsight.core.analyzer.AnalysisContext;
import com.circuitinsight.core.model.LineMetric;
import com.circuitinsight.core.model.Severity;
import com.circuitinsight.core.model.Suggestion;
import com.circuitinsight.core.model.SuggestionCategory;

import java.util.List;
import java.util.Optional;

/**
 * Flags field division, which compiles to an inversion plus a multiplication.
 *
 * <p>A line counts as a division when its code portion contains {@code /} once line and block
 * comments have been removed.
 */
public class ArithmeticRule extends AbstractAnalyzerRule {

    public static final String RULE_ID = "arithmetic";

    @Override
    public String getId() {
        return RULE_ID;
    }

    @Override
    public String getDisplayName() {
        return "Expensive Arithmetic";
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    public List<Suggestion> analyze(AnalysisContext context) {
        List<Suggestion> suggestions = suggestions();
        double factor = context.savings().division();
        long fallback = context.savings().divisionFallback();

        forEachCodeLine(context, (lineNumber, line) -> {
            if (line.indexOf('/') < 0) {
                return;
            }
            Optional<LineMetric> hotspot = context.hotspot(lineNumber);
            suggestions.add(Suggestion.builder("arithmetic-division-" + lineNumber, lineNumber)
                .severity(Severity.MEDIUM)
                .category(SuggestionCategory.ARITHMETIC)
                .title("Division")
                .description("Division requires expensive field inversion - multiply by modular inverse "
                    + "for constants or restructure logic to avoid division")
                .impact(scaledSavings(hotspot, factor, fallback), scaledPercent(hotspot, factor))
                .codeSnippet(snippet(context, lineNumber))
                .build());
        });
        return suggestions;
    }
}

package com.circuitinsight.core.analyzer.impl;

import com.circuitinsight.core.analyzer.AbstractAnalyzerRule;
import com.circuitinsight.core.analyzer.AnalysisContext;
import com.circuitinsight.core.model.Severity;
import com.circuitinsight.core.model.Suggestion;
import com.circuitinsight.core.model.SuggestionCategory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags dynamically sized collections.
 *
 * <p>{@code Vec<...>} declarations and {@code .push(...)} calls are reported with fixed
 * estimates; {@code BoundedVec} is not a match.
 */
public class ArrayRule extends AbstractAnalyzerRule {

    public static final String RULE_ID = "arrays";

    private static final Pattern VEC_TYPE = Pattern.compile("\\bVec\\s*<");
    private static final Pattern PUSH_CALL = Pattern.compile("\\.push\\s*\\(");

    private static final long VEC_SAVINGS = 30;
    private static final double VEC_SAVINGS_PERCENT = 0.5;
    private static final long PUSH_SAVINGS = 10;
    private static final double PUSH_SAVINGS_PERCENT = 0.2;

    @Override
    public String getId() {
        return RULE_ID;
    }

    @Override
    public String getDisplayName() {
        return "Dynamic Arrays";
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    public List<Suggestion> analyze(AnalysisContext context) {
        List<Suggestion> suggestions = suggestions();

        forEachCodeLine(context, (lineNumber, line) -> {
            if (VEC_TYPE.matcher(line).find()) {
                suggestions.add(Suggestion.builder("array-vec-" + lineNumber, lineNumber)
                    .severity(Severity.MEDIUM)
                    .category(SuggestionCategory.STORAGE)
                    .title("Dynamic array (Vec)")
                    .description("Vec is less efficient than fixed-size arrays - use [Field; 10] instead of Vec<Field>")
                    .impact(VEC_SAVINGS, VEC_SAVINGS_PERCENT)
                    .codeSnippet(snippet(context, lineNumber))
                    .suggestedFix("[Field; N] or BoundedVec<Field, N>")
                    .build());
            }
            if (PUSH_CALL.matcher(line).find()) {
                suggestions.add(Suggestion.builder("array-push-" + lineNumber, lineNumber)
                    .severity(Severity.LOW)
                    .category(SuggestionCategory.STORAGE)
                    .title("Array push")
                    .description("push() adds overhead - use fixed-size arrays with manual indexing")
                    .impact(PUSH_SAVINGS, PUSH_SAVINGS_PERCENT)
                    .codeSnippet(snippet(context, lineNumber))
                    .build());
            }
        });
        return suggestions;
    }
}

package com.circuitinsight.core.analyzer.impl;

import com.circuitinsight.core.analyzer.AbstractAnalyzerRule;
import com.circuitinsight.core.analyzer.AnalysisContext;
import com.circuitinsight.core.config.InsightConfig.SavingsFactors;
import com.circuitinsight.core.model.LineMetric;
import com.circuitinsight.core.model.Severity;
import com.circuitinsight.core.model.Suggestion;
import com.circuitinsight.core.model.SuggestionCategory;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags loops that unroll into many constraints.
 *
 * <p>Loops are unrolled at compile time, so every iteration costs constraints. Three shapes are
 * reported:
 * <ul>
 *   <li>literal ranges with more iterations than the configured limit (high)</li>
 *   <li>ranges that are not two integer literals (medium)</li>
 *   <li>loops with another loop declaration a few lines above (high)</li>
 * </ul>
 * A single loop line can produce both a range finding and a nesting finding.
 */
public class LoopRule extends AbstractAnalyzerRule {

    public static final String RULE_ID = "loops";

    /** {@code start..end} or {@code start..=end} with integer literals. */
    private static final Pattern LITERAL_RANGE = Pattern.compile("^(\\d+)\\s*\\.\\.(=?)\\s*(\\d+)$");

    @Override
    public String getId() {
        return RULE_ID;
    }

    @Override
    public String getDisplayName() {
        return "Loop Unrolling";
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public List<Suggestion> analyze(AnalysisContext context) {
        List<Suggestion> suggestions = suggestions();
        SavingsFactors savings = context.savings();
        int limit = context.settings().loopIterationLimit();
        int lookback = context.settings().nestedLoopLookback();

        forEachCodeLine(context, (lineNumber, line) -> {
            Matcher loop = LOOP_DECLARATION.matcher(line);
            if (!loop.find()) {
                return;
            }
            Optional<LineMetric> hotspot = context.hotspot(lineNumber);
            String text = snippet(context, lineNumber);
            OptionalLong iterations = iterations(loop.group(1));

            if (iterations.isPresent()) {
                long count = iterations.getAsLong();
                if (count > limit) {
                    suggestions.add(Suggestion.builder("loop-large-" + lineNumber, lineNumber)
                        .severity(Severity.HIGH)
                        .category(SuggestionCategory.LOOP)
                        .title("Loop: " + count + " iterations")
                        .description("Loop unrolls " + count
                            + " times - reduce iterations or restructure to lower constraint count")
                        .impact(
                            scaledSavings(hotspot, savings.largeLoop(),
                                saturatedMultiply(count, savings.largeLoopPerIteration())),
                            scaledPercent(hotspot, savings.largeLoop()))
                        .codeSnippet(text)
                        .suggestedFix("Process the data in smaller batches or reduce the range bound")
                        .build());
                }
            } else {
                suggestions.add(Suggestion.builder("loop-dynamic-" + lineNumber, lineNumber)
                    .severity(Severity.MEDIUM)
                    .category(SuggestionCategory.LOOP)
                    .title("Loop: variable bounds")
                    .description("Loop has variable bounds - use compile-time constants or fixed-size arrays")
                    .impact(
                        scaledSavings(hotspot, savings.dynamicLoop(), savings.dynamicLoopFallback()),
                        scaledPercent(hotspot, savings.dynamicLoop()))
                    .codeSnippet(text)
                    .build());
            }

            if (hasMatchWithin(context, lineNumber, lookback, LOOP_DECLARATION)) {
                suggestions.add(Suggestion.builder("loop-nested-" + lineNumber, lineNumber)
                    .severity(Severity.HIGH)
                    .category(SuggestionCategory.LOOP)
                    .title("Nested loop")
                    .description("Nested loops create quadratic complexity - flatten logic, "
                        + "use lookup tables, or restructure")
                    .impact(
                        scaledSavings(hotspot, savings.nestedLoop(), savings.nestedLoopFallback()),
                        scaledPercent(hotspot, savings.nestedLoop()))
                    .codeSnippet(text)
                    .build());
            }
        });
        log.debug("{} loop suggestion(s)", suggestions.size());
        return suggestions;
    }

    /**
     * Computes the iteration count of a literal range.
     *
     * <p>Counts that do not fit a {@code long} saturate at {@link Long#MAX_VALUE}.
     *
     * @param range range expression of the loop header
     * @return iteration count, or empty if the range is not two integer literals
     */
    static OptionalLong iterations(String range) {
        Matcher matcher = LITERAL_RANGE.matcher(range.trim());
        if (!matcher.matches()) {
            return OptionalLong.empty();
        }
        BigInteger start = new BigInteger(matcher.group(1));
        BigInteger end = new BigInteger(matcher.group(3));
        BigInteger count = end.subtract(start).add(matcher.group(2).isEmpty() ? BigInteger.ZERO : BigInteger.ONE);
        if (count.signum() < 0) {
            return OptionalLong.of(0);
        }
        return OptionalLong.of(count.bitLength() < Long.SIZE ? count.longValue() : Long.MAX_VALUE);
    }
}

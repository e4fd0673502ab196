package com.circuitinsight.core.analyzer;

import com.circuitinsight.core.model.LineMetric;
import com.circuitinsight.core.model.Suggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.regex.Pattern;

/**
 * Base class for analyzer rules providing common functionality.
 *
 * <p>This class reduces duplication across rule implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per rule class)</li>
 *   <li>Shared source patterns ({@link #LOOP_DECLARATION})</li>
 *   <li>Comment-free line iteration ({@link #forEachCodeLine})</li>
 *   <li>Lookback windows ({@link #hasMatchWithin})</li>
 *   <li>Savings estimation ({@link #scaledSavings}, {@link #scaledPercent})</li>
 * </ul>
 *
 * @see AnalyzerRule
 * @since 1.0.0
 */
public abstract class AbstractAnalyzerRule implements AnalyzerRule {

    /** {@code for <var> in <range> {}} with the range in group 1. */
    public static final Pattern LOOP_DECLARATION =
        Pattern.compile("\\bfor\\s+\\w+\\s+in\\s+(.+?)\\s*\\{");

    /**
     * Logger instance for this rule.
     * Automatically initialized with the concrete rule class name.
     */
    protected final Logger log;

    protected AbstractAnalyzerRule() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public String toString() {
        return getId();
    }

    // ==================== Line Utilities ====================

    /**
     * Calls {@code action} with the 1-based number and code portion of every line that holds
     * code. Comments, including block comments spanning several lines, are removed first.
     *
     * @param context analysis context
     * @param action callback receiving line number and code text
     */
    protected void forEachCodeLine(AnalysisContext context, BiConsumer<Integer, String> action) {
        List<String> code = context.codeLines();
        for (int i = 0; i < code.size(); i++) {
            String line = code.get(i);
            if (!line.isBlank()) {
                action.accept(i + 1, line);
            }
        }
    }

    /**
     * Checks whether the code of any of the {@code lookback} lines before {@code lineNumber}
     * matches.
     *
     * <p>The line itself is not part of the window.
     *
     * @param context analysis context
     * @param lineNumber 1-based line number
     * @param lookback window size in lines
     * @param pattern pattern to find
     * @return true if a preceding line in the window matches
     */
    protected boolean hasMatchWithin(AnalysisContext context, int lineNumber, int lookback, Pattern pattern) {
        int from = Math.max(1, lineNumber - lookback);
        for (int n = from; n < lineNumber; n++) {
            if (pattern.matcher(context.code(n)).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the trimmed source text of a line, comments included, for display.
     *
     * @param context analysis context
     * @param lineNumber 1-based line number
     * @return snippet text
     */
    protected static String snippet(AnalysisContext context, int lineNumber) {
        return context.line(lineNumber).trim();
    }

    // ==================== Savings Estimation ====================

    /**
     * Estimates savings as a fraction of a hotspot's gates, or a fixed fallback.
     *
     * @param hotspot hotspot metrics of the line, if it is a hotspot
     * @param factor fraction of the gates that could be saved
     * @param fallback savings used when the line is not a hotspot
     * @return estimated savings
     */
    protected static long scaledSavings(Optional<LineMetric> hotspot, double factor, long fallback) {
        return hotspot.map(line -> (long) Math.floor(line.gateCount() * factor)).orElse(fallback);
    }

    /**
     * Multiplies two non-negative values, saturating at {@link Long#MAX_VALUE}.
     *
     * @param a first factor
     * @param b second factor
     * @return product, or {@code Long.MAX_VALUE} on overflow
     */
    protected static long saturatedMultiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Estimates the savings percentage as a fraction of a hotspot's share, or 0.
     *
     * @param hotspot hotspot metrics of the line, if it is a hotspot
     * @param factor fraction of the share that could be saved
     * @return estimated savings percentage
     */
    protected static double scaledPercent(Optional<LineMetric> hotspot, double factor) {
        return hotspot.map(line -> line.percentOfCircuit() * factor).orElse(0.0);
    }

    /**
     * Creates a mutable result list.
     *
     * @return empty suggestion list
     */
    protected static List<Suggestion> suggestions() {
        return new ArrayList<>();
    }
}

package com.circuitinsight.core.metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical function boundary detection.
 *
 * <p>This is a heuristic, not a parser: a function starts at a line matching the declaration
 * pattern and ends just before the next declaration (or at end of file). Code between two
 * functions, such as a struct or global, is attributed to the preceding function.
 */
public final class FunctionDetector {

    /** {@code fn name}, optionally {@code pub}, {@code pub(crate)} and/or {@code unconstrained}. */
    public static final Pattern FUNCTION_DECLARATION = Pattern.compile(
        "^\\s*(?:pub(?:\\(crate\\))?\\s+)?(?:unconstrained\\s+)?fn\\s+(\\w+)");

    private FunctionDetector() {
        // Utility class
    }

    /**
     * Lexically detected function range.
     *
     * @param name function name
     * @param startLine declaration line
     * @param endLine first line after the function (exclusive)
     */
    public record FunctionSpan(String name, int startLine, int endLine) {
        public boolean contains(int lineNumber) {
            return lineNumber >= startLine && lineNumber < endLine;
        }
    }

    /**
     * Detects function spans in source text.
     *
     * @param sourceCode source text, may be null
     * @return spans in declaration order
     */
    public static List<FunctionSpan> detect(String sourceCode) {
        if (sourceCode == null || sourceCode.isEmpty()) {
            return List.of();
        }
        String[] lines = sourceCode.split("\n", -1);

        List<Integer> starts = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = FUNCTION_DECLARATION.matcher(lines[i]);
            if (matcher.find()) {
                starts.add(i + 1);
                names.add(matcher.group(1));
            }
        }

        List<FunctionSpan> spans = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : lines.length + 1;
            spans.add(new FunctionSpan(names.get(i), starts.get(i), end));
        }
        return spans;
    }
}

package com.circuitinsight.core.parser;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for the profiler annotation grammar.
 *
 * <p>A cost annotation has the shape
 * {@code <title>{file}:{line}:{column}::{expression} ({count} opcodes, {percent}%)</title>}.
 * The container around the tags (SVG flamegraph, plain log) is ignored.
 *
 * @since 1.0.0
 */
public final class AnnotationPatterns {

    /**
     * One {@code <title>...</title>} element. The body is matched lazily so that adjacent tags
     * on one line are read separately.
     */
    public static final Pattern TITLE_PATTERN =
        Pattern.compile("<title>(.*?)</title>", Pattern.DOTALL);

    private static final Pattern MARKUP_PATTERN = Pattern.compile("<[^>]*>");

    private static final Map<String, String> ENTITIES = Map.of(
        "&gt;", ">",
        "&lt;", "<",
        "&quot;", "\"",
        "&apos;", "'",
        "&#39;", "'"
    );

    private AnnotationPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Builds the pattern for a title body whose file name ends in {@code sourceExtension}.
     *
     * <p>Groups: {@code file}, {@code line}, {@code column}, {@code expression}, {@code count},
     * {@code percent}. The unit word may be {@code opcode(s)} or {@code gate(s)}.
     *
     * @param sourceExtension file extension including the dot (e.g. {@code .nr})
     * @return compiled pattern
     */
    public static Pattern annotationPattern(String sourceExtension) {
        return Pattern.compile(
            "^\\s*(?<file>[^:<>]+" + Pattern.quote(sourceExtension) + ")"
                + ":(?<line>\\d+):(?<column>\\d+)::"
                + "(?<expression>.+?)"
                + " \\((?<count>\\d+) (?:opcodes?|gates?), (?<percent>\\d+(?:\\.\\d+)?)%\\)\\s*$",
            Pattern.DOTALL
        );
    }

    /**
     * Strips embedded markup, then decodes the HTML entities a profiler emits.
     *
     * <p>Markup is removed before decoding, so escaped angle brackets such as {@code &lt;T&gt;}
     * survive as literal text. {@code &amp;} is decoded last so that an escaped entity such as {@code &amp;lt;}
     * becomes the literal text {@code &lt;} rather than {@code <}.
     *
     * @param text escaped text, may be null
     * @return unescaped text, never null
     */
    public static String unescape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = MARKUP_PATTERN.matcher(text).replaceAll("");
        for (Map.Entry<String, String> entity : ENTITIES.entrySet()) {
            result = result.replace(entity.getKey(), entity.getValue());
        }
        return result.replace("&amp;", "&");
    }

    /**
     * Parses a positive integer group, returning -1 for anything that does not fit an int.
     *
     * @param matcher matcher with results
     * @param group group name
     * @return parsed value or -1
     */
    static int positiveInt(Matcher matcher, String group) {
        try {
            int value = Integer.parseInt(matcher.group(group));
            return value > 0 ? value : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}

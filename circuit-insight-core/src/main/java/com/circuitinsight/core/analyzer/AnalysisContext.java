package com.circuitinsight.core.analyzer;

import com.circuitinsight.core.config.InsightConfig.AnalyzerSettings;
import com.circuitinsight.core.config.InsightConfig.SavingsFactors;
import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.FileMetric;
import com.circuitinsight.core.model.LineMetric;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Input shared by every analyzer rule.
 *
 * @param report complexity report under analysis
 * @param sourceCode source text of the primary file
 * @param sourceLines source text split into lines; index 0 is line 1
 * @param codeLines source lines with comments removed, aligned with {@code sourceLines}
 * @param settings analyzer settings
 */
public record AnalysisContext(
    ComplexityReport report,
    String sourceCode,
    List<String> sourceLines,
    List<String> codeLines,
    AnalyzerSettings settings
) {
    public AnalysisContext {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        sourceCode = sourceCode == null ? "" : sourceCode;
        sourceLines = sourceLines == null ? List.of() : List.copyOf(sourceLines);
        codeLines = codeLines == null ? stripComments(sourceLines) : List.copyOf(codeLines);
        if (codeLines.size() != sourceLines.size()) {
            throw new IllegalArgumentException("codeLines must have one entry per source line");
        }
    }

    /**
     * Creates a context, splitting the source into lines.
     *
     * @param report complexity report
     * @param sourceCode source text
     * @param settings analyzer settings
     * @return analysis context
     */
    public static AnalysisContext of(ComplexityReport report, String sourceCode, AnalyzerSettings settings) {
        String source = sourceCode == null ? "" : sourceCode;
        List<String> lines = source.isEmpty() ? List.of() : List.of(source.split("\n", -1));
        return new AnalysisContext(report, source, lines, null, settings);
    }

    /**
     * Removes line comments and block comments, keeping one entry per line.
     *
     * <p>Block comments may span lines; a line that lies entirely inside one becomes empty.
     * Comment markers inside string literals are not recognised.
     *
     * @param lines source lines
     * @return code portion of every line
     */
    static List<String> stripComments(List<String> lines) {
        List<String> code = new ArrayList<>(lines.size());
        boolean inBlock = false;
        for (String line : lines) {
            StringBuilder kept = new StringBuilder();
            int i = 0;
            while (i < line.length()) {
                if (inBlock) {
                    int end = line.indexOf("*/", i);
                    if (end < 0) {
                        break;
                    }
                    inBlock = false;
                    i = end + 2;
                    continue;
                }
                int lineComment = line.indexOf("//", i);
                int blockStart = line.indexOf("/*", i);
                if (lineComment >= 0 && (blockStart < 0 || lineComment < blockStart)) {
                    kept.append(line, i, lineComment);
                    break;
                }
                if (blockStart >= 0) {
                    kept.append(line, i, blockStart).append(' ');
                    inBlock = true;
                    i = blockStart + 2;
                    continue;
                }
                kept.append(line, i, line.length());
                break;
            }
            code.add(kept.toString());
        }
        return code;
    }

    public SavingsFactors savings() {
        return settings.savings();
    }

    /**
     * Name of the file the source text belongs to.
     *
     * @return primary file name, or null if the report has no files
     */
    public String primaryFileName() {
        return report.primaryFile().map(FileMetric::fileName).orElse(null);
    }

    /**
     * Returns the text of a 1-based source line.
     *
     * @param lineNumber line number
     * @return line text, or empty string if out of range
     */
    public String line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > sourceLines.size()) {
            return "";
        }
        return sourceLines.get(lineNumber - 1);
    }

    /**
     * Returns the code portion of a 1-based source line.
     *
     * @param lineNumber line number
     * @return line text without comments, or empty string if out of range
     */
    public String code(int lineNumber) {
        if (lineNumber < 1 || lineNumber > codeLines.size()) {
            return "";
        }
        return codeLines.get(lineNumber - 1);
    }

    /**
     * Finds the hotspot metrics of a primary-file line.
     *
     * <p>Only hotspot lines are consulted: the estimates of line rules are scaled by observed
     * cost when the line is a hotspot and fall back to fixed values otherwise.
     *
     * @param lineNumber line number
     * @return hotspot line metric, or empty
     */
    public Optional<LineMetric> hotspot(int lineNumber) {
        String primary = primaryFileName();
        return report.hotspots().stream()
            .filter(line -> line.lineNumber() == lineNumber)
            .filter(line -> primary == null || primary.equals(line.file()))
            .findFirst();
    }
}

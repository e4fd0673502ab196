package com.circuitinsight.core.parser;

import com.circuitinsight.core.model.CostRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts line-level cost records from raw profiler output.
 *
 * <p>The parser reads every {@code <title>} element of the input and keeps those whose body
 * matches the annotation grammar (see {@link AnnotationPatterns}). Anything else, including
 * malformed annotations, is skipped: {@link #parse(String)} never throws and never returns a
 * partially populated record.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CostRecordParser parser = new CostRecordParser();
 * List<CostRecord> records = parser.parse(acirFlamegraphSvg);
 *
 * ParsedCostRecords index = parser.index(acirFlamegraphSvg);
 * long line3 = index.totalCostForLine(3, "main.nr");
 * }</pre>
 *
 * <p>Instances are immutable and safe to share.
 */
public class CostRecordParser {

    /** Extension used when none is configured. */
    public static final String DEFAULT_SOURCE_EXTENSION = ".nr";

    private static final Logger log = LoggerFactory.getLogger(CostRecordParser.class);

    private static final Comparator<CostRecord> POSITION_ORDER = Comparator
        .comparingInt(CostRecord::line)
        .thenComparingInt(CostRecord::column);

    private final String sourceExtension;
    private final Pattern annotationPattern;

    public CostRecordParser() {
        this(DEFAULT_SOURCE_EXTENSION);
    }

    /**
     * Creates a parser accepting file names that end in {@code sourceExtension}.
     *
     * @param sourceExtension extension including the dot
     */
    public CostRecordParser(String sourceExtension) {
        this.sourceExtension = Objects.requireNonNull(sourceExtension, "sourceExtension must not be null");
        this.annotationPattern = AnnotationPatterns.annotationPattern(sourceExtension);
    }

    public String getSourceExtension() {
        return sourceExtension;
    }

    /**
     * Parses raw profiler text into cost records.
     *
     * @param rawText profiler output, may be null
     * @return records sorted by line then column; empty if nothing matched
     */
    public List<CostRecord> parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return List.of();
        }

        List<CostRecord> records = new ArrayList<>();
        int skipped = 0;

        Matcher title = AnnotationPatterns.TITLE_PATTERN.matcher(rawText);
        while (title.find()) {
            CostRecord record = parseAnnotation(title.group(1));
            if (record != null) {
                records.add(record);
            } else {
                skipped++;
            }
        }

        // List.sort is stable: records on the same line and column keep their input order
        records.sort(POSITION_ORDER);

        log.debug("Parsed {} cost records ({} title elements skipped)", records.size(), skipped);
        return List.copyOf(records);
    }

    /**
     * Parses raw profiler text once and returns an index over the records.
     *
     * @param rawText profiler output, may be null
     * @return indexed records
     */
    public ParsedCostRecords index(String rawText) {
        return new ParsedCostRecords(parse(rawText));
    }

    /**
     * Strips markup from an expression, then decodes HTML entities.
     *
     * @param text escaped text
     * @return unescaped text
     * @see AnnotationPatterns#unescape(String)
     */
    public static String unescape(String text) {
        return AnnotationPatterns.unescape(text);
    }

    /**
     * Parses the body of one title element.
     *
     * @param body title text
     * @return record, or null if the body is not a well-formed annotation
     */
    private CostRecord parseAnnotation(String body) {
        Matcher matcher = annotationPattern.matcher(body);
        if (!matcher.matches()) {
            return null;
        }

        int line = AnnotationPatterns.positiveInt(matcher, "line");
        int column = AnnotationPatterns.positiveInt(matcher, "column");
        if (line < 0 || column < 0) {
            return null;
        }

        long cost;
        double percent;
        try {
            cost = Long.parseLong(matcher.group("count"));
            percent = Double.parseDouble(matcher.group("percent"));
        } catch (NumberFormatException e) {
            return null;
        }

        String file = matcher.group("file").trim();
        String expression = unescape(matcher.group("expression")).trim();
        if (expression.isEmpty()) {
            return null;
        }
        return new CostRecord(file, line, column, expression, cost, percent);
    }
}

package com.circuitinsight.core.parser;

import com.circuitinsight.core.model.CostRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parsed cost records of one profiler pass with lookup accessors.
 *
 * <p>Built once by {@link CostRecordParser#index(String)}; lookups by line or file do not
 * re-parse the input. Records of different files that share a line number stay distinct.
 */
public final class ParsedCostRecords {

    private final List<CostRecord> records;
    private final Map<String, List<CostRecord>> byFile;

    ParsedCostRecords(List<CostRecord> records) {
        this.records = List.copyOf(records);
        Map<String, List<CostRecord>> grouped = new LinkedHashMap<>();
        for (CostRecord record : this.records) {
            grouped.computeIfAbsent(record.file(), file -> new ArrayList<>()).add(record);
        }
        grouped.replaceAll((file, list) -> List.copyOf(list));
        this.byFile = Collections.unmodifiableMap(grouped);
    }

    /**
     * All records, sorted by line then column.
     *
     * @return records
     */
    public List<CostRecord> all() {
        return records;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    /**
     * Records on a line, across every file.
     *
     * @param lineNumber line number
     * @return matching records
     */
    public List<CostRecord> forLine(int lineNumber) {
        return records.stream()
            .filter(record -> record.line() == lineNumber)
            .toList();
    }

    /**
     * Records on a line of one file.
     *
     * @param lineNumber line number
     * @param fileName file name; null matches every file
     * @return matching records
     */
    public List<CostRecord> forLine(int lineNumber, String fileName) {
        if (fileName == null) {
            return forLine(lineNumber);
        }
        return forFile(fileName).stream()
            .filter(record -> record.line() == lineNumber)
            .toList();
    }

    /**
     * Records of one file.
     *
     * @param fileName file name
     * @return records of that file, empty if the file never appeared
     */
    public List<CostRecord> forFile(String fileName) {
        return byFile.getOrDefault(fileName, List.of());
    }

    /**
     * File names in the order they were first seen.
     *
     * @return distinct file names
     */
    public List<String> fileNames() {
        return List.copyOf(byFile.keySet());
    }

    /**
     * Sum of the cost of every expression on a line.
     *
     * @param lineNumber line number
     * @param fileName file name; null matches every file
     * @return total cost
     */
    public long totalCostForLine(int lineNumber, String fileName) {
        return forLine(lineNumber, fileName).stream()
            .mapToLong(CostRecord::cost)
            .sum();
    }

    /**
     * Expressions reported on a line, in column order.
     *
     * @param lineNumber line number
     * @param fileName file name; null matches every file
     * @return expression texts
     */
    public List<String> expressionsForLine(int lineNumber, String fileName) {
        return forLine(lineNumber, fileName).stream()
            .map(CostRecord::expression)
            .toList();
    }

    /**
     * Distinct line numbers carrying at least one record, ascending.
     *
     * @param fileName file name; null matches every file
     * @return line numbers
     */
    public Set<Integer> lineNumbers(String fileName) {
        List<CostRecord> source = fileName == null ? records : forFile(fileName);
        Set<Integer> lines = new TreeSet<>();
        source.forEach(record -> lines.add(record.line()));
        return Collections.unmodifiableSet(lines);
    }
}

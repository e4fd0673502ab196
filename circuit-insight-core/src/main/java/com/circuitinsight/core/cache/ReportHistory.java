package com.circuitinsight.core.cache;

import com.circuitinsight.core.model.ComplexityReport;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded history of generated reports, kept only for run-to-run comparison.
 *
 * <p>When the history is full the oldest report is evicted first.
 */
public class ReportHistory {

    /** Default number of retained reports. */
    public static final int DEFAULT_DEPTH = 10;

    private final Deque<ComplexityReport> reports = new ArrayDeque<>();
    private int depth;

    public ReportHistory() {
        this(DEFAULT_DEPTH);
    }

    public ReportHistory(int depth) {
        this.depth = requirePositive(depth);
    }

    /**
     * Appends a report, evicting the oldest ones beyond the depth.
     *
     * @param report generated report
     */
    public synchronized void record(ComplexityReport report) {
        reports.addLast(report);
        trim();
    }

    /**
     * Most recently recorded report.
     *
     * @return latest report, or empty if none was recorded
     */
    public synchronized Optional<ComplexityReport> latest() {
        return Optional.ofNullable(reports.peekLast());
    }

    /**
     * The report recorded immediately before the latest one.
     *
     * @return previous report, or empty if fewer than two are retained
     */
    public synchronized Optional<ComplexityReport> previous() {
        if (reports.size() < 2) {
            return Optional.empty();
        }
        List<ComplexityReport> ordered = List.copyOf(reports);
        return Optional.of(ordered.get(ordered.size() - 2));
    }

    public synchronized List<ComplexityReport> snapshot() {
        return List.copyOf(reports);
    }

    public synchronized int size() {
        return reports.size();
    }

    public synchronized int getDepth() {
        return depth;
    }

    /**
     * Changes the depth, evicting the oldest reports if the history shrinks.
     *
     * @param depth new maximum number of retained reports
     */
    public synchronized void setDepth(int depth) {
        this.depth = requirePositive(depth);
        trim();
    }

    public synchronized void clear() {
        reports.clear();
    }

    private void trim() {
        while (reports.size() > depth) {
            reports.removeFirst();
        }
    }

    private static int requirePositive(int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be >= 1");
        }
        return depth;
    }
}

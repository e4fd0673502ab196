package com.circuitinsight.core.metrics;

import com.circuitinsight.core.CircuitInsightException;
import com.circuitinsight.core.cache.ReportCache;
import com.circuitinsight.core.cache.ReportHistory;
import com.circuitinsight.core.cache.SourceHasher;
import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.CostDomain;
import com.circuitinsight.core.model.CostRecord;
import com.circuitinsight.core.model.ExpressionMetric;
import com.circuitinsight.core.model.FileMetric;
import com.circuitinsight.core.model.FunctionMetric;
import com.circuitinsight.core.model.LineMetric;
import com.circuitinsight.core.model.MetricType;
import com.circuitinsight.core.model.MetricsComparison;
import com.circuitinsight.core.parser.CostRecordParser;
import com.circuitinsight.core.profiler.ProfilerOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Merges per-domain cost records into a {@link ComplexityReport}.
 *
 * <p>The aggregation pipeline:
 * <ol>
 *   <li>Fold every present domain into line accumulators keyed by file and line</li>
 *   <li>Normalize heat against the most expensive line and percentages against the circuit total</li>
 *   <li>Detect functions lexically in the primary file and normalize them among themselves</li>
 *   <li>Select hotspots with the configured {@link HotspotSelector}</li>
 * </ol>
 *
 * <p>{@link #aggregate} is a pure function. {@link #generateReport} adds parsing, the injected
 * {@link ReportCache} and the {@link ReportHistory} used by {@link #compareWithPrevious}.
 */
public class MetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    private final CostRecordParser parser;
    private final HotspotSelector hotspotSelector;
    private final int topFunctionCount;
    private final String defaultFileName;
    private final ReportCache cache;
    private final ReportHistory history;
    private final Clock clock;

    /**
     * Creates an aggregator.
     *
     * @param parser parser for raw profiler text
     * @param hotspotSelector hotspot selection strategy
     * @param topFunctionCount number of functions kept in {@code topFunctions}
     * @param defaultFileName file name used when the input names none
     * @param cache report cache owned by the caller
     * @param history report history owned by the caller
     * @param clock time source for report timestamps
     */
    public MetricsAggregator(
        CostRecordParser parser,
        HotspotSelector hotspotSelector,
        int topFunctionCount,
        String defaultFileName,
        ReportCache cache,
        ReportHistory history,
        Clock clock
    ) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.hotspotSelector = Objects.requireNonNull(hotspotSelector, "hotspotSelector must not be null");
        this.topFunctionCount = topFunctionCount;
        this.defaultFileName = Objects.requireNonNull(defaultFileName, "defaultFileName must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ==================== Report Generation ====================

    /**
     * Parses the profiler output and returns its complexity report, served from the cache when
     * the same inputs were aggregated within the time-to-live.
     *
     * <p>A freshly computed report is also appended to the history.
     *
     * @param input profiler output
     * @return complexity report
     * @throws CircuitInsightException if the input has neither source code nor profiler text
     */
    public ComplexityReport generateReport(ProfilerOutput input) {
        Objects.requireNonNull(input, "input must not be null");
        if (!input.hasSourceCode() && input.hasNoProfileData()) {
            throw new CircuitInsightException("Neither source code nor profiler output was supplied");
        }

        String sourceCode = input.sourceCode() == null ? "" : input.sourceCode();
        String fileName = input.fileName() == null || input.fileName().isBlank()
            ? defaultFileName
            : input.fileName();

        String sourceHash = SourceHasher.hash(sourceCode);
        String inputDigest = SourceHasher.hashAll(
            sourceCode, fileName, input.constrainedText(), input.unconstrainedText(), input.gatesText());

        return cache.getOrCompute(sourceHash, inputDigest, () -> {
            DomainRecords domains = DomainRecords.of(
                input.constrainedText() == null ? null : parser.parse(input.constrainedText()),
                input.unconstrainedText() == null ? null : parser.parse(input.unconstrainedText()),
                input.gatesText() == null ? null : parser.parse(input.gatesText())
            );
            ComplexityReport report = aggregate(domains, sourceCode, fileName);
            history.record(report);
            return report;
        });
    }

    /**
     * Returns a cached report for the source text, whatever profiler output produced it.
     *
     * @param sourceCode source text
     * @return cached report, or empty if none is valid
     */
    public Optional<ComplexityReport> cachedReport(String sourceCode) {
        return cache.get(SourceHasher.hash(sourceCode == null ? "" : sourceCode));
    }

    /**
     * Compares a report with the report generated just before the latest one.
     *
     * @param current report to compare
     * @param metricType metric to compare
     * @return comparison, or empty if fewer than two reports are retained
     */
    public Optional<MetricsComparison> compareWithPrevious(ComplexityReport current, MetricType metricType) {
        Objects.requireNonNull(current, "current must not be null");
        return history.previous()
            .map(previous -> DeltaCalculator.compare(current, previous, metricType, clock.instant()));
    }

    /**
     * Purges the report cache and the comparison history.
     */
    public void clearCache() {
        cache.clear();
        history.clear();
    }

    // ==================== Aggregation ====================

    /**
     * Aggregates parsed records into a complexity report.
     *
     * @param domains parsed records per domain; absent domains contribute zero
     * @param sourceCode source text of the primary file, used for function detection
     * @param fileName name of the primary file
     * @return complexity report
     */
    public ComplexityReport aggregate(DomainRecords domains, String sourceCode, String fileName) {
        Objects.requireNonNull(domains, "domains must not be null");
        String primaryFile = fileName == null || fileName.isBlank() ? defaultFileName : fileName;

        Map<String, TreeMap<Integer, LineAccumulator>> files = fold(domains, primaryFile);

        long maxLineCost = 0;
        long[] domainTotals = new long[CostDomain.values().length];
        for (TreeMap<Integer, LineAccumulator> lines : files.values()) {
            for (LineAccumulator line : lines.values()) {
                maxLineCost = Math.max(maxLineCost, line.total());
                for (CostDomain domain : CostDomain.values()) {
                    domainTotals[domain.ordinal()] += line.cost(domain);
                }
            }
        }
        long circuitTotal = domainTotals[0] + domainTotals[1] + domainTotals[2];

        List<FileMetric> fileMetrics = new ArrayList<>();
        List<LineMetric> allLines = new ArrayList<>();
        List<FunctionMetric> primaryFunctions = List.of();
        for (Map.Entry<String, TreeMap<Integer, LineAccumulator>> entry : files.entrySet()) {
            List<LineMetric> lines = new ArrayList<>(entry.getValue().size());
            for (LineAccumulator accumulator : entry.getValue().values()) {
                lines.add(accumulator.toMetric(maxLineCost, circuitTotal));
            }
            List<FunctionMetric> functions = entry.getKey().equals(primaryFile)
                ? extractFunctions(sourceCode, lines)
                : List.of();
            if (entry.getKey().equals(primaryFile)) {
                primaryFunctions = functions;
            }
            fileMetrics.add(new FileMetric(
                entry.getKey(),
                lines,
                functions,
                lines.stream().mapToLong(LineMetric::constrainedOps).sum(),
                lines.stream().mapToLong(LineMetric::unconstrainedOps).sum(),
                lines.stream().mapToLong(LineMetric::gateCount).sum()
            ));
            allLines.addAll(lines);
        }

        List<LineMetric> hotspots = hotspotSelector.select(allLines);
        List<FunctionMetric> topFunctions = FunctionRanking.top(primaryFunctions, topFunctionCount);

        log.debug("Aggregated {} lines in {} files: {} constrained, {} unconstrained, {} gates, {} hotspots",
            allLines.size(), fileMetrics.size(),
            domainTotals[CostDomain.CONSTRAINED.ordinal()],
            domainTotals[CostDomain.UNCONSTRAINED.ordinal()],
            domainTotals[CostDomain.GATES.ordinal()],
            hotspots.size());

        return new ComplexityReport(
            fileMetrics,
            domainTotals[CostDomain.CONSTRAINED.ordinal()],
            domainTotals[CostDomain.UNCONSTRAINED.ordinal()],
            domainTotals[CostDomain.GATES.ordinal()],
            hotspots,
            topFunctions,
            clock.instant()
        );
    }

    /**
     * Folds every domain through the same accumulation routine.
     *
     * <p>The primary file is always the first entry, even when no record refers to it.
     */
    private Map<String, TreeMap<Integer, LineAccumulator>> fold(DomainRecords domains, String primaryFile) {
        Map<String, TreeMap<Integer, LineAccumulator>> files = new LinkedHashMap<>();
        files.put(primaryFile, new TreeMap<>());

        for (CostDomain domain : CostDomain.values()) {
            for (CostRecord record : domains.get(domain)) {
                String file = resolveFile(record.file(), primaryFile);
                files.computeIfAbsent(file, key -> new TreeMap<>())
                    .computeIfAbsent(record.line(), line -> new LineAccumulator(file, line))
                    .add(domain, record);
            }
        }
        return files;
    }

    /**
     * Maps a profiler file name onto the primary file when they name the same file
     * (e.g. {@code src/main.nr} and {@code main.nr}).
     */
    static String resolveFile(String recordFile, String primaryFile) {
        if (recordFile.equals(primaryFile)
            || recordFile.endsWith("/" + primaryFile)
            || primaryFile.endsWith("/" + recordFile)) {
            return primaryFile;
        }
        return recordFile;
    }

    /**
     * Aggregates line metrics into lexically detected functions.
     *
     * <p>Heat and percentage are relative to the functions only.
     */
    private List<FunctionMetric> extractFunctions(String sourceCode, List<LineMetric> lines) {
        List<FunctionDetector.FunctionSpan> spans = FunctionDetector.detect(sourceCode);
        if (spans.isEmpty()) {
            return List.of();
        }

        List<long[]> costs = new ArrayList<>(spans.size());
        long maxCost = 0;
        long totalCost = 0;
        for (FunctionDetector.FunctionSpan span : spans) {
            long[] triple = new long[3];
            for (LineMetric line : lines) {
                if (span.contains(line.lineNumber())) {
                    triple[0] += line.constrainedOps();
                    triple[1] += line.unconstrainedOps();
                    triple[2] += line.gateCount();
                }
            }
            long cost = triple[0] + triple[1] + triple[2];
            maxCost = Math.max(maxCost, cost);
            totalCost += cost;
            costs.add(triple);
        }

        List<FunctionMetric> functions = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            FunctionDetector.FunctionSpan span = spans.get(i);
            long[] triple = costs.get(i);
            long cost = triple[0] + triple[1] + triple[2];
            functions.add(new FunctionMetric(
                span.name(),
                span.startLine(),
                span.endLine(),
                triple[0],
                triple[1],
                triple[2],
                maxCost > 0 ? (double) cost / maxCost : 0.0,
                totalCost > 0 ? 100.0 * cost / totalCost : 0.0
            ));
        }
        functions.sort(FunctionRanking.BY_COST_DESCENDING);
        return functions;
    }

    /**
     * Mutable per-line state used only while folding.
     */
    private static final class LineAccumulator {
        private final String file;
        private final int lineNumber;
        private final long[] costs = new long[CostDomain.values().length];
        private final Map<ExpressionKey, ExpressionMetric> expressions = new LinkedHashMap<>();

        LineAccumulator(String file, int lineNumber) {
            this.file = file;
            this.lineNumber = lineNumber;
        }

        void add(CostDomain domain, CostRecord record) {
            costs[domain.ordinal()] += record.cost();
            expressions.merge(
                new ExpressionKey(record.column(), record.expression()),
                ExpressionMetric.of(record.expression(), record.column(), domain, record.cost()),
                (existing, added) -> existing.plus(domain, record.cost())
            );
        }

        long cost(CostDomain domain) {
            return costs[domain.ordinal()];
        }

        long total() {
            return costs[0] + costs[1] + costs[2];
        }

        LineMetric toMetric(long maxLineCost, long circuitTotal) {
            long total = total();
            return new LineMetric(
                lineNumber,
                file,
                List.copyOf(expressions.values()),
                cost(CostDomain.CONSTRAINED),
                cost(CostDomain.UNCONSTRAINED),
                cost(CostDomain.GATES),
                total,
                maxLineCost > 0 ? (double) total / maxLineCost : 0.0,
                circuitTotal > 0 ? 100.0 * total / circuitTotal : 0.0
            );
        }
    }

    private record ExpressionKey(int column, String expression) {
    }
}

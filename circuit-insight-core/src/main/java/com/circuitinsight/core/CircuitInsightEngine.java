package com.circuitinsight.core;

import com.circuitinsight.core.analyzer.AnalyzerRule;
import com.circuitinsight.core.analyzer.OptimizationAnalyzer;
import com.circuitinsight.core.cache.ReportCache;
import com.circuitinsight.core.cache.ReportHistory;
import com.circuitinsight.core.config.InsightConfig;
import com.circuitinsight.core.metrics.HeatmapFilter;
import com.circuitinsight.core.metrics.HeatmapGenerator;
import com.circuitinsight.core.metrics.MetricsAggregator;
import com.circuitinsight.core.metrics.ThresholdHotspotSelector;
import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.CostRecord;
import com.circuitinsight.core.model.HeatmapEntry;
import com.circuitinsight.core.model.InsightReport;
import com.circuitinsight.core.model.MetricType;
import com.circuitinsight.core.model.MetricsComparison;
import com.circuitinsight.core.parser.CostRecordParser;
import com.circuitinsight.core.profiler.ProfilerClient;
import com.circuitinsight.core.profiler.ProfilerOutput;
import com.circuitinsight.core.profiler.ProfilingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for circuit complexity metrics and optimization insights.
 *
 * <p>The engine wires the parser, aggregator, cache, history and analyzer from one
 * {@link InsightConfig}. Reconfiguring rebuilds the stateless collaborators but keeps the cache and
 * history, so cached reports survive a configuration change until they expire.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (CircuitInsightEngine engine = new CircuitInsightEngine()) {
 *     ComplexityReport report = engine.generateComplexityReport(
 *         new ProfilerOutput(acirSvg, brilligSvg, gatesSvg, source, "main.nr"));
 *     InsightReport insights = engine.analyzeCircuit(report, source);
 * }
 * }</pre>
 *
 * <p>All work is synchronous. The engine is safe to share between threads; concurrent requests for
 * the same inputs share one computation.
 */
public class CircuitInsightEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CircuitInsightEngine.class);

    private final ProfilerClient profilerClient;
    private final Clock clock;
    private final List<AnalyzerRule> rules;
    private final ReportCache cache;
    private final ReportHistory history;

    private volatile InsightConfig config;
    private volatile CostRecordParser parser;
    private volatile MetricsAggregator aggregator;
    private volatile OptimizationAnalyzer analyzer;

    /**
     * Creates an engine with default configuration and no profiler client.
     */
    public CircuitInsightEngine() {
        this(InsightConfig.defaults());
    }

    public CircuitInsightEngine(InsightConfig config) {
        this(config, null, Clock.systemUTC());
    }

    /**
     * Creates an engine.
     *
     * @param config configuration, merged over the defaults
     * @param profilerClient client used by {@link #getComplexityReport}; may be null
     * @param clock time source for report timestamps and cache expiry
     */
    public CircuitInsightEngine(InsightConfig config, ProfilerClient profilerClient, Clock clock) {
        this.profilerClient = profilerClient;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.rules = OptimizationAnalyzer.discoverRules();
        InsightConfig effective = InsightConfig.defaults().merge(config);
        this.cache = new ReportCache(Duration.ofMillis(effective.metrics().cacheTimeoutMs()), clock);
        this.history = new ReportHistory(effective.metrics().historyDepth());
        configure(effective);
    }

    // ==================== Parsing and Aggregation ====================

    /**
     * Parses raw profiler text into cost records.
     *
     * @param rawText profiler output; may be null or empty
     * @return records sorted by line then column
     */
    public List<CostRecord> parseCostRecords(String rawText) {
        return parser.parse(rawText);
    }

    /**
     * Builds (or returns the cached) complexity report for a profiler output.
     *
     * @param input profiler output
     * @return complexity report
     * @throws CircuitInsightException if neither source code nor profiler text is supplied
     */
    public ComplexityReport generateComplexityReport(ProfilerOutput input) {
        return aggregator.generateReport(input);
    }

    /**
     * Profiles source code through the {@link ProfilerClient} and builds its report.
     *
     * <p>A valid cached report for the same source is returned without calling the profiler.
     *
     * @param sourceCode circuit source
     * @param manifest project manifest, passed through to the profiler
     * @param fileName primary file name; defaults to the configured name when null
     * @return report, or empty when the profiler produced no data
     * @throws ProfilingException if the profiler fails
     * @throws IllegalStateException if the engine has no profiler client
     */
    public Optional<ComplexityReport> getComplexityReport(String sourceCode, String manifest, String fileName)
        throws ProfilingException {
        Optional<ComplexityReport> cached = aggregator.cachedReport(sourceCode);
        if (cached.isPresent()) {
            log.debug("Serving cached report for {}", fileName);
            return cached;
        }
        if (profilerClient == null) {
            throw new IllegalStateException("No profiler client configured");
        }

        String name = fileName == null || fileName.isBlank() ? config.metrics().defaultFileName() : fileName;
        ProfilerOutput output = profilerClient.profile(sourceCode, manifest, name);
        if (output == null || output.hasNoProfileData()) {
            log.warn("Profiler returned no data for {}", name);
            return Optional.empty();
        }
        ProfilerOutput withSource = new ProfilerOutput(
            output.constrainedText(),
            output.unconstrainedText(),
            output.gatesText(),
            sourceCode,
            output.fileName() == null ? name : output.fileName()
        );
        return Optional.of(aggregator.generateReport(withSource));
    }

    /**
     * Compares a report with the one generated before the latest report.
     *
     * @param current current report
     * @param metricType metric to compare; null means TOTAL
     * @return comparison, or empty without a previous report
     */
    public Optional<MetricsComparison> compareWithPrevious(ComplexityReport current, MetricType metricType) {
        return aggregator.compareWithPrevious(current, metricType);
    }

    // ==================== Insights ====================

    /**
     * Runs the optimization rules over a report.
     *
     * @param report complexity report
     * @param sourceCode source text of the report's primary file
     * @return insight report
     */
    public InsightReport analyzeCircuit(ComplexityReport report, String sourceCode) {
        return analyzer.analyze(report, sourceCode);
    }

    /**
     * Builds heatmap entries for a report.
     *
     * @param report complexity report
     * @param filter heatmap filter
     * @return entries sorted by heat, hottest first
     */
    public List<HeatmapEntry> heatmap(ComplexityReport report, HeatmapFilter filter) {
        return HeatmapGenerator.generate(report, filter);
    }

    // ==================== State and Configuration ====================

    /**
     * Purges cached reports and the comparison history.
     */
    public void clearCache() {
        aggregator.clearCache();
        log.debug("Report cache and history cleared");
    }

    /**
     * Overlays the non-null fields of a partial configuration.
     *
     * <p>The merged configuration is validated in full before anything is applied; a rejected
     * update leaves the engine, its cache and its history untouched.
     *
     * @param partial partial configuration
     * @throws IllegalArgumentException if the merged configuration is invalid
     */
    public synchronized void updateConfiguration(InsightConfig partial) {
        InsightConfig merged = config.merge(partial);
        Duration timeToLive = Duration.ofMillis(merged.metrics().cacheTimeoutMs());
        int depth = merged.metrics().historyDepth();
        if (timeToLive.isNegative() || timeToLive.isZero()) {
            throw new IllegalArgumentException("cacheTimeoutMs must be positive");
        }
        if (depth < 1) {
            throw new IllegalArgumentException("historyDepth must be >= 1");
        }
        Components components = build(merged);

        cache.setTimeToLive(timeToLive);
        history.setDepth(depth);
        apply(merged, components);
        log.info("Configuration updated");
    }

    public InsightConfig getConfiguration() {
        return config;
    }

    @Override
    public void close() {
        cache.close();
        history.clear();
    }

    private synchronized void configure(InsightConfig effective) {
        apply(effective, build(effective));
    }

    private Components build(InsightConfig effective) {
        CostRecordParser newParser = new CostRecordParser(effective.metrics().sourceExtension());
        MetricsAggregator newAggregator = new MetricsAggregator(
            newParser,
            new ThresholdHotspotSelector(effective.hotspots().toCriteria()),
            effective.metrics().topFunctions(),
            effective.metrics().defaultFileName(),
            cache,
            history,
            clock
        );
        return new Components(newParser, newAggregator, new OptimizationAnalyzer(rules, effective.analyzer(), clock));
    }

    private void apply(InsightConfig effective, Components components) {
        this.parser = components.parser();
        this.aggregator = components.aggregator();
        this.analyzer = components.analyzer();
        this.config = effective;
    }

    private record Components(CostRecordParser parser, MetricsAggregator aggregator, OptimizationAnalyzer analyzer) {
    }
}

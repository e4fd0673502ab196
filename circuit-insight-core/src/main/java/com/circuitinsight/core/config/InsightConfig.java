package com.circuitinsight.core.config;

import com.circuitinsight.core.metrics.HotspotCriteria;
import com.circuitinsight.core.model.MetricType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration of the circuit insight engine.
 *
 * <p>Loaded from {@code circuit-insight.yaml}. Every field is optional: a partial file (or a
 * partial object passed to {@code updateConfiguration}) is overlaid on {@link #defaults()} with
 * {@link #merge(InsightConfig)}, so only the keys that differ from the defaults need to be given.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * metrics:
 *   cacheTimeoutMs: 60000
 *
 * hotspots:
 *   minimumThreshold: 0.1
 *   maxResults: 5
 *
 * analyzer:
 *   largeCircuitGates: 200000
 *   rules:
 *     arithmetic: false
 *   savings:
 *     hotspot: 0.25
 * }</pre>
 *
 * @param metrics aggregation and cache settings
 * @param hotspots hotspot selection settings
 * @param analyzer optimization analyzer settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightConfig(
    @JsonProperty("metrics") MetricsSettings metrics,
    @JsonProperty("hotspots") HotspotSettings hotspots,
    @JsonProperty("analyzer") AnalyzerSettings analyzer
) {
    /**
     * Creates the default configuration.
     *
     * @return default configuration with every value populated
     */
    public static InsightConfig defaults() {
        return new InsightConfig(
            MetricsSettings.defaults(),
            HotspotSettings.defaults(),
            AnalyzerSettings.defaults()
        );
    }

    /**
     * Overlays the non-null values of {@code partial} on this configuration.
     *
     * @param partial partial configuration, may be null
     * @return merged configuration
     */
    public InsightConfig merge(InsightConfig partial) {
        if (partial == null) {
            return this;
        }
        return new InsightConfig(
            metrics == null ? partial.metrics : metrics.merge(partial.metrics),
            hotspots == null ? partial.hotspots : hotspots.merge(partial.hotspots),
            analyzer == null ? partial.analyzer : analyzer.merge(partial.analyzer)
        );
    }

    /**
     * Aggregation and cache settings.
     *
     * @param sourceExtension extension a profiled file name must end with
     * @param defaultFileName file name used when the caller supplies none
     * @param cacheTimeoutMs report cache time-to-live in milliseconds
     * @param historyDepth number of reports retained for delta comparison
     * @param topFunctions number of functions kept in {@code topFunctions}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetricsSettings(
        @JsonProperty("sourceExtension") String sourceExtension,
        @JsonProperty("defaultFileName") String defaultFileName,
        @JsonProperty("cacheTimeoutMs") Long cacheTimeoutMs,
        @JsonProperty("historyDepth") Integer historyDepth,
        @JsonProperty("topFunctions") Integer topFunctions
    ) {
        public static MetricsSettings defaults() {
            return new MetricsSettings(".nr", "main.nr", 5 * 60 * 1000L, 10, 5);
        }

        MetricsSettings merge(MetricsSettings partial) {
            if (partial == null) {
                return this;
            }
            return new MetricsSettings(
                pick(partial.sourceExtension, sourceExtension),
                pick(partial.defaultFileName, defaultFileName),
                pick(partial.cacheTimeoutMs, cacheTimeoutMs),
                pick(partial.historyDepth, historyDepth),
                pick(partial.topFunctions, topFunctions)
            );
        }
    }

    /**
     * Hotspot selection settings.
     *
     * @param metricType metric used when {@code sortBy} is ABSOLUTE
     * @param minimumThreshold fraction of the circuit (PERCENTAGE) or absolute value (ABSOLUTE)
     * @param sortBy sort key
     * @param maxResults maximum number of hotspots
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HotspotSettings(
        @JsonProperty("metricType") MetricType metricType,
        @JsonProperty("minimumThreshold") Double minimumThreshold,
        @JsonProperty("sortBy") HotspotCriteria.SortKey sortBy,
        @JsonProperty("maxResults") Integer maxResults
    ) {
        public static HotspotSettings defaults() {
            HotspotCriteria criteria = HotspotCriteria.defaults();
            return new HotspotSettings(
                criteria.metricType(),
                criteria.minimumThreshold(),
                criteria.sortBy(),
                criteria.maxResults()
            );
        }

        HotspotSettings merge(HotspotSettings partial) {
            if (partial == null) {
                return this;
            }
            return new HotspotSettings(
                pick(partial.metricType, metricType),
                pick(partial.minimumThreshold, minimumThreshold),
                pick(partial.sortBy, sortBy),
                pick(partial.maxResults, maxResults)
            );
        }

        /**
         * Converts these settings to selector criteria.
         *
         * @return hotspot criteria
         */
        public HotspotCriteria toCriteria() {
            return new HotspotCriteria(metricType, minimumThreshold, sortBy, maxResults);
        }
    }

    /**
     * Optimization analyzer settings.
     *
     * @param hotspotThreshold minimum percent of the circuit for the hotspot rule
     * @param complexityThresholds gate-count thresholds for complexity classification
     * @param largeCircuitGates gate count above which a circuit is "very large"
     * @param recursionGates gate count above which recursive composition is recommended
     * @param constrainedOpsThreshold constrained opcode count above which a circuit is flagged
     * @param functionDominancePercent percent of the circuit above which one function dominates
     * @param entryPoint entry-point function excluded from the dominance check
     * @param recursiveMarker source marker that shows recursive composition is in use
     * @param loopIterationLimit literal iteration count above which a loop is "large"
     * @param nestedLoopLookback lines searched backwards for an enclosing loop
     * @param hashLoopLookback lines searched backwards for a loop around a hash call
     * @param rules rule id to enabled flag; rules not listed are enabled
     * @param savings multipliers and fallbacks used to estimate savings
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalyzerSettings(
        @JsonProperty("hotspotThreshold") Double hotspotThreshold,
        @JsonProperty("complexityThresholds") ComplexityThresholds complexityThresholds,
        @JsonProperty("largeCircuitGates") Long largeCircuitGates,
        @JsonProperty("recursionGates") Long recursionGates,
        @JsonProperty("constrainedOpsThreshold") Long constrainedOpsThreshold,
        @JsonProperty("functionDominancePercent") Double functionDominancePercent,
        @JsonProperty("entryPoint") String entryPoint,
        @JsonProperty("recursiveMarker") String recursiveMarker,
        @JsonProperty("loopIterationLimit") Integer loopIterationLimit,
        @JsonProperty("nestedLoopLookback") Integer nestedLoopLookback,
        @JsonProperty("hashLoopLookback") Integer hashLoopLookback,
        @JsonProperty("rules") Map<String, Boolean> rules,
        @JsonProperty("savings") SavingsFactors savings
    ) {
        public AnalyzerSettings {
            rules = rules == null ? Map.of() : Map.copyOf(rules);
        }

        public static AnalyzerSettings defaults() {
            return new AnalyzerSettings(
                5.0,
                new ComplexityThresholds(1_000L, 10_000L),
                100_000L,
                50_000L,
                10_000L,
                50.0,
                "main",
                "#[recursive]",
                10,
                5,
                10,
                Map.of(),
                SavingsFactors.defaults()
            );
        }

        /**
         * Checks if a rule is enabled. Rules are enabled unless explicitly switched off.
         *
         * @param ruleId rule id
         * @return true if the rule should run
         */
        public boolean isRuleEnabled(String ruleId) {
            return rules.getOrDefault(ruleId, Boolean.TRUE);
        }

        AnalyzerSettings merge(AnalyzerSettings partial) {
            if (partial == null) {
                return this;
            }
            Map<String, Boolean> mergedRules = new LinkedHashMap<>(rules);
            mergedRules.putAll(partial.rules);
            return new AnalyzerSettings(
                pick(partial.hotspotThreshold, hotspotThreshold),
                complexityThresholds == null
                    ? partial.complexityThresholds
                    : complexityThresholds.merge(partial.complexityThresholds),
                pick(partial.largeCircuitGates, largeCircuitGates),
                pick(partial.recursionGates, recursionGates),
                pick(partial.constrainedOpsThreshold, constrainedOpsThreshold),
                pick(partial.functionDominancePercent, functionDominancePercent),
                pick(partial.entryPoint, entryPoint),
                pick(partial.recursiveMarker, recursiveMarker),
                pick(partial.loopIterationLimit, loopIterationLimit),
                pick(partial.nestedLoopLookback, nestedLoopLookback),
                pick(partial.hashLoopLookback, hashLoopLookback),
                mergedRules,
                savings == null ? partial.savings : savings.merge(partial.savings)
            );
        }
    }

    /**
     * Gate-count thresholds for complexity classification.
     *
     * @param low counts below this are low complexity
     * @param medium counts below this are medium complexity, the rest high
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComplexityThresholds(
        @JsonProperty("low") Long low,
        @JsonProperty("medium") Long medium
    ) {
        ComplexityThresholds merge(ComplexityThresholds partial) {
            if (partial == null) {
                return this;
            }
            return new ComplexityThresholds(pick(partial.low, low), pick(partial.medium, medium));
        }
    }

    /**
     * Savings estimation constants.
     *
     * <p>The multipliers are applied to the observed cost of the line (or circuit) a suggestion
     * refers to. They are product heuristics rather than measured values.
     *
     * @param hotspot hotspot line multiplier
     * @param largeLoop large literal loop multiplier
     * @param dynamicLoop variable-bound loop multiplier
     * @param nestedLoop nested loop multiplier
     * @param division division multiplier
     * @param hashInLoop hash-in-loop multiplier
     * @param largeCircuit very large circuit multiplier
     * @param missingRecursion missing recursion multiplier
     * @param dominantFunction dominant function multiplier
     * @param constrainedOps high constrained opcode count multiplier
     * @param dynamicLoopFallback savings for a variable-bound loop without line metrics
     * @param nestedLoopFallback savings for a nested loop without line metrics
     * @param divisionFallback savings for a division without line metrics
     * @param hashInLoopFallback savings for a hash in a loop without line metrics
     * @param largeLoopPerIteration savings per iteration for a large loop without line metrics
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SavingsFactors(
        @JsonProperty("hotspot") Double hotspot,
        @JsonProperty("largeLoop") Double largeLoop,
        @JsonProperty("dynamicLoop") Double dynamicLoop,
        @JsonProperty("nestedLoop") Double nestedLoop,
        @JsonProperty("division") Double division,
        @JsonProperty("hashInLoop") Double hashInLoop,
        @JsonProperty("largeCircuit") Double largeCircuit,
        @JsonProperty("missingRecursion") Double missingRecursion,
        @JsonProperty("dominantFunction") Double dominantFunction,
        @JsonProperty("constrainedOps") Double constrainedOps,
        @JsonProperty("dynamicLoopFallback") Long dynamicLoopFallback,
        @JsonProperty("nestedLoopFallback") Long nestedLoopFallback,
        @JsonProperty("divisionFallback") Long divisionFallback,
        @JsonProperty("hashInLoopFallback") Long hashInLoopFallback,
        @JsonProperty("largeLoopPerIteration") Long largeLoopPerIteration
    ) {
        public static SavingsFactors defaults() {
            return new SavingsFactors(
                0.3, 0.4, 0.3, 0.5, 0.4, 0.5, 0.2, 0.15, 0.25, 0.15,
                50L, 100L, 20L, 100L, 10L
            );
        }

        SavingsFactors merge(SavingsFactors partial) {
            if (partial == null) {
                return this;
            }
            return new SavingsFactors(
                pick(partial.hotspot, hotspot),
                pick(partial.largeLoop, largeLoop),
                pick(partial.dynamicLoop, dynamicLoop),
                pick(partial.nestedLoop, nestedLoop),
                pick(partial.division, division),
                pick(partial.hashInLoop, hashInLoop),
                pick(partial.largeCircuit, largeCircuit),
                pick(partial.missingRecursion, missingRecursion),
                pick(partial.dominantFunction, dominantFunction),
                pick(partial.constrainedOps, constrainedOps),
                pick(partial.dynamicLoopFallback, dynamicLoopFallback),
                pick(partial.nestedLoopFallback, nestedLoopFallback),
                pick(partial.divisionFallback, divisionFallback),
                pick(partial.hashInLoopFallback, hashInLoopFallback),
                pick(partial.largeLoopPerIteration, largeLoopPerIteration)
            );
        }
    }

    private static <T> T pick(T override, T current) {
        return override != null ? override : current;
    }
}

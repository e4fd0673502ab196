package com.circuitinsight.core.analyzer;

import com.circuitinsight.core.config.InsightConfig.AnalyzerSettings;
import com.circuitinsight.core.config.InsightConfig.ComplexityThresholds;
import com.circuitinsight.core.model.ComplexityClass;
import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.InsightReport;
import com.circuitinsight.core.model.Suggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Runs the analyzer rules over a complexity report and assembles an {@link InsightReport}.
 *
 * <p>Rules are executed in priority order. Rules switched off in the settings are skipped, and a
 * rule that throws is logged and contributes nothing. Suggestions are ordered by
 * {@link Suggestion#PRIORITY_ORDER}; the sort is stable, so suggestions with the same severity and
 * savings keep rule order.
 *
 * <p>The summed savings percentage is capped at 100; the summed savings saturate at
 * {@link Long#MAX_VALUE}.
 */
public class OptimizationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(OptimizationAnalyzer.class);

    private static final double MAX_SAVINGS_PERCENT = 100.0;

    private final List<AnalyzerRule> rules;
    private final AnalyzerSettings settings;
    private final Clock clock;

    /**
     * Creates an analyzer using the rules registered via SPI.
     *
     * @param settings analyzer settings
     */
    public OptimizationAnalyzer(AnalyzerSettings settings) {
        this(discoverRules(), settings, Clock.systemUTC());
    }

    public OptimizationAnalyzer(List<AnalyzerRule> rules, AnalyzerSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        List<AnalyzerRule> ordered = new ArrayList<>(Objects.requireNonNull(rules, "rules must not be null"));
        ordered.sort(Comparator.comparingInt(AnalyzerRule::getPriority));
        this.rules = List.copyOf(ordered);
    }

    /**
     * Discovers all available rules via SPI, lowest priority value first.
     *
     * @return discovered rules
     */
    public static List<AnalyzerRule> discoverRules() {
        log.debug("Discovering analyzer rules via ServiceLoader");
        List<AnalyzerRule> rules = new ArrayList<>();
        ServiceLoader.load(AnalyzerRule.class).forEach(rules::add);
        rules.sort(Comparator.comparingInt(AnalyzerRule::getPriority));

        log.debug("Discovered {} analyzer rules", rules.size());
        if (log.isTraceEnabled()) {
            rules.forEach(r -> log.trace("  - {} ({})", r.getId(), r.getDisplayName()));
        }
        return rules;
    }

    /**
     * Analyzes a report.
     *
     * @param report complexity report
     * @param sourceCode source text of the report's primary file
     * @return insight report
     */
    public InsightReport analyze(ComplexityReport report, String sourceCode) {
        Objects.requireNonNull(report, "report must not be null");
        AnalysisContext context = AnalysisContext.of(report, sourceCode, settings);

        List<Suggestion> suggestions = new ArrayList<>();
        for (AnalyzerRule rule : rules) {
            if (!settings.isRuleEnabled(rule.getId())) {
                log.debug("Rule {} is disabled in configuration", rule.getId());
                continue;
            }
            try {
                List<Suggestion> found = rule.analyze(context);
                log.debug("Rule {} produced {} suggestion(s)", rule.getId(), found.size());
                suggestions.addAll(found);
            } catch (RuntimeException e) {
                log.warn("Rule {} failed: {}", rule.getId(), e.getMessage(), e);
            }
        }
        suggestions.sort(Suggestion.PRIORITY_ORDER);

        long totalSavings = 0;
        double totalPercent = 0.0;
        for (Suggestion suggestion : suggestions) {
            totalSavings = saturatedAdd(totalSavings, suggestion.impact().estimatedSavings());
            totalPercent += suggestion.impact().savingsPercent();
        }

        ComplexityThresholds thresholds = settings.complexityThresholds();
        ComplexityClass complexity = ComplexityClass.classify(report.totalGates(), thresholds.low(), thresholds.medium());

        log.info("Analysis produced {} suggestion(s), complexity {}", suggestions.size(), complexity.id());
        return new InsightReport(
            suggestions,
            totalSavings,
            Math.min(totalPercent, MAX_SAVINGS_PERCENT),
            complexity,
            report.totalGates(),
            report.totalConstrainedOps(),
            report.totalUnconstrainedOps(),
            clock.instant()
        );
    }

    private static long saturatedAdd(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    public List<AnalyzerRule> getRules() {
        return rules;
    }

    public AnalyzerSettings getSettings() {
        return settings;
    }
}

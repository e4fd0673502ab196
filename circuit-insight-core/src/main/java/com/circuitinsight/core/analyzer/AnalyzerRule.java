package com.circuitinsight.core.analyzer;

import com.circuitinsight.core.model.Suggestion;

import java.util.List;

/**
 * A heuristic rule that inspects a complexity report and its source text and proposes
 * optimizations.
 *
 * <p>Rules are discovered via Java Service Provider Interface (SPI) and run in priority order
 * (lower numbers first). Each rule is independent: it sees only the {@link AnalysisContext}, never
 * the output of other rules, and can be switched off by id in the analyzer settings.
 *
 * <p>Rules are lexical by design. Loops, functions and hash calls are recognised by pattern and
 * fixed-size lookback windows over the source lines, not by parsing.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.circuitinsight.core.analyzer.AnalyzerRule}
 *
 * @see AbstractAnalyzerRule
 * @see OptimizationAnalyzer
 */
public interface AnalyzerRule {

    /**
     * Returns the unique, kebab-case identifier of this rule (e.g. {@code hash-operations}).
     *
     * <p>Used as the key for enabling or disabling the rule in configuration.
     *
     * @return rule identifier
     */
    String getId();

    /**
     * Returns a human-readable name for logs and listings.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns execution priority; lower values run first.
     *
     * @return priority value
     */
    int getPriority();

    /**
     * Runs the rule.
     *
     * @param context report, source text and settings
     * @return suggestions, possibly empty; never null
     */
    List<Suggestion> analyze(AnalysisContext context);
}

package com.circuitinsight.core.analyzer.impl;

import com.circuitinsight.core.analyzer.AbstractAnalyzerRule;
import com.circuitinsight.core.analyzer.AnalysisContext;
import com.circuitinsight.core.model.LineMetric;
import com.circuitinsight.core.model.Severity;
import com.circuitinsight.core.model.Suggestion;
import com.circuitinsight.core.model.SuggestionCategory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns expensive hotspot lines into suggestions.
 *
 * <p>Every hotspot at or above the configured share of the circuit yields one suggestion; lines
 * without gates are skipped. Severity follows the share: {@code >= 20%} is high, {@code < 10%} is
 * low, anything in between medium.
 */
public class HotspotRule extends AbstractAnalyzerRule {

    public static final String RULE_ID = "hotspots";

    private static final double HIGH_PERCENT = 20.0;
    private static final double LOW_PERCENT = 10.0;

    @Override
    public String getId() {
        return RULE_ID;
    }

    @Override
    public String getDisplayName() {
        return "Hotspot Lines";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public List<Suggestion> analyze(AnalysisContext context) {
        List<Suggestion> suggestions = suggestions();
        double threshold = context.settings().hotspotThreshold();
        double factor = context.savings().hotspot();
        String primary = context.primaryFileName();

        for (LineMetric hotspot : context.report().hotspots()) {
            if (hotspot.gateCount() == 0 || hotspot.percentOfCircuit() < threshold) {
                continue;
            }
            boolean inPrimary = primary == null || Objects.equals(primary, hotspot.file());
            String id = inPrimary
                ? "hotspot-" + hotspot.lineNumber()
                : "hotspot-" + hotspot.file() + ":" + hotspot.lineNumber();
            String percent = String.format(Locale.ROOT, "%.1f", hotspot.percentOfCircuit());

            suggestions.add(Suggestion.builder(id, hotspot.lineNumber())
                .severity(severityOf(hotspot.percentOfCircuit()))
                .category(SuggestionCategory.GENERAL)
                .title("Hotspot: " + percent + "% of circuit")
                .description("Uses " + percent + "% of circuit (" + hotspot.gateCount()
                    + " gates) - split into smaller operations or optimize algorithm")
                .impact((long) Math.floor(hotspot.gateCount() * factor), hotspot.percentOfCircuit() * factor)
                .codeSnippet(inPrimary ? context.line(hotspot.lineNumber()).trim() : null)
                .build());
        }
        log.debug("{} hotspot suggestion(s)", suggestions.size());
        return suggestions;
    }

    static Severity severityOf(double percent) {
        if (percent >= HIGH_PERCENT) {
            return Severity.HIGH;
        }
        if (percent < LOW_PERCENT) {
            return Severity.LOW;
        }
        return Severity.MEDIUM;
    }
}

package com.circuitinsight.cli;

import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.FunctionMetric;
import com.circuitinsight.core.model.InsightReport;
import com.circuitinsight.core.model.LineMetric;
import com.circuitinsight.core.model.MetricsComparison;
import com.circuitinsight.core.model.MetricsDelta;
import com.circuitinsight.core.model.Suggestion;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * Plain-text rendering of reports, insights and comparisons.
 */
final class ReportFormatter {

    private ReportFormatter() {
    }

    static void printReport(PrintWriter out, ComplexityReport report) {
        out.println("Complexity Report:");
        out.println("  ACIR opcodes:     " + report.totalConstrainedOps());
        out.println("  Brillig opcodes:  " + report.totalUnconstrainedOps());
        out.println("  Gates:            " + report.totalGates());
        out.println("  Files:            " + report.files().size());

        out.println();
        out.println("Hotspots:");
        if (report.hotspots().isEmpty()) {
            out.println("  (none)");
        }
        for (LineMetric line : report.hotspots()) {
            out.printf(Locale.ROOT, "  %s:%d  %d  (%.1f%%)%n",
                line.file(), line.lineNumber(), line.totalCost(), line.percentOfCircuit());
        }

        out.println();
        out.println("Top Functions:");
        if (report.topFunctions().isEmpty()) {
            out.println("  (none)");
        }
        for (FunctionMetric function : report.topFunctions()) {
            out.printf(Locale.ROOT, "  %-24s lines %d-%d  %d  (%.1f%%)%n",
                function.name(), function.startLine(), function.endLine() - 1,
                function.totalCost(), function.percentOfCircuit());
        }
    }

    static void printInsights(PrintWriter out, InsightReport insights) {
        out.println();
        out.printf(Locale.ROOT, "Complexity: %s  |  Potential savings: %d (%.1f%%)%n",
            insights.complexityClass().id(),
            insights.totalPotentialSavings(),
            insights.totalPotentialSavingsPercent());
        out.println();
        out.println("Suggestions:");
        if (!insights.hasSuggestions()) {
            out.println("  (none)");
        }
        for (Suggestion suggestion : insights.suggestions()) {
            String location = suggestion.isCircuitWide() ? "circuit" : "line " + suggestion.lineNumber();
            out.printf("  [%s] %s (%s)%n", suggestion.severity().id(), suggestion.title(), location);
            out.println("      " + suggestion.description());
            if (suggestion.codeSnippet() != null && !suggestion.codeSnippet().isEmpty()) {
                out.println("      > " + suggestion.codeSnippet());
            }
        }
    }

    static void printComparison(PrintWriter out, MetricsComparison comparison) {
        out.printf(Locale.ROOT, "Comparison (%s) against %s:%n",
            comparison.metricType(), comparison.baselineLabel());
        out.printf(Locale.ROOT, "  Overall change: %+d (%+.1f%%)%n",
            comparison.overallChange(), comparison.overallChangePercent());
        out.println();
        if (comparison.deltas().isEmpty()) {
            out.println("  No line-level changes");
        }
        for (MetricsDelta delta : comparison.deltas()) {
            out.printf(Locale.ROOT, "  %s %s:%d  %d -> %d  (%+d, %+.1f%%)%n",
                delta.isImprovement() ? "↓" : "↑",
                delta.file(), delta.lineNumber(),
                delta.previousValue(), delta.currentValue(), delta.delta(), delta.deltaPercent());
        }
    }
}

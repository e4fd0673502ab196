package com.circuitinsight.cli;

import com.circuitinsight.core.CircuitInsightEngine;
import com.circuitinsight.core.metrics.HeatmapFilter;
import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.HeatmapEntry;
import com.circuitinsight.core.model.MetricType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Prints per-line heat badges, hottest first.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * circuit-insight heatmap src/main.nr --gates gates.svg --metric GATES --top 10
 * }</pre>
 */
@Command(
    name = "heatmap",
    description = "Per-line heat badges",
    mixinStandardHelpOptions = true
)
public class HeatmapCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HeatmapCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ProfileInputOptions input;

    @Option(
        names = {"-m", "--metric"},
        description = "Metric shown in badges: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "TOTAL"
    )
    MetricType metric;

    @Option(names = {"--threshold"}, description = "Minimum share of the circuit in percent (default: ${DEFAULT-VALUE})", defaultValue = "0")
    double threshold;

    @Option(names = {"--top"}, description = "Maximum number of lines, 0 for all (default: ${DEFAULT-VALUE})", defaultValue = "0")
    int top;

    @Option(names = {"--file"}, description = "File to render (default: the primary file)")
    String file;

    @Option(names = {"--json"}, description = "Print entries as JSON")
    boolean json;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (CircuitInsightEngine engine = new CircuitInsightEngine(input.loadConfig())) {
            ComplexityReport report = engine.generateComplexityReport(input.read());
            List<HeatmapEntry> entries = engine.heatmap(report, new HeatmapFilter(metric, threshold, file, top));
            log.debug("Heatmap has {} entries", entries.size());

            if (json) {
                out.println(JsonOutput.write(entries));
            } else {
                for (HeatmapEntry entry : entries) {
                    out.printf(Locale.ROOT, "  %5d  %-10s %.2f  %s%n",
                        entry.lineNumber(), entry.badgeText(), entry.heatValue(), entry.tooltipText());
                }
                if (entries.isEmpty()) {
                    out.println("  (no lines)");
                }
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.error("Heatmap failed", e);
            spec.commandLine().getErr().println("✗ Heatmap failed: " + e.getMessage());
            return 1;
        }
    }
}

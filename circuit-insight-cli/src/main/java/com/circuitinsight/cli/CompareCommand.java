package com.circuitinsight.cli;

import com.circuitinsight.core.CircuitInsightEngine;
import com.circuitinsight.core.metrics.DeltaCalculator;
import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.MetricType;
import com.circuitinsight.core.model.MetricsComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Compares the current profile of a circuit against a baseline profile.
 *
 * <p>Both reports are generated through one engine, baseline first, so the comparison is the
 * engine's "previous run" delta. Domains without a baseline file reuse the current file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * circuit-insight compare src/main.nr --baseline-acir old-acir.svg --acir acir.svg
 * circuit-insight compare src/main.nr --baseline-gates old.svg --gates new.svg --metric GATES --fail-on-regression
 * }</pre>
 */
@Command(
    name = "compare",
    description = "Compare line-level metrics against a baseline profile",
    mixinStandardHelpOptions = true
)
public class CompareCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompareCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ProfileInputOptions input;

    @Option(names = {"--baseline-acir"}, description = "Baseline constrained (ACIR) opcode flamegraph")
    Path baselineAcir;

    @Option(names = {"--baseline-brillig"}, description = "Baseline unconstrained (Brillig) opcode flamegraph")
    Path baselineBrillig;

    @Option(names = {"--baseline-gates"}, description = "Baseline gate flamegraph")
    Path baselineGates;

    @Option(
        names = {"-m", "--metric"},
        description = "Metric to compare: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "TOTAL"
    )
    MetricType metric;

    @Option(names = {"--json"}, description = "Print the comparison as JSON")
    boolean json;

    @Option(names = {"--fail-on-regression"}, description = "Exit with code 2 if the overall cost increased")
    boolean failOnRegression;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (baselineAcir == null && baselineBrillig == null && baselineGates == null) {
            spec.commandLine().getErr().println("✗ Compare failed: at least one --baseline-* file is required");
            return 1;
        }
        try (CircuitInsightEngine engine = new CircuitInsightEngine(input.loadConfig())) {
            ComplexityReport baseline = engine.generateComplexityReport(input.read(
                baselineAcir != null ? baselineAcir : input.getAcirFile(),
                baselineBrillig != null ? baselineBrillig : input.getBrilligFile(),
                baselineGates != null ? baselineGates : input.getGatesFile()));
            ComplexityReport current = engine.generateComplexityReport(input.read());

            // Identical inputs are served from the cache and leave no second history entry.
            MetricsComparison comparison = engine.compareWithPrevious(current, metric)
                .orElseGet(() -> DeltaCalculator.compare(current, baseline, metric, Instant.now()));
            log.info("Compared {}: {} changed lines, overall {}",
                input.getSourceFile(), comparison.deltas().size(), comparison.overallChange());

            if (json) {
                out.println(JsonOutput.write(comparison));
            } else {
                ReportFormatter.printComparison(out, comparison);
                out.println();
                out.println("✓ Comparison complete");
            }
            out.flush();

            if (failOnRegression && comparison.overallChange() > 0) {
                spec.commandLine().getErr().println("✗ Overall cost increased by " + comparison.overallChange());
                return 2;
            }
            return 0;
        } catch (Exception e) {
            log.error("Comparison failed", e);
            spec.commandLine().getErr().println("✗ Compare failed: " + e.getMessage());
            return 1;
        }
    }
}

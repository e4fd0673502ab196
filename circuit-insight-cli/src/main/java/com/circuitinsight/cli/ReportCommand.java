package com.circuitinsight.cli;

import com.circuitinsight.core.CircuitInsightEngine;
import com.circuitinsight.core.model.ComplexityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Builds a complexity report from profiler output files.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * circuit-insight report src/main.nr --acir acir.svg --brillig brillig.svg --gates gates.svg
 * circuit-insight report src/main.nr --gates gates.svg --json
 * }</pre>
 */
@Command(
    name = "report",
    description = "Build a complexity report from profiler output",
    mixinStandardHelpOptions = true
)
public class ReportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReportCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ProfileInputOptions input;

    @Option(names = {"--json"}, description = "Print the report as JSON")
    boolean json;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (CircuitInsightEngine engine = new CircuitInsightEngine(input.loadConfig())) {
            log.info("Building report for: {}", input.getSourceFile());
            ComplexityReport report = engine.generateComplexityReport(input.read());

            if (json) {
                out.println(JsonOutput.write(report));
            } else {
                ReportFormatter.printReport(out, report);
                out.println();
                out.println("✓ Report complete");
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.error("Report failed", e);
            spec.commandLine().getErr().println("✗ Report failed: " + e.getMessage());
            return 1;
        }
    }
}

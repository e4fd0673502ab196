package com.circuitinsight.cli;

import com.circuitinsight.core.CircuitInsightEngine;
import com.circuitinsight.core.model.ComplexityReport;
import com.circuitinsight.core.model.InsightReport;
import com.circuitinsight.core.model.Severity;
import com.circuitinsight.core.profiler.ProfilerOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Builds a complexity report and runs the optimization rules over it.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * circuit-insight analyze src/main.nr --acir acir.svg --gates gates.svg
 * circuit-insight analyze src/main.nr --gates gates.svg --fail-on-high
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Report plus optimization suggestions",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ProfileInputOptions input;

    @Option(names = {"--json"}, description = "Print report and insights as JSON")
    boolean json;

    @Option(names = {"--fail-on-high"}, description = "Exit with code 2 if any high-severity suggestion is found")
    boolean failOnHigh;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (CircuitInsightEngine engine = new CircuitInsightEngine(input.loadConfig())) {
            ProfilerOutput output = input.read();
            ComplexityReport report = engine.generateComplexityReport(output);
            InsightReport insights = engine.analyzeCircuit(report, output.sourceCode());
            log.info("Analysis of {} produced {} suggestions", input.getSourceFile(), insights.suggestions().size());

            if (json) {
                Map<String, Object> document = new LinkedHashMap<>();
                document.put("report", report);
                document.put("insights", insights);
                out.println(JsonOutput.write(document));
            } else {
                ReportFormatter.printReport(out, report);
                ReportFormatter.printInsights(out, insights);
                out.println();
                out.println("✓ Analysis complete");
            }
            out.flush();

            if (failOnHigh && !insights.suggestionsBySeverity(Severity.HIGH).isEmpty()) {
                spec.commandLine().getErr().println("✗ High-severity suggestions found");
                return 2;
            }
            return 0;
        } catch (Exception e) {
            log.error("Analysis failed", e);
            spec.commandLine().getErr().println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }
}

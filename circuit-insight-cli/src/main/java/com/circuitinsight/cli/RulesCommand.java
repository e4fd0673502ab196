package com.circuitinsight.cli;

import com.circuitinsight.core.analyzer.AnalyzerRule;
import com.circuitinsight.core.analyzer.OptimizationAnalyzer;
import com.circuitinsight.core.config.ConfigLoader;
import com.circuitinsight.core.config.InsightConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Lists the analyzer rules discovered via SPI and whether configuration enables them.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * circuit-insight rules
 * circuit-insight rules --config ci.yaml
 * }</pre>
 */
@Command(
    name = "rules",
    description = "List available analyzer rules",
    mixinStandardHelpOptions = true
)
public class RulesCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = ConfigLoader.DEFAULT_FILE_NAME
    )
    Path configFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        InsightConfig config = ConfigLoader.load(configFile.toAbsolutePath());
        List<AnalyzerRule> rules = OptimizationAnalyzer.discoverRules();

        out.println("Available Rules:");
        out.println();
        for (AnalyzerRule rule : rules) {
            boolean enabled = config.analyzer().isRuleEnabled(rule.getId());
            out.printf("  • %s (ID: %s)%n", rule.getDisplayName(), rule.getId());
            out.printf("    Priority: %d%n", rule.getPriority());
            out.printf("    Enabled: %s%n", enabled ? "yes" : "no");
            out.println();
        }
        if (rules.isEmpty()) {
            out.println("  No rules found.");
        }
        out.flush();
        return 0;
    }
}

package com.circuitinsight;

import ch.qos.logback.classic.Level;
import com.circuitinsight.cli.AnalyzeCommand;
import com.circuitinsight.cli.CompareCommand;
import com.circuitinsight.cli.HeatmapCommand;
import com.circuitinsight.cli.ReportCommand;
import com.circuitinsight.cli.RulesCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Circuit Insight.
 *
 * <p>Circuit Insight turns profiler flamegraphs of a zero-knowledge circuit into per-line cost
 * metrics, hotspots and optimization suggestions.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code report} - Build a complexity report from profiler output</li>
 *   <li>{@code analyze} - Report plus optimization suggestions</li>
 *   <li>{@code heatmap} - Per-line heat badges</li>
 *   <li>{@code compare} - Line-level deltas against a baseline run</li>
 *   <li>{@code rules} - List available analyzer rules</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Summarize a circuit
 * circuit-insight report src/main.nr --acir acir.svg --gates gates.svg
 *
 * # Suggestions as JSON
 * circuit-insight analyze src/main.nr --gates gates.svg --json
 *
 * # Compare against a previous profile
 * circuit-insight compare src/main.nr --baseline-acir old.svg --acir new.svg
 * }</pre>
 */
@Command(
    name = "circuit-insight",
    mixinStandardHelpOptions = true,
    version = "Circuit Insight 1.0.0-SNAPSHOT",
    description = "Circuit complexity metrics and optimization insights",
    subcommands = {
        ReportCommand.class,
        AnalyzeCommand.class,
        HeatmapCommand.class,
        CompareCommand.class,
        RulesCommand.class
    }
)
public class CircuitInsightCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CircuitInsightCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("Circuit Insight - Circuit Complexity Metrics & Insight Engine");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'circuit-insight --help' to see available commands");
        System.out.println("Use 'circuit-insight <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line. Global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CircuitInsightCLI cli = new CircuitInsightCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}

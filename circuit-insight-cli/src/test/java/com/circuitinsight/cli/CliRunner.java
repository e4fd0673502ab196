package com.circuitinsight.cli;

import com.circuitinsight.CircuitInsightCLI;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the CLI in-process, capturing both output streams.
 */
final class CliRunner {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    int run(String... args) {
        CommandLine commandLine = CircuitInsightCLI.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    String out() {
        return out.toString();
    }

    String err() {
        return err.toString();
    }

    /**
     * Copies a bundled {@code profiles/} fixture into a directory.
     */
    static Path fixture(Path directory, String name) throws IOException {
        Path target = directory.resolve(name);
        try (InputStream in = CliRunner.class.getClassLoader().getResourceAsStream("profiles/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource: profiles/" + name);
            }
            Files.copy(in, target);
        }
        return target;
    }
}

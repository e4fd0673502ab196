package com.circuitinsight.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CompareCommandTest {

    @TempDir
    Path tempDir;

    private final CliRunner cli = new CliRunner();
    private Path source;
    private Path gates;
    private Path reducedGates;

    @BeforeEach
    void setUp() throws IOException {
        source = CliRunner.fixture(tempDir, "main.nr");
        gates = CliRunner.fixture(tempDir, "main-gates.svg");
        reducedGates = Files.writeString(tempDir.resolve("reduced-gates.svg"),
            Files.readString(gates).replace("(500 gates, 50%)", "(200 gates, 28.6%)"));
    }

    @Test
    void compare_reducedGates_reportsImprovement() {
        int exitCode = cli.run("compare", source.toString(),
            "--baseline-gates", gates.toString(), "--gates", reducedGates.toString(), "--fail-on-regression");

        assertThat(exitCode).isZero();
        assertThat(cli.out())
            .contains("Overall change: -300")
            .contains("main.nr:8")
            .contains("✓ Comparison complete");
    }

    @Test
    void compare_increasedGates_failsOnRegression() {
        int exitCode = cli.run("compare", source.toString(),
            "--baseline-gates", reducedGates.toString(), "--gates", gates.toString(), "--fail-on-regression");

        assertThat(exitCode).isEqualTo(2);
        assertThat(cli.err()).contains("Overall cost increased by 300");
    }

    @Test
    void compare_identicalProfiles_hasNoLineChanges() {
        int exitCode = cli.run("compare", source.toString(),
            "--baseline-gates", gates.toString(), "--gates", gates.toString());

        assertThat(exitCode).isZero();
        assertThat(cli.out()).contains("No line-level changes");
    }

    @Test
    void compare_withoutBaseline_failsWithExitCodeOne() {
        int exitCode = cli.run("compare", source.toString(), "--gates", gates.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.err()).contains("at least one --baseline-* file is required");
    }
}

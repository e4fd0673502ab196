package com.circuitinsight.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class HeatmapCommandTest {

    @TempDir
    Path tempDir;

    private final CliRunner cli = new CliRunner();

    @Test
    void heatmap_top_limitsToHottestLines() throws IOException {
        Path source = CliRunner.fixture(tempDir, "main.nr");
        Path gates = CliRunner.fixture(tempDir, "main-gates.svg");

        int exitCode = cli.run("heatmap", source.toString(), "--gates", gates.toString(), "--metric", "GATES", "--top", "1");

        assertThat(exitCode).isZero();
        assertThat(cli.out().lines()).singleElement().satisfies(line -> assertThat(line.trim()).startsWith("8 "));
    }
}

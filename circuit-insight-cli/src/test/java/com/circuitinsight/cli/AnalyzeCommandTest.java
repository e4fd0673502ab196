package com.circuitinsight.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyzeCommandTest {

    @TempDir
    Path tempDir;

    private final CliRunner cli = new CliRunner();
    private Path source;
    private Path acir;
    private Path gates;

    @BeforeEach
    void setUp() throws IOException {
        source = CliRunner.fixture(tempDir, "main.nr");
        acir = CliRunner.fixture(tempDir, "main-acir.svg");
        gates = CliRunner.fixture(tempDir, "main-gates.svg");
    }

    @Test
    void analyze_printsSuggestions() {
        int exitCode = cli.run("analyze", source.toString(), "--acir", acir.toString(), "--gates", gates.toString());

        assertThat(exitCode).isZero();
        assertThat(cli.out())
            .contains("Suggestions:")
            .contains("Hash function inside loop")
            .contains("Loop: 20 iterations")
            .contains("✓ Analysis complete");
    }

    @Test
    void analyze_json_containsReportAndInsights() throws IOException {
        int exitCode = cli.run("analyze", source.toString(),
            "--acir", acir.toString(), "--gates", gates.toString(), "--json");

        JsonNode json = new ObjectMapper().readTree(cli.out());
        assertThat(exitCode).isZero();
        assertThat(json.get("report").get("totalGates").asLong()).isEqualTo(1000);
        JsonNode insights = json.get("insights");
        assertThat(insights.get("totalPotentialSavings").asLong()).isEqualTo(750);
        assertThat(insights.get("suggestions").get(0).get("id").asText()).isEqualTo("hash-in-loop-8");
    }

    @Test
    void analyze_failOnHigh_exitsWithTwo() {
        int exitCode = cli.run("analyze", source.toString(), "--gates", gates.toString(), "--fail-on-high");

        assertThat(exitCode).isEqualTo(2);
        assertThat(cli.err()).contains("High-severity suggestions found");
    }

    @Test
    void analyze_configDisablingRules_isHonoured() throws IOException {
        Path config = Files.writeString(tempDir.resolve("circuit-insight.yaml"), """
            analyzer:
              rules:
                hotspots: false
                loops: false
                hash-operations: false
            """);

        int exitCode = cli.run("analyze", source.toString(), "--gates", gates.toString(),
            "--config", config.toString(), "--fail-on-high");

        assertThat(exitCode).isZero();
        assertThat(cli.out()).contains("Division").doesNotContain("Hash function inside loop");
    }
}

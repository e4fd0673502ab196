package com.circuitinsight.core.config;

import com.circuitinsight.core.metrics.HotspotCriteria;
import com.circuitinsight.core.model.MetricType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_overlaysDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            metrics:
              cacheTimeoutMs: 60000
              historyDepth: 3

            hotspots:
              metricType: GATES
              sortBy: ABSOLUTE
              minimumThreshold: 250
              maxResults: 4

            analyzer:
              hotspotThreshold: 2.5
              complexityThresholds:
                medium: 20000
              rules:
                arrays: false
                hash-operations: true
              savings:
                hotspot: 0.25
                divisionFallback: 40
            """);

        InsightConfig config = ConfigLoader.load(configFile);

        assertThat(config.metrics().cacheTimeoutMs()).isEqualTo(60_000L);
        assertThat(config.metrics().historyDepth()).isEqualTo(3);
        assertThat(config.metrics().defaultFileName()).isEqualTo("main.nr");
        assertThat(config.hotspots().toCriteria())
            .isEqualTo(new HotspotCriteria(MetricType.GATES, 250, HotspotCriteria.SortKey.ABSOLUTE, 4));
        assertThat(config.analyzer().hotspotThreshold()).isEqualTo(2.5);
        assertThat(config.analyzer().complexityThresholds().low()).isEqualTo(1_000L);
        assertThat(config.analyzer().complexityThresholds().medium()).isEqualTo(20_000L);
        assertThat(config.analyzer().isRuleEnabled("arrays")).isFalse();
        assertThat(config.analyzer().isRuleEnabled("hash-operations")).isTrue();
        assertThat(config.analyzer().isRuleEnabled("loops")).isTrue();
        assertThat(config.analyzer().savings().hotspot()).isEqualTo(0.25);
        assertThat(config.analyzer().savings().divisionFallback()).isEqualTo(40L);
        assertThat(config.analyzer().savings().nestedLoop()).isEqualTo(0.5);
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            project:
              name: "ignored"
            metrics:
              topFunctions: 2
              colour: red
            """);

        InsightConfig config = ConfigLoader.load(configFile);

        assertThat(config.metrics().topFunctions()).isEqualTo(2);
    }

    @Test
    void load_missingFile_returnsDefaults() {
        InsightConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(InsightConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "metrics: [unclosed\n  historyDepth: : :");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(InsightConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(InsightConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(InsightConfig.defaults());
    }

    @Test
    void parse_text_overlaysDefaults() {
        InsightConfig config = ConfigLoader.parse("analyzer:\n  loopIterationLimit: 32\n");

        assertThat(config.analyzer().loopIterationLimit()).isEqualTo(32);
        assertThat(config.analyzer().nestedLoopLookback()).isEqualTo(5);
        assertThat(ConfigLoader.parse("  ")).isEqualTo(InsightConfig.defaults());
    }
}

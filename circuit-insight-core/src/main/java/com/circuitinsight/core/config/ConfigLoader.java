package com.circuitinsight.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading circuit insight configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code circuit-insight.yaml} into {@link InsightConfig} records
 * and overlays the result on {@link InsightConfig#defaults()}. If the file is missing, empty or
 * invalid, the defaults are returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * InsightConfig config = ConfigLoader.load(Path.of("circuit-insight.yaml"));
 * CircuitInsightEngine engine = new CircuitInsightEngine(config);
 * }</pre>
 */
public final class ConfigLoader {

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "circuit-insight.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link InsightConfig#defaults()}.
     *
     * @param configPath path to {@code circuit-insight.yaml}
     * @return loaded configuration merged over the defaults
     */
    public static InsightConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return InsightConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return InsightConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            InsightConfig config = YAML_MAPPER.readValue(configPath.toFile(), InsightConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return InsightConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return InsightConfig.defaults().merge(config);
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return InsightConfig.defaults();
        }
    }

    /**
     * Parses configuration from YAML text, overlaid on the defaults.
     *
     * @param yaml YAML content
     * @return parsed configuration, or defaults if the text is blank or invalid
     */
    public static InsightConfig parse(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            return InsightConfig.defaults();
        }
        try {
            InsightConfig config = YAML_MAPPER.readValue(yaml, InsightConfig.class);
            return InsightConfig.defaults().merge(config);
        } catch (IOException e) {
            log.error("Failed to parse configuration. Using defaults. Error: {}", e.getMessage());
            return InsightConfig.defaults();
        }
    }
}

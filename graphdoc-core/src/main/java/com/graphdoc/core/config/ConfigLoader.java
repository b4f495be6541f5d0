package com.graphdoc.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading GraphDoc configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code graphdoc.yaml} into {@link GraphDocConfig} records.
 * If the config file is missing, empty or invalid, returns {@link GraphDocConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * GraphDocConfig config = ConfigLoader.load(Paths.get("graphdoc.yaml"));
 * Path docs = Paths.get(config.output().directory());
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Default configuration file name.
     */
    public static final String DEFAULT_FILE_NAME = "graphdoc.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Reads {@code graphdoc.yaml}.
     *
     * <p>A missing, unreadable, empty or malformed file is logged and replaced by
     * {@link GraphDocConfig#defaults()}.
     *
     * @param configPath path to {@code graphdoc.yaml}
     * @return configuration, defaults when the file is unusable
     */
    public static GraphDocConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("No configuration at {}, falling back to defaults", configPath);
            return GraphDocConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Cannot read configuration {}, falling back to defaults", configPath);
            return GraphDocConfig.defaults();
        }

        try {
            log.debug("Reading GraphDoc configuration {}", configPath);
            GraphDocConfig config = YAML_MAPPER.readValue(configPath.toFile(), GraphDocConfig.class);
            if (config == null) {
                log.warn("Configuration {} is empty, falling back to defaults", configPath);
                return GraphDocConfig.defaults();
            }
            log.info("Using configuration {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Invalid configuration {}, falling back to defaults: {}", configPath, e.getMessage());
            return GraphDocConfig.defaults();
        }
    }
}

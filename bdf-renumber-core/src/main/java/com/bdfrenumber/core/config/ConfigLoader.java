package com.bdfrenumber.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading renumbering configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code bdf-renumber.yaml} into {@link RenumberConfig} records.
 * If the config file is missing or invalid, returns {@link RenumberConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RenumberConfig config = ConfigLoader.load(Path.of("bdf-renumber.yaml"));
 * Set<String> disabled = config.effectiveDisabledCards();
 * }</pre>
 */
public class ConfigLoader {

    /** Default configuration file name, looked up next to the root deck. */
    public static final String DEFAULT_FILE_NAME = "bdf-renumber.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link RenumberConfig#defaults()}.
     *
     * @param configPath path to {@code bdf-renumber.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static RenumberConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return RenumberConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return RenumberConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            RenumberConfig config = YAML_MAPPER.readValue(configPath.toFile(), RenumberConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return RenumberConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return RenumberConfig.defaults();
        }
    }

    /**
     * Loads the configuration that sits next to a deck.
     *
     * @param deck root deck file
     * @return configuration from {@value #DEFAULT_FILE_NAME} in the deck's directory, or defaults
     */
    public static RenumberConfig loadFor(Path deck) {
        Path directory = deck.toAbsolutePath().getParent();
        return load(directory.resolve(DEFAULT_FILE_NAME));
    }
}

package com.bdfrenumber.cli;

import com.bdfrenumber.core.config.ConfigLoader;
import com.bdfrenumber.core.config.RenumberConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Configuration options shared by every command.
 */
public class ConfigOptions {

    private static final Logger log = LoggerFactory.getLogger(ConfigOptions.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: bdf-renumber.yaml next to the deck)"
    )
    Path configPath;

    @Option(
        names = {"--keep-set-ids"},
        description = "Keep SPC, MPC and load set IDs unchanged"
    )
    boolean keepSetIds;

    /**
     * Loads the configuration and applies command-line overrides.
     *
     * @param deck root deck file
     * @return effective configuration
     */
    RenumberConfig load(Path deck) {
        RenumberConfig config = configPath != null ? ConfigLoader.load(configPath) : ConfigLoader.loadFor(deck);
        if (keepSetIds) {
            log.debug("Set IDs are kept unchanged (--keep-set-ids)");
            config = new RenumberConfig(config.cards(), false, config.output());
        }
        log.debug("Disabled cards: {}", config.effectiveDisabledCards());
        return config;
    }
}

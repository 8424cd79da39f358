package com.bdfrenumber.cli;

import com.bdfrenumber.core.config.RenumberConfig;

/**
 * Helpers shared by the range-based commands.
 */
final class Commands {

    private Commands() {
        // Utility class
    }

    /**
     * Applies the set renumbering flag stored in a snapshot. Set IDs stay
     * frozen when either the configuration or the snapshot freezes them.
     */
    static RenumberConfig effectiveConfig(RenumberConfig config, RangeOptions.Selection selection) {
        if (Boolean.FALSE.equals(selection.renumberSetIds()) && config.renumberSetIds()) {
            return new RenumberConfig(config.cards(), false, config.output());
        }
        return config;
    }
}

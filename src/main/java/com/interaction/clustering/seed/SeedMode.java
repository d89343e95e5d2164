package com.interaction.clustering.seed;

import com.interaction.clustering.core.exception.ConfigurationException;

import java.util.Locale;

/**
 * How the iteration-0 assignment is produced.
 */
public enum SeedMode {
    /** Pick {@link #COMPONENTS} or {@link #UNIQUE} from the estimated entity count. */
    AUTO,
    /** Connected components over the whole graph; needs the entity set in memory. */
    COMPONENTS,
    /** Every entity starts in its own singleton cluster. */
    UNIQUE;

    /**
     * Parses the configuration spelling ({@code auto}, {@code components}, {@code unique}).
     */
    public static SeedMode fromConfig(String value) {
        if (value == null) {
            throw new ConfigurationException("seed_mode must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    "seed_mode must be one of auto, components, unique but was '" + value + "'", e);
        }
    }
}

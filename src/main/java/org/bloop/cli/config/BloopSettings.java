package org.bloop.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Typed, validated view of the {@code bloop} configuration block.
 *
 * <pre>
 * bloop {
 *   max-steps = 1000000
 *   source-extension = ".bloop"
 *   easter-eggs {
 *     enabled = true
 *     konami-sequence = "BBLLBBLL"
 *   }
 *   flavor {
 *     seed = 42   # optional; a time-based seed is used when absent
 *   }
 * }
 * </pre>
 */
public final class BloopSettings {

    private static final String ROOT_PATH = "bloop";

    private final int maxSteps;
    private final String sourceExtension;
    private final boolean easterEggsEnabled;
    private final String konamiSequence;
    private final Long flavorSeed;

    private BloopSettings(int maxSteps, String sourceExtension, boolean easterEggsEnabled,
                          String konamiSequence, Long flavorSeed) {
        this.maxSteps = maxSteps;
        this.sourceExtension = sourceExtension;
        this.easterEggsEnabled = easterEggsEnabled;
        this.konamiSequence = konamiSequence;
        this.flavorSeed = flavorSeed;
    }

    /**
     * Reads the settings from a resolved configuration.
     *
     * @param config The application configuration; must contain the {@code bloop} block.
     * @return The settings.
     * @throws ConfigException.Missing if a required key is absent.
     * @throws ConfigException.BadValue if a value is out of range.
     */
    public static BloopSettings fromConfig(final Config config) {
        final Config bloop = config.getConfig(ROOT_PATH);

        final int maxSteps = bloop.getInt("max-steps");
        if (maxSteps <= 0) {
            throw new ConfigException.BadValue(ROOT_PATH + ".max-steps", "must be a positive integer, got " + maxSteps);
        }

        final String konamiSequence = bloop.getString("easter-eggs.konami-sequence");
        if (konamiSequence.isEmpty()) {
            throw new ConfigException.BadValue(ROOT_PATH + ".easter-eggs.konami-sequence", "must not be empty");
        }

        final Long seed = bloop.hasPath("flavor.seed") ? bloop.getLong("flavor.seed") : null;

        return new BloopSettings(
                maxSteps,
                bloop.getString("source-extension"),
                bloop.getBoolean("easter-eggs.enabled"),
                konamiSequence,
                seed);
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public String getSourceExtension() {
        return sourceExtension;
    }

    public boolean isEasterEggsEnabled() {
        return easterEggsEnabled;
    }

    public String getKonamiSequence() {
        return konamiSequence;
    }

    /**
     * Returns the configured flavor seed.
     * @return The seed, or {@code null} when none is configured.
     */
    public Long getFlavorSeed() {
        return flavorSeed;
    }
}

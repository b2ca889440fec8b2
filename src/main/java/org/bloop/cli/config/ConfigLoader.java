package org.bloop.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * The configuration file picked up from the working directory when no explicit file is given.
     */
    public static final String CONFIG_FILE_NAME = "bloop.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dbloop.max-steps=500)
     * 2. Environment Variables
     * 3. Configuration file (the explicit file if given, otherwise the fallback file if it exists)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A file named on the command line, or {@code null}. It must exist.
     * @param fallbackFile A file used only when present, typically {@value #CONFIG_FILE_NAME}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if a file cannot be read or parsed.
     */
    public static Config load(final File explicitFile, final File fallbackFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            LOG.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile, ConfigParseOptions.defaults().setAllowMissing(false));
        } else if (fallbackFile != null && fallbackFile.isFile()) {
            LOG.info("Using configuration file found in current directory: {}", fallbackFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(fallbackFile);
        } else {
            LOG.debug("No configuration file found. Using default configuration from classpath.");
            fileConfig = ConfigFactory.empty();
        }

        // Chain the configs together. The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}

package org.syntaxforge.cst.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the tree configuration from various sources.
 * The loader respects a specific precedence order so that a single run can be tuned
 * without touching the packaged defaults.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_CONFIG_FILE_NAME = "cst.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using the optional {@code cst.conf} override file.
     * A missing override file is normal and not reported as a problem.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(DEFAULT_CONFIG_FILE_NAME, false);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. CLI arguments (as Java System Properties, e.g., -Dcst.mutation.verify-invariants=true)
     * 2. Configuration file (looked up in the working directory, then on the classpath)
     * 3. Default values (from reference.conf on the classpath)
     *
     * @param fileName The configuration file the caller expects to exist.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String fileName) {
        return load(fileName, true);
    }

    private static Config load(final String fileName, final boolean required) {
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config fileConfig = loadFile(fileName, required);
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return cliConfig
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    private static Config loadFile(final String fileName, final boolean required) {
        final File configFile = new File(fileName);
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile);
        }

        final Config resourceConfig = ConfigFactory.parseResources(fileName);
        if (!resourceConfig.isEmpty()) {
            LOG.info("Loading configuration from classpath resource: {}", fileName);
            return resourceConfig;
        }

        if (required) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", fileName);
        } else {
            LOG.debug("No '{}' override present, using defaults.", fileName);
        }
        return ConfigFactory.empty();
    }
}

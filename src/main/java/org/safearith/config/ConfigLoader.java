package org.safearith.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the library configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "safe-arith.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment overrides (variables prefixed with {@code CONFIG_FORCE_})
     * 2. Java System Properties (e.g., -Dsafe-arith.evaluator.default-type=u64)
     * 3. Configuration File (safe-arith.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return merge(fileConfig);
    }

    /**
     * Loads the configuration with a classpath resource in place of the working-directory file.
     *
     * @param resourceName The classpath resource, e.g. {@code "org/safearith/config/test-config.conf"}.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String resourceName) {
        LOG.debug("Loading configuration from classpath resource: {}", resourceName);
        return merge(ConfigFactory.parseResources(resourceName));
    }

    private static Config merge(final Config fileConfig) {
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
        return combinedConfig.resolve();
    }
}

package org.transitscope.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the telemetry configuration from four layers, highest precedence first:
 * <ol>
 *   <li>environment overrides ({@code CONFIG_FORCE_transitscope_snapshot_write__interval=5})</li>
 *   <li>system properties below {@code transitscope} ({@code -Dtransitscope.output.pretty-print=true})</li>
 *   <li>the configuration file, explicit or {@code transitscope.conf} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "transitscope.conf";
    static final String ROOT_PATH = "transitscope";

    private ConfigLoader() {
    }

    public static Config load() {
        return load(null);
    }

    /**
     * @param configFile An explicit configuration file, or {@code null} for the default location.
     * @return The merged and resolved configuration.
     * @throws com.typesafe.config.ConfigException if the file exists but cannot be parsed.
     */
    public static Config load(final File configFile) {
        Config properties = ConfigFactory.systemProperties();
        Config telemetryProperties = properties.hasPath(ROOT_PATH)
                ? properties.withOnlyPath(ROOT_PATH)
                : ConfigFactory.empty();

        return ConfigFactory.systemEnvironmentOverrides()
                .withFallback(telemetryProperties)
                .withFallback(fileLayer(configFile))
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    /**
     * A missing explicit file is worth a warning; a missing default file is the normal case.
     */
    private static Config fileLayer(final File configFile) {
        File file = configFile != null ? configFile : new File(CONFIG_FILE_NAME);
        if (file.isFile()) {
            LOG.info("Reading telemetry settings from {}", file.getAbsolutePath());
            return ConfigFactory.parseFile(file);
        }
        if (configFile != null) {
            LOG.warn("Configuration file '{}' not found. Using defaults.", file.getPath());
        } else {
            LOG.debug("No {} in the working directory, using built-in settings", CONFIG_FILE_NAME);
        }
        return ConfigFactory.empty();
    }
}

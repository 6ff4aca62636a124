package org.explorerscript.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the configuration of the command line tools.
 * <p>
 * System properties override the file given via {@code --config}, which overrides
 * {@code reference.conf}. Without a file, Typesafe Config's standard lookup applies
 * ({@code -Dconfig.file}, {@code application.conf} on the classpath).
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * @param configFile The file given on the command line, or {@code null}.
     * @return The resolved configuration.
     * @throws IllegalArgumentException            if {@code configFile} does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File configFile) {
        if (configFile == null) {
            log.debug("No --config given, using default configuration lookup");
            return ConfigFactory.load();
        }
        if (!configFile.isFile()) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
        }
        log.debug("Using configuration file {}", configFile.getAbsolutePath());
        return ConfigFactory.load(ConfigFactory.parseFile(configFile));
    }
}

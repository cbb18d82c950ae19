package org.jafc.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the analyzer configuration. Sources, highest precedence first:
 * <ol>
 *     <li>environment variables</li>
 *     <li>system properties, e.g. {@code -Djafc.analyzer.verbosity=3}</li>
 *     <li>{@value #CONFIG_FILE_NAME} in the working directory</li>
 *     <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "jafc.conf";

    private ConfigLoader() {
    }

    /**
     * @return The merged and resolved configuration, with {@value #CONFIG_FILE_NAME} read from the working directory.
     */
    public static Config load() {
        return load(Path.of(CONFIG_FILE_NAME));
    }

    /**
     * @param configFile The file used in place of {@value #CONFIG_FILE_NAME}; skipped if it is not a regular file.
     * @return The merged and resolved configuration.
     */
    public static Config load(Path configFile) {
        return ConfigFactory.systemEnvironment()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(fileLayer(configFile))
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    private static Config fileLayer(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            LOG.debug("No configuration file at '{}', using defaults", configFile);
            return ConfigFactory.empty();
        }
        LOG.info("Loading analyzer configuration from {}", configFile.toAbsolutePath());
        return ConfigFactory.parseFile(configFile.toFile());
    }
}

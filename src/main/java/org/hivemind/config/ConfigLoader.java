package org.hivemind.config;

import java.io.File;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the engine settings and returns the {@value #ROOT} block, i.e. the block holding
 * {@code spatial} and {@code ai}.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dhivemind.ai.algorithm=astar})</li>
 *   <li>Environment variables</li>
 *   <li>Overrides supplied by the host, relative to the {@value #ROOT} block</li>
 *   <li>The configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions in {@code reference.conf} are resolved after layering, so they see overrides.
 * <p>
 * The configuration file is, in order: the file passed by the host, the file named by the
 * {@value #FILE_PROPERTY} system property, {@code config/hivemind.conf} in the working
 * directory. Without any of them only the defaults apply.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Root path of all engine settings. */
    public static final String ROOT = "hivemind";

    /** System property naming the configuration file. */
    public static final String FILE_PROPERTY = "hivemind.config-file";

    static final File WORKING_DIRECTORY_FILE = new File("config", "hivemind.conf");

    private ConfigLoader() {
    }

    /**
     * @return The {@value #ROOT} block from the discovered file, if any, and the defaults.
     */
    public static Config load() {
        return load(null, ConfigFactory.empty());
    }

    /**
     * @param configFile The configuration file, or {@code null} for discovery.
     * @return The resolved {@value #ROOT} block.
     * @throws IllegalArgumentException if {@code configFile} does not exist.
     */
    public static Config load(File configFile) {
        return load(configFile, ConfigFactory.empty());
    }

    /**
     * Loads the settings with host overrides layered above the file.
     *
     * @param configFile The configuration file, or {@code null} for discovery.
     * @param overrides Settings relative to the {@value #ROOT} block, e.g. {@code ai.algorithm = astar}.
     * @return The resolved {@value #ROOT} block.
     * @throws IllegalArgumentException if the chosen configuration file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config load(File configFile, Config overrides) {
        Config layered = ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(overrides.atPath(ROOT));
        Optional<File> file = locate(configFile);
        if (file.isPresent()) {
            layered = layered.withFallback(ConfigFactory.parseFile(file.get()));
        }
        return layered
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve()
            .getConfig(ROOT);
    }

    /**
     * @param configFile The file passed by the host, or {@code null}.
     * @return The configuration file to layer, empty if the defaults apply alone.
     */
    static Optional<File> locate(File configFile) {
        if (configFile != null) {
            requireExisting(configFile, "Configuration file not found: ");
            LOG.info("Using configuration file {}", configFile.getAbsolutePath());
            return Optional.of(configFile);
        }

        String property = System.getProperty(FILE_PROPERTY);
        if (property != null && !property.isBlank()) {
            File named = new File(property).getAbsoluteFile();
            requireExisting(named, "Configuration file named by -D" + FILE_PROPERTY + " not found: ");
            LOG.info("Using configuration file {} from -D{}", named, FILE_PROPERTY);
            return Optional.of(named);
        }

        if (WORKING_DIRECTORY_FILE.isFile()) {
            LOG.info("Using configuration file {}", WORKING_DIRECTORY_FILE.getAbsolutePath());
            return Optional.of(WORKING_DIRECTORY_FILE);
        }

        LOG.debug("No configuration file found, using reference defaults");
        return Optional.empty();
    }

    private static void requireExisting(File file, String message) {
        if (!file.isFile()) {
            throw new IllegalArgumentException(message + file.getAbsolutePath());
        }
    }
}

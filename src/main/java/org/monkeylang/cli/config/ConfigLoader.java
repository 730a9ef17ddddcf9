package org.monkeylang.cli.config;

import java.io.File;
import java.util.Map;
import java.util.Optional;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the HOCON configuration of the command line.
 * <p>
 * At most one user file is merged between the overrides and the defaults, highest precedence
 * first:
 * <ol>
 *   <li>Java system properties ({@code -Dmonkey.repl.prompt=...})</li>
 *   <li>environment variables</li>
 *   <li>the user file picked by {@link #locate(File, Map)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    static final String ENV_CONFIG_FILE = "MONKEY_CONFIG";
    static final File DEFAULT_CONFIG_FILE = new File("config", "monkey.conf");

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration is resolved.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * A user configuration file and how it was found.
     *
     * @param file   the file, as an absolute path.
     * @param origin where the path came from, e.g. {@code --config}.
     */
    record ConfigSource(File file, String origin) {
    }

    /**
     * Resolves the configuration for the current process.
     *
     * @param explicitConfigFile file from the {@code --config} option, or {@code null}.
     * @param handler            receives one message naming the source that was used.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if a file named explicitly does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        Optional<ConfigSource> source = locate(explicitConfigFile, System.getenv());
        if (source.isEmpty()) {
            handler.log(MessageLevel.INFO,
                    "No '" + DEFAULT_CONFIG_FILE.getPath() + "' found. Using default configuration from classpath.");
            return loadDefaults();
        }
        handler.log(MessageLevel.INFO,
                "Using configuration file from " + source.get().origin() + ": " + source.get().file());
        return loadFromFile(source.get().file());
    }

    /**
     * Picks the user configuration file. Candidates are tried in this order: the {@code --config}
     * option, the {@code -Dconfig.file} property, the {@code MONKEY_CONFIG} environment variable,
     * and {@code config/monkey.conf} in the working directory. The first three must point at an
     * existing file; the last is used only if present.
     *
     * @param explicitConfigFile file from the {@code --config} option, or {@code null}.
     * @param env                the process environment.
     * @return the chosen file, or empty to use the classpath defaults alone.
     * @throws IllegalArgumentException if an explicitly named file does not exist.
     */
    static Optional<ConfigSource> locate(final File explicitConfigFile, final Map<String, String> env) {
        if (explicitConfigFile != null) {
            return Optional.of(required(explicitConfigFile, "--config"));
        }

        final String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            return Optional.of(required(new File(property), "-Dconfig.file"));
        }

        final String fromEnv = env.get(ENV_CONFIG_FILE);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Optional.of(required(new File(fromEnv), ENV_CONFIG_FILE));
        }

        if (DEFAULT_CONFIG_FILE.isFile()) {
            return Optional.of(new ConfigSource(DEFAULT_CONFIG_FILE.getAbsoluteFile(), "config/monkey.conf in the working directory"));
        }
        return Optional.empty();
    }

    private static ConfigSource required(final File file, final String origin) {
        final File absolute = file.getAbsoluteFile();
        if (!absolute.exists()) {
            throw new IllegalArgumentException("Configuration file not found (" + origin + "): " + absolute);
        }
        return new ConfigSource(absolute, origin);
    }

    /**
     * Loads a user file between the overrides and the classpath defaults.
     */
    static Config loadFromFile(final File configFile) {
        return compose(ConfigFactory.parseFile(configFile));
    }

    /**
     * Loads the overrides and the classpath defaults only.
     */
    static Config loadDefaults() {
        return compose(ConfigFactory.empty());
    }

    private static Config compose(final Config user) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(user)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}

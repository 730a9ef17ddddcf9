package org.monkeylang.cli;

import java.io.File;
import java.net.URL;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.monkeylang.cli.commands.ReplCommand;
import org.monkeylang.cli.commands.RunCommand;
import org.monkeylang.cli.config.ConfigLoader;
import org.monkeylang.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Entry point of the {@code monkey} command.
 * <p>
 * The configuration is loaded lazily, the first time a subcommand asks for it, so that
 * {@code --help} and {@code --version} work even with a broken configuration file.
 */
@Command(
    name = "monkey",
    mixinStandardHelpOptions = true,
    versionProvider = CommandLineInterface.ManifestVersionProvider.class,
    description = "Monkey - a small interpreted expression language",
    subcommands = {
        RunCommand.class,
        ReplCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    static final String LOG_FORMAT_PROPERTY = "monkey.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/monkey.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show the usage.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("monkey");
        return commandLine;
    }

    /**
     * Returns the resolved configuration, loading it and applying its logging settings on
     * first use.
     *
     * @return the application configuration.
     * @throws CommandLine.ParameterException if the configuration cannot be found, parsed or applied.
     */
    public Config getConfig() {
        if (config == null) {
            Config loaded = loadConfig();
            applyLogging(loaded);
            config = loaded;
        }
        return config;
    }

    private Config loadConfig() {
        try {
            return ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> LOG.info(message);
                    case WARN -> LOG.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }

    private void applyLogging(Config loaded) {
        if (loaded.hasPath("logging.format")) {
            System.setProperty(LOG_FORMAT_PROPERTY, appenderFor(loaded.getString("logging.format")));
            reconfigureLogback();
        }
        LoggingConfigurator.configure(loaded);
    }

    /**
     * Maps the {@code logging.format} setting to the Logback appender that implements it.
     */
    private String appenderFor(String format) {
        return switch (format.toUpperCase(Locale.ROOT)) {
            case "PLAIN" -> "STDOUT_PLAIN";
            case "COLOR" -> "STDOUT";
            default -> throw new CommandLine.ParameterException(spec.commandLine(),
                    "Unknown logging.format '" + format + "', expected PLAIN or COLOR");
        };
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            spec.commandLine().getErr().println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Reports the version recorded in the jar manifest, or {@code dev} when running from classes.
     */
    static class ManifestVersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = CommandLineInterface.class.getPackage().getImplementationVersion();
            return new String[] {"Monkey " + (version != null ? version : "dev")};
        }
    }
}

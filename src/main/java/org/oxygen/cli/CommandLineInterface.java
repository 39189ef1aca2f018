package org.oxygen.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.oxygen.cli.commands.CompileCommand;
import org.oxygen.cli.commands.CompletionsCommand;
import org.oxygen.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "oxygen",
    mixinStandardHelpOptions = true,
    version = "Oxygen 0.1.0",
    description = "Oxygen - compiler front end for the Oxygen language",
    subcommands = {
        CompileCommand.class,
        CompletionsCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String CONFIG_FILE_NAME = "oxygen.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the picocli command line used by {@link #main(String[])}.
     * @return A command line for a fresh {@link CommandLineInterface}.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("oxygen");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Returns the application configuration, loading it and applying its logging
     * settings on first use.
     * <p>
     * Load order: System Props &gt; Env Vars &gt; File &gt; Classpath defaults. The file is the one
     * given by {@code --config}, else {@code oxygen.conf} in the working directory if present.
     * {@code -Dconfig.file} is honoured by the classpath defaults.
     *
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if a configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig();
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    private Config loadConfig() {
        Config fileConfig = ConfigFactory.empty();
        if (configFile != null) {
            LOGGER.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile, ConfigParseOptions.defaults().setAllowMissing(false));
        } else {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.exists()) {
                LOGGER.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfigFile, ConfigParseOptions.defaults().setAllowMissing(false));
            } else {
                LOGGER.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
            }
        }
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();
    }
}

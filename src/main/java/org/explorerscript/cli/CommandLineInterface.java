package org.explorerscript.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.explorerscript.cli.commands.ResolveJumpsCommand;
import org.explorerscript.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "explorerscript",
    mixinStandardHelpOptions = true,
    version = "ExplorerScript 0.1.1",
    description = "ExplorerScript - decompiler tooling for SSB scripts",
    subcommands = {
        ResolveJumpsCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file overriding the defaults of reference.conf"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
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
        commandLine.setCommandName("explorerscript");
        return commandLine;
    }

    /**
     * Returns the application configuration, loading it on first access.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the configuration file given via {@code --config} does not exist.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    private void initialize() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile);

        if (config.hasPath("logging.level")) {
            applyLogLevel(config.getString("logging.level"), logger);
        }
        initialized = true;
    }

    private static void applyLogLevel(final String levelName, final Logger logger) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            logger.warn("Logging backend is not Logback, ignoring logging.level={}", levelName);
            return;
        }
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown logging.level '{}', keeping the default level", levelName);
            return;
        }
        context.getLogger("org.explorerscript").setLevel(level);
    }
}

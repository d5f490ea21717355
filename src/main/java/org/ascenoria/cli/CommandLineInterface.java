package org.ascenoria.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.ascenoria.cli.commands.InspectCommand;
import org.ascenoria.cli.commands.LintCommand;
import org.ascenoria.cli.commands.RunCommand;
import org.ascenoria.config.ConfigLoader;
import org.ascenoria.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "ascenoria",
    mixinStandardHelpOptions = true,
    version = "Ascenoria content tools 1.0",
    description = "Lints, inspects and serves Ascenoria content packs.",
    subcommands = {
        LintCommand.class,
        InspectCommand.class,
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: ascenoria.conf in the working directory)"
    )
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * @return The configured picocli command line, with configuration errors mapped to exit code 1.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("ascenoria");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof ConfigException || ex instanceof IllegalArgumentException) {
                cmd.getErr().println("Configuration error: " + ex.getMessage());
                return 1;
            }
            throw ex;
        });
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     */
    public synchronized Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}

package org.fluxgen.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.fluxgen.cli.commands.GenerateCommand;
import org.fluxgen.config.ConfigLoader;
import org.fluxgen.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "fluxgen",
    mixinStandardHelpOptions = true,
    version = "fluxgen 1.0",
    description = "Generates source units from dataflow graphs",
    subcommands = {
        GenerateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("fluxgen");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     *
     * @return The merged configuration.
     * @throws CommandLine.ParameterException if an explicit configuration file is missing
     *                                        or cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null && !configFile.isFile()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        try {
            config = ConfigLoader.load(configFile != null ? configFile : new File(ConfigLoader.CONFIG_FILE_NAME));
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage());
        }
        LoggingConfigurator.configure(config);
        LOG.debug("Configuration loaded");
        return config;
    }
}

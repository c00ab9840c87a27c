package org.xdrls.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xdrls.cli.commands.DefinitionCommand;
import org.xdrls.cli.commands.ReferencesCommand;
import org.xdrls.cli.commands.ServeCommand;
import org.xdrls.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "xdrls",
    mixinStandardHelpOptions = true,
    version = "xdrls 1.0",
    description = "Go-to-definition and find-references for XDR schema files",
    subcommands = {
        ServeCommand.class,
        DefinitionCommand.class,
        ReferencesCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for a workspace that cannot be indexed at all. */
    public static final int EXIT_FATAL = 2;

    private static final String CONFIG_FILE_NAME = "xdrls.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: xdrls.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("xdrls");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // Config load order: System Props > Env Vars > File > Classpath defaults
        Config fallback = ConfigFactory.load();
        File selected = selectConfigFile();
        if (selected != null) {
            if (!selected.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file not found: " + selected.getAbsolutePath());
            }
            logger.info("Using configuration file: {}", selected.getAbsolutePath());
            try {
                fallback = ConfigFactory.parseFile(selected).withFallback(fallback);
            } catch (ConfigException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Failed to parse configuration: " + e.getMessage());
            }
        }
        this.config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fallback)
                .resolve();

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Resolves the configuration file: {@code --config}, then {@code -Dconfig.file},
     * then {@code xdrls.conf} in the working directory.
     *
     * @return The file to load, or null to use classpath defaults only.
     */
    private File selectConfigFile() {
        if (configFile != null) {
            return configFile;
        }
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return new File(systemConfigPath).getAbsoluteFile();
        }
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        return cwdConfigFile.exists() ? cwdConfigFile : null;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}

package org.transitscope.cli;

import com.typesafe.config.Config;
import org.transitscope.cli.commands.DiagnoseCommand;
import org.transitscope.cli.commands.SnapshotCommand;
import org.transitscope.config.ConfigLoader;
import org.transitscope.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "transitscope",
    mixinStandardHelpOptions = true,
    version = "TransitScope 1.0",
    description = "TransitScope - transport network telemetry snapshots",
    subcommands = {
        SnapshotCommand.class,
        DiagnoseCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: transitscope.conf)"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("transitscope");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        this.config = ConfigLoader.load(configFile);
        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Returns the application configuration, loading it and applying its logging levels on
     * first use.
     *
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}

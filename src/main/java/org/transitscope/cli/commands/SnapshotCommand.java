package org.transitscope.cli.commands;

import com.typesafe.config.ConfigException;
import org.transitscope.cli.CommandLineInterface;
import org.transitscope.config.TelemetryConfiguration;
import org.transitscope.host.fixture.FixtureHostApi;
import org.transitscope.host.fixture.FixtureHostLoader;
import org.transitscope.host.fixture.FixtureLoadException;
import org.transitscope.pipeline.orchestrator.CycleOutcome;
import org.transitscope.pipeline.output.FileSnapshotSink;
import org.transitscope.runtime.TelemetryRuntime;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "snapshot",
    description = "Run snapshot cycles against a host fixture and write the telemetry document"
)
public class SnapshotCommand implements Callable<Integer> {

    @Option(
        names = {"-f", "--fixture"},
        required = true,
        description = "JSON fixture describing the host world"
    )
    private Path fixture;

    @Option(
        names = {"-n", "--cycles"},
        description = "Number of cycles to run (default: 1)"
    )
    private int cycles = 1;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: transitscope.output.directory)"
    )
    private Path outputDirectory;

    @Option(
        names = {"--pretty"},
        description = "Pretty-print the document"
    )
    private boolean pretty;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (cycles < 1) {
            err.println("--cycles must be at least 1");
            return 2;
        }

        TelemetryConfiguration configuration;
        try {
            configuration = TelemetryConfiguration.from(parent.getConfig());
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }
        if (outputDirectory != null) {
            configuration = configuration.withOutputDirectory(outputDirectory);
        }
        if (pretty) {
            configuration = configuration.withPrettyPrint(true);
        }

        FixtureHostApi host;
        try {
            host = new FixtureHostLoader().load(fixture);
        } catch (FixtureLoadException e) {
            err.println("Error loading fixture: " + e.getMessage());
            return 1;
        }

        FileSnapshotSink sink = new FileSnapshotSink(configuration.outputDirectory(), configuration.fileName());
        TelemetryRuntime runtime = new TelemetryRuntime(host, configuration, sink);
        runtime.onInit();
        CycleOutcome last = runtime.onGameReady().orElseThrow();
        for (int i = 1; i < cycles; i++) {
            last = runtime.onEvent("cli").orElse(last);
        }

        out.println("Wrote " + sink.target() + " (write_count=" + last.writeCount() + ", " + last.finalStage() + ")");
        for (Map.Entry<String, Number> metric : runtime.orchestrator().getMetrics().entrySet()) {
            out.println("  " + metric.getKey() + ": " + metric.getValue());
        }
        return last.written() ? 0 : 1;
    }
}

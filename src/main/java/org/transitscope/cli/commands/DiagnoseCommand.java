package org.transitscope.cli.commands;

import org.transitscope.host.capability.CapabilityTable;
import org.transitscope.host.fixture.FixtureHostLoader;
import org.transitscope.host.fixture.FixtureLoadException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "diagnose",
    description = "Probe a host fixture and print its capability report"
)
public class DiagnoseCommand implements Callable<Integer> {

    @Option(
        names = {"-f", "--fixture"},
        required = true,
        description = "JSON fixture describing the host world"
    )
    private Path fixture;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try {
            CapabilityTable table = CapabilityTable.probe(new FixtureHostLoader().load(fixture));
            spec.commandLine().getOut().print(table.render());
            return 0;
        } catch (FixtureLoadException e) {
            spec.commandLine().getErr().println("Error loading fixture: " + e.getMessage());
            return 1;
        }
    }
}

package org.transitscope.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitscope.config.TelemetryConfiguration;
import org.transitscope.host.EntityAccessor;
import org.transitscope.host.IHostApi;
import org.transitscope.pipeline.orchestrator.CycleOutcome;
import org.transitscope.pipeline.orchestrator.SnapshotOrchestrator;
import org.transitscope.pipeline.output.ISnapshotSink;

import java.io.IOException;
import java.util.Optional;

/**
 * Binds the host's lifecycle callbacks to the snapshot pipeline.
 * <p>
 * The host calls {@link #onInit()} when the script is loaded, {@link #onUpdate()} every
 * frame, {@link #onGameReady()} once its runtime interface is usable, and
 * {@link #onEvent(String)} for game events. Initialization happens once; later attempts
 * are ignored. A trigger that arrives while a cycle is running is dropped.
 */
public class TelemetryRuntime {

    private static final Logger log = LoggerFactory.getLogger(TelemetryRuntime.class);

    /**
     * Delta passed per frame, about 1/60 s.
     */
    public static final double FRAME_DELTA = 0.016;

    private final IHostApi host;
    private final TelemetryConfiguration configuration;
    private final ISnapshotSink sink;

    private EntityAccessor accessor;
    private SnapshotOrchestrator orchestrator;
    private TickAccumulator accumulator;
    private boolean initialized;
    private boolean cycleRunning;
    private boolean diagnosticsWritten;

    public TelemetryRuntime(IHostApi host, TelemetryConfiguration configuration, ISnapshotSink sink) {
        this.host = host;
        this.configuration = configuration;
        this.sink = sink;
    }

    /**
     * Probes the host and assembles the pipeline.
     *
     * @return {@code true} if this call initialized the runtime, {@code false} if it was
     *         already initialized.
     */
    public boolean onInit() {
        if (initialized) {
            log.info("Telemetry runtime already initialized, skipping second initialization");
            return false;
        }
        accessor = new EntityAccessor(host);
        orchestrator = SnapshotOrchestrator.builder(accessor, sink)
                .configuration(configuration)
                .build();
        accumulator = new TickAccumulator(configuration.writeInterval(), configuration.eventUnit());
        initialized = true;
        log.info("Telemetry runtime initialized, writing {} every {}s",
                configuration.fileName(), configuration.writeInterval());
        return true;
    }

    public Optional<CycleOutcome> onUpdate() {
        return onTick(FRAME_DELTA);
    }

    /**
     * Advances the tick accumulator and runs a cycle when one is due.
     *
     * @param dt The elapsed time in seconds.
     * @return The cycle outcome, or empty if no cycle ran.
     */
    public Optional<CycleOutcome> onTick(double dt) {
        ensureInitialized();
        return accumulator.onTick(dt) ? runCycle() : Optional.empty();
    }

    /**
     * Writes the runtime diagnostics report, allows the main report to be rewritten and
     * runs a cycle right away.
     */
    public Optional<CycleOutcome> onGameReady() {
        ensureInitialized();
        log.info("Host runtime interface ready, writing runtime diagnostics");
        writeDiagnostics(configuration.runtimeDiagnosticsFileName());
        diagnosticsWritten = false;
        return runCycle();
    }

    public Optional<CycleOutcome> onEvent(String eventName) {
        ensureInitialized();
        log.trace("Host event {}", eventName);
        return accumulator.onEvent() ? runCycle() : Optional.empty();
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Returns the orchestrator, or {@code null} before initialization.
     */
    public SnapshotOrchestrator orchestrator() {
        return orchestrator;
    }

    private void ensureInitialized() {
        if (!initialized) {
            onInit();
        }
    }

    private Optional<CycleOutcome> runCycle() {
        if (cycleRunning) {
            log.debug("Snapshot cycle already running, dropping trigger");
            return Optional.empty();
        }
        cycleRunning = true;
        try {
            if (!diagnosticsWritten) {
                writeDiagnostics(configuration.diagnosticsFileName());
                diagnosticsWritten = true;
            }
            return Optional.of(orchestrator.runCycle());
        } finally {
            cycleRunning = false;
        }
    }

    private void writeDiagnostics(String name) {
        if (!configuration.writeDiagnostics()) {
            return;
        }
        try {
            sink.writeDiagnostics(name, accessor.capabilities().render());
        } catch (IOException e) {
            log.warn("Could not write diagnostics report {}: {}", name, e.getMessage());
        }
    }
}

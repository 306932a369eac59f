package org.transitscope.runtime;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.transitscope.config.TelemetryConfiguration;
import org.transitscope.host.HostFunctions;
import org.transitscope.host.IHostApi;
import org.transitscope.host.fixture.FixtureHostApi;
import org.transitscope.host.fixture.FixtureHostLoader;
import org.transitscope.junit.extensions.logging.ExpectLog;
import org.transitscope.junit.extensions.logging.LogLevel;
import org.transitscope.junit.extensions.logging.LogWatchExtension;
import org.transitscope.pipeline.orchestrator.CycleOutcome;
import org.transitscope.pipeline.output.ISnapshotSink;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class TelemetryRuntimeTest {

    private FixtureHostApi host;
    private ISnapshotSink sink;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/small-network.json")) {
            host = new FixtureHostLoader().load(in);
        }
        sink = mock(ISnapshotSink.class);
    }

    private static TelemetryConfiguration configuration(String overrides) {
        return TelemetryConfiguration.from(ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve());
    }

    @Test
    void initializesOnlyOnce() {
        TelemetryRuntime runtime = new TelemetryRuntime(host, configuration(""), sink);

        assertThat(runtime.onInit()).isTrue();
        assertThat(runtime.onInit()).isFalse();
        assertThat(runtime.isInitialized()).isTrue();
        assertThat(host.functionQueryCount()).isEqualTo(1);
    }

    @Test
    void ticksAreThrottledByTheWriteInterval() throws Exception {
        TelemetryRuntime runtime = new TelemetryRuntime(host, configuration("transitscope.snapshot.write-interval = 2"), sink);
        runtime.onInit();

        assertThat(runtime.onTick(1.0)).isEmpty();
        Optional<CycleOutcome> outcome = runtime.onTick(1.0);
        assertThat(runtime.onTick(0.5)).isEmpty();

        assertThat(outcome).get().extracting(CycleOutcome::writeCount).isEqualTo(1L);
        verify(sink, times(1)).write(anyString());
    }

    @Test
    void firstCallbackInitializesLazily() {
        TelemetryRuntime runtime = new TelemetryRuntime(host, configuration(""), sink);

        Optional<CycleOutcome> outcome = runtime.onEvent("vehicleArrived");

        assertThat(runtime.isInitialized()).isTrue();
        assertThat(outcome).isPresent();
        assertThat(runtime.orchestrator().context().writeCount()).isEqualTo(1);
    }

    @Test
    void diagnosticsAreWrittenBeforeFirstCycleAndAgainWhenGameIsReady() throws Exception {
        TelemetryRuntime runtime = new TelemetryRuntime(host, configuration(""), sink);
        runtime.onInit();

        runtime.onEvent("first");
        runtime.onEvent("second");
        verify(sink, times(1)).writeDiagnostics(eq("telemetry_diag.txt"), contains("capability report"));

        runtime.onGameReady();
        verify(sink).writeDiagnostics(eq("telemetry_diag_runtime.txt"), contains("capability report"));
        verify(sink, times(2)).writeDiagnostics(eq("telemetry_diag.txt"), anyString());
        verify(sink, times(3)).write(anyString());
    }

    @Test
    void diagnosticsCanBeDisabled() throws Exception {
        TelemetryRuntime runtime = new TelemetryRuntime(host,
                configuration("transitscope.output.write-diagnostics = false"), sink);

        runtime.onGameReady();

        verify(sink, never()).writeDiagnostics(anyString(), anyString());
        verify(sink).write(anyString());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Could not write diagnostics report telemetry_diag.txt: no space")
    void diagnosticsFailureDoesNotStopTheCycle() throws Exception {
        doThrow(new IOException("no space")).when(sink).writeDiagnostics(anyString(), anyString());
        TelemetryRuntime runtime = new TelemetryRuntime(host, configuration(""), sink);

        Optional<CycleOutcome> outcome = runtime.onEvent("any");

        assertThat(outcome).get().extracting(CycleOutcome::written).isEqualTo(true);
    }

    @Test
    void triggerDuringRunningCycleIsDropped() {
        AtomicReference<TelemetryRuntime> runtimeRef = new AtomicReference<>();
        List<Optional<CycleOutcome>> nested = new ArrayList<>();
        IHostApi reentrant = new IHostApi() {
            @Override
            public Set<String> functions() {
                return host.functions();
            }

            @Override
            public Object invoke(String function, Object... args) {
                if (HostFunctions.GI_GET_GAME_TIME.equals(function) && runtimeRef.get() != null) {
                    nested.add(runtimeRef.get().onEvent("nested"));
                }
                return host.invoke(function, args);
            }

            @Override
            public Map<String, Object> constants(String table) {
                return host.constants(table);
            }
        };
        TelemetryRuntime runtime = new TelemetryRuntime(reentrant, configuration(""), sink);
        runtime.onInit();
        runtimeRef.set(runtime);

        Optional<CycleOutcome> outcome = runtime.onEvent("outer");

        assertThat(outcome).isPresent();
        assertThat(nested).containsExactly(Optional.empty());
        assertThat(runtime.orchestrator().context().cycles()).isEqualTo(1);
    }
}

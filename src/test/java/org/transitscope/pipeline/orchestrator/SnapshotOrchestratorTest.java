package org.transitscope.pipeline.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.transitscope.config.TelemetryConfiguration;
import org.transitscope.host.EntityAccessor;
import org.transitscope.host.EntityKind;
import org.transitscope.host.HostFunctions;
import org.transitscope.host.IHostApi;
import org.transitscope.host.fixture.FixtureHostApi;
import org.transitscope.host.fixture.FixtureHostLoader;
import org.transitscope.junit.extensions.logging.ExpectLog;
import org.transitscope.junit.extensions.logging.LogLevel;
import org.transitscope.junit.extensions.logging.LogWatchExtension;
import org.transitscope.pipeline.monitoring.OperationalError;
import org.transitscope.pipeline.output.FileSnapshotSink;
import org.transitscope.pipeline.output.ISnapshotSink;
import org.transitscope.pipeline.vehicle.VehicleCollector;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class SnapshotOrchestratorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private EntityAccessor accessor;
    private RecordingSink sink;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/small-network.json")) {
            accessor = new EntityAccessor(new FixtureHostLoader().load(in));
        }
        sink = new RecordingSink();
    }

    @Test
    void publishesCompleteDocumentForFixtureNetwork() throws Exception {
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(accessor, sink).build();

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.written()).isTrue();
        assertThat(outcome.finalStage()).isEqualTo(PipelineStage.WRITTEN);
        assertThat(outcome.stageErrors()).isEmpty();
        assertThat(outcome.writeCount()).isEqualTo(1);

        JsonNode doc = mapper.readTree(sink.last());
        assertThat(doc.get("schema_version").asInt()).isEqualTo(4);
        assertThat(doc.get("write_count").asLong()).isEqualTo(1);
        assertThat(doc.at("/game_time/date/year").asInt()).isEqualTo(1950);

        JsonNode line = doc.get("lines").get(0);
        assertThat(line.get("name").asText()).isEqualTo("Coast Line");
        assertThat(line.get("stop_count").asInt()).isEqualTo(3);
        assertThat(line.at("/stops/0/name").asText()).isEqualTo("Central");
        assertThat(line.at("/stops/1/station_id").asLong()).isEqualTo(20);
        assertThat(line.at("/stops/1/raw_stop_id").asLong()).isEqualTo(30);
        assertThat(line.at("/stops/1/name").asText()).isEqualTo("Harbour");
        assertThat(line.at("/stops/2/station_id").asLong()).isEqualTo(42);
        assertThat(line.at("/stops/2/name").asText()).isEqualTo("Stop #42");

        JsonNode coaster = doc.get("vehicles").get(0);
        assertThat(coaster.get("id").asLong()).isEqualTo(50);
        assertThat(coaster.get("line_name").asText()).isEqualTo("Coast Line");
        assertThat(coaster.get("last_stop_id").asLong()).isEqualTo(10);
        assertThat(coaster.get("last_stop_name").asText()).isEqualTo("Central");
        assertThat(coaster.get("next_stop_id").asLong()).isEqualTo(20);
        assertThat(coaster.get("next_stop_name").asText()).isEqualTo("Harbour");
        assertThat(coaster.get("speed_kmh").asDouble()).isEqualTo(36.0);
        assertThat(coaster.get("passengers").asLong()).isEqualTo(12);
        assertThat(coaster.get("cargo").asLong()).isEqualTo(3);
        assertThat(doc.get("vehicles").get(1).get("type").asText()).isEqualTo("ROAD");

        assertThat(doc.get("stations")).hasSize(2);
        assertThat(doc.at("/paths/0/line_id").asLong()).isEqualTo(40);
        assertThat(doc.at("/paths/0/points")).hasSize(2);
        assertThat(doc.at("/tracks/0/id").asLong()).isEqualTo(70);
        assertThat(doc.at("/tracks/0/kind").asText()).isEqualTo("rail");
        assertThat(doc.at("/signals/0/state").asInt()).isEqualTo(1);

        JsonNode stats = doc.get("stats");
        assertThat(stats.get("total_vehicles").asInt()).isEqualTo(2);
        assertThat(stats.get("total_passengers").asLong()).isEqualTo(12);
        assertThat(stats.get("total_lines").asInt()).isEqualTo(1);
        assertThat(stats.get("total_stations").asInt()).isEqualTo(2);
        assertThat(stats.at("/vehicles_by_type/RAIL").asInt()).isEqualTo(1);
        assertThat(stats.at("/vehicles_by_type/ROAD").asInt()).isEqualTo(1);

        assertThat(orchestrator.isHealthy()).isTrue();
    }

    @Test
    void unnamedTerminalGetsPlaceholderStopName() throws Exception {
        FixtureHostApi host = FixtureHostApi.builder()
                .entity(EntityKind.STATION, 10, Map.of("name", "Central", "position", List.of(0, 0)))
                .entity(EntityKind.LINE, 40, Map.of("name", "Shuttle", "stops", List.of(10, 42)))
                .entity(EntityKind.VEHICLE, 50, Map.of("line", 40, "stopIndex", 0))
                .build();
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(new EntityAccessor(host), sink).build();

        orchestrator.runCycle();

        JsonNode doc = mapper.readTree(sink.last());
        assertThat(doc.at("/stations/0/name").asText()).isEqualTo("Central");
        assertThat(doc.at("/lines/0/stops/1/name").asText()).isEqualTo("Stop #42");
        assertThat(doc.at("/vehicles/0/last_stop_name").asText()).isEqualTo("Central");
        assertThat(doc.at("/vehicles/0/next_stop_name").asText()).isEqualTo("Stop #42");
        assertThat(doc.get("game_time").isNull()).isTrue();
    }

    @Test
    void writeCountGrowsByOnePerDocument() throws Exception {
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(accessor, sink).build();

        orchestrator.runCycle();
        orchestrator.runCycle();
        CycleOutcome third = orchestrator.runCycle();

        assertThat(third.writeCount()).isEqualTo(3);
        assertThat(sink.documents).hasSize(3);
        for (int i = 0; i < 3; i++) {
            assertThat(mapper.readTree(sink.documents.get(i)).get("write_count").asLong()).isEqualTo(i + 1);
        }
        assertThat(orchestrator.getMetrics())
                .containsEntry("cycles", 3L)
                .containsEntry("write_count", 3L)
                .containsEntry("fallback_writes", 0L);
    }

    @Test
    void identicalStateProducesIdenticalDocumentsApartFromWriteCount() throws Exception {
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(accessor, sink).build();

        orchestrator.runCycle();
        orchestrator.runCycle();

        JsonNode first = mapper.readTree(sink.documents.get(0));
        JsonNode second = mapper.readTree(sink.documents.get(1));
        ((ObjectNode) first).remove("write_count");
        ((ObjectNode) second).remove("write_count");
        assertThat(second).isEqualTo(first);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Stage COLLECTING_VEHICLES failed.*IllegalStateException: host vanished")
    void failingStageLeavesItsSectionEmptyAndTheRestIntact() throws Exception {
        VehicleCollector broken = mock(VehicleCollector.class);
        when(broken.collect()).thenThrow(new IllegalStateException("host vanished"));
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(accessor, sink)
                .vehicleCollector(broken)
                .build();

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.finalStage()).isEqualTo(PipelineStage.WRITTEN);
        assertThat(outcome.stageErrors()).extracting(StageError::stage)
                .containsExactly(PipelineStage.COLLECTING_VEHICLES);
        JsonNode doc = mapper.readTree(sink.last());
        assertThat(doc.get("vehicles")).isEmpty();
        assertThat(doc.get("lines")).hasSize(1);
        assertThat(doc.get("stations")).hasSize(2);
        assertThat(doc.at("/stats/total_vehicles").asInt()).isZero();

        assertThat(orchestrator.isHealthy()).isFalse();
        assertThat(orchestrator.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.errorType()).isEqualTo("STAGE_FAILED");
            assertThat(error.cycle()).isEqualTo(1);
            assertThat(error.details()).contains("host vanished");
        });
        assertThat(orchestrator.getMetrics()).containsEntry("stage_failures", 1L);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Snapshot cycle 1 failed in stage SERIALIZING.*")
    void publishFailureIsAnsweredWithMinimalDocument() throws Exception {
        ISnapshotSink flaky = mock(ISnapshotSink.class);
        doThrow(new IOException("disk full"))
                .doNothing()
                .when(flaky).write(anyString());
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(accessor, flaky).build();

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.isFallback()).isTrue();
        assertThat(outcome.written()).isTrue();
        assertThat(outcome.writeCount()).isEqualTo(1);
        assertThat(orchestrator.getMetrics()).containsEntry("fallback_writes", 1L);
        assertThat(orchestrator.getErrors()).extracting(OperationalError::errorType).containsExactly("CYCLE_FAILED");

        assertThat(orchestrator.runCycle().finalStage()).isEqualTo(PipelineStage.WRITTEN);
        assertThat(orchestrator.context().writeCount()).isEqualTo(2);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Snapshot cycle 1 failed.*")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Fallback document for cycle 1 could not be written")
    void unwritableSinkDoesNotAdvanceTheWriteCount() throws Exception {
        ISnapshotSink dead = mock(ISnapshotSink.class);
        doThrow(new IOException("read-only")).when(dead).write(anyString());
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(accessor, dead).build();

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.written()).isFalse();
        assertThat(outcome.writeCount()).isZero();
        assertThat(orchestrator.getErrors()).extracting(OperationalError::errorType)
                .containsExactly("CYCLE_FAILED", "FALLBACK_FAILED");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Stage COLLECTING_VEHICLES failed.*", occurrences = 3)
    void errorHistoryIsBounded() {
        TelemetryConfiguration configuration = TelemetryConfiguration.from(
                ConfigFactory.parseString("transitscope.monitoring.max-errors = 2")
                        .withFallback(ConfigFactory.parseResources("reference.conf"))
                        .resolve());
        VehicleCollector broken = mock(VehicleCollector.class);
        when(broken.collect()).thenThrow(new IllegalStateException("gone"));
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(accessor, sink)
                .configuration(configuration)
                .vehicleCollector(broken)
                .build();

        orchestrator.runCycle();
        orchestrator.runCycle();
        orchestrator.runCycle();

        assertThat(orchestrator.getErrors()).extracting(OperationalError::cycle).containsExactly(2L, 3L);

        orchestrator.clearErrors();
        assertThat(orchestrator.isHealthy()).isTrue();
    }

    @Test
    void linkageErrorFromTheHostDoesNotEscapeTheCycle(@TempDir Path tempDir) throws Exception {
        IHostApi host;
        try (InputStream in = getClass().getResourceAsStream("/fixtures/small-network.json")) {
            host = new LinkageFailingHost(new FixtureHostLoader().load(in), HostFunctions.GI_GET_ENTITY);
        }
        FileSnapshotSink files = new FileSnapshotSink(tempDir, "telemetry.json");
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(new EntityAccessor(host), files).build();

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.written()).isTrue();
        assertThat(outcome.finalStage()).isEqualTo(PipelineStage.WRITTEN);
        JsonNode doc = mapper.readTree(Files.readString(files.target()));
        assertThat(doc.get("write_count").asLong()).isEqualTo(1);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Stage COLLECTING_VEHICLES failed.*NoSuchMethodError: getVehicle\\(J\\)")
    void errorThrownByAStageIsIsolatedLikeAnException() throws Exception {
        VehicleCollector broken = mock(VehicleCollector.class);
        when(broken.collect()).thenThrow(new NoSuchMethodError("getVehicle(J)"));
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(accessor, sink)
                .vehicleCollector(broken)
                .build();

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.finalStage()).isEqualTo(PipelineStage.WRITTEN);
        assertThat(outcome.stageErrors()).extracting(StageError::stage)
                .containsExactly(PipelineStage.COLLECTING_VEHICLES);
        JsonNode doc = mapper.readTree(sink.last());
        assertThat(doc.get("vehicles")).isEmpty();
        assertThat(doc.get("stations")).hasSize(2);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Snapshot cycle 1 failed in stage SERIALIZING.*")
    void errorThrownByTheSinkIsAnsweredWithMinimalDocument() throws Exception {
        ISnapshotSink flaky = mock(ISnapshotSink.class);
        doThrow(new LinkageError("sink class changed"))
                .doNothing()
                .when(flaky).write(anyString());
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(accessor, flaky).build();

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.isFallback()).isTrue();
        assertThat(outcome.writeCount()).isEqualTo(1);
    }

    @Test
    void nameWithUnpairedSurrogateIsPublishedWithTheOtherStations(@TempDir Path tempDir) throws Exception {
        FixtureHostApi host = FixtureHostApi.builder()
                .entity(EntityKind.STATION, 10, Map.of("name", "Central", "position", List.of(0, 0)))
                .entity(EntityKind.STATION, 11, Map.of("name", "Bad\uD800name", "position", List.of(5, 5)))
                .build();
        FileSnapshotSink files = new FileSnapshotSink(tempDir, "telemetry.json");
        SnapshotOrchestrator orchestrator = SnapshotOrchestrator.builder(new EntityAccessor(host), files).build();

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.finalStage()).isEqualTo(PipelineStage.WRITTEN);
        JsonNode doc = mapper.readTree(Files.readString(files.target()));
        List<String> names = new ArrayList<>();
        doc.get("stations").forEach(station -> names.add(station.get("name").asText()));
        assertThat(names).containsExactlyInAnyOrder("Central", "Bad\uD800name");
    }

    private static final class RecordingSink implements ISnapshotSink {

        private final List<String> documents = new ArrayList<>();

        @Override
        public void write(String document) {
            documents.add(document);
        }

        @Override
        public void writeDiagnostics(String name, String report) {
        }

        String last() {
            return documents.get(documents.size() - 1);
        }
    }

    /**
     * Delegates to a fixture host but fails one function the way a host of another
     * version does.
     */
    private static final class LinkageFailingHost implements IHostApi {

        private final IHostApi delegate;
        private final String brokenFunction;

        LinkageFailingHost(IHostApi delegate, String brokenFunction) {
            this.delegate = delegate;
            this.brokenFunction = brokenFunction;
        }

        @Override
        public Set<String> functions() {
            return delegate.functions();
        }

        @Override
        public Object invoke(String function, Object... args) throws Exception {
            if (function.equals(brokenFunction)) {
                throw new NoSuchMethodError("getEntity(J)");
            }
            return delegate.invoke(function, args);
        }

        @Override
        public Map<String, Object> constants(String table) {
            return delegate.constants(table);
        }
    }
}

package org.transitscope.pipeline.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitscope.config.TelemetryConfiguration;
import org.transitscope.host.EntityAccessor;
import org.transitscope.pipeline.cache.CacheManager;
import org.transitscope.pipeline.cache.SignalCollector;
import org.transitscope.pipeline.cache.TrackCollector;
import org.transitscope.pipeline.geometry.EdgeGeometryReader;
import org.transitscope.pipeline.geometry.GeometryReconstructor;
import org.transitscope.pipeline.model.Line;
import org.transitscope.pipeline.model.LinePath;
import org.transitscope.pipeline.model.Snapshot;
import org.transitscope.pipeline.model.SnapshotStats;
import org.transitscope.pipeline.model.Vehicle;
import org.transitscope.pipeline.monitoring.IMonitorable;
import org.transitscope.pipeline.monitoring.OperationalError;
import org.transitscope.pipeline.output.ISnapshotSink;
import org.transitscope.pipeline.resolve.LineResolver;
import org.transitscope.pipeline.resolve.NameResolver;
import org.transitscope.pipeline.resolve.StationCatalog;
import org.transitscope.pipeline.resolve.StationResolver;
import org.transitscope.pipeline.vehicle.VehicleCollector;
import org.transitscope.pipeline.vehicle.VehicleEnricher;
import org.transitscope.serialization.DeterministicEncoder;
import org.transitscope.serialization.SnapshotDocumentMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs snapshot cycles: builds the station catalog, resolves lines, collects and enriches
 * vehicles, builds paths, refreshes the caches, computes statistics, then encodes and
 * publishes the document.
 * <p>
 * Every stage runs inside its own boundary. A failing stage is logged at WARN with its
 * name, recorded as an {@link OperationalError} and replaced by its default output, and the
 * cycle continues. A failure outside the stage boundaries (encoding or publishing) is
 * logged at ERROR and answered with a minimal document whose collections are all empty.
 * Nothing but a {@link VirtualMachineError} escapes {@link #runCycle()}.
 * <p>
 * Not thread-safe: cycles must not overlap.
 */
public class SnapshotOrchestrator implements IMonitorable {

    private static final Logger log = LoggerFactory.getLogger(SnapshotOrchestrator.class);

    private final EntityAccessor accessor;
    private final StationResolver stationResolver;
    private final LineResolver lineResolver;
    private final VehicleCollector vehicleCollector;
    private final VehicleEnricher vehicleEnricher;
    private final PathBuilder pathBuilder;
    private final StatsCalculator statsCalculator;
    private final SnapshotDocumentMapper documentMapper;
    private final DeterministicEncoder encoder;
    private final ISnapshotSink sink;
    private final SnapshotContext context;
    private final int maxErrors;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private final AtomicLong fallbackWrites = new AtomicLong();
    private final AtomicLong stageFailures = new AtomicLong();

    private SnapshotOrchestrator(Builder builder, CacheManager caches, StationResolver stationResolver,
                                 LineResolver lineResolver, VehicleCollector vehicleCollector) {
        this.accessor = builder.accessor;
        this.stationResolver = stationResolver;
        this.lineResolver = lineResolver;
        this.vehicleCollector = vehicleCollector;
        this.vehicleEnricher = builder.vehicleEnricher;
        this.pathBuilder = new PathBuilder(builder.accessor);
        this.statsCalculator = new StatsCalculator();
        this.documentMapper = builder.documentMapper;
        this.encoder = builder.encoder;
        this.sink = builder.sink;
        this.context = new SnapshotContext(caches);
        this.maxErrors = builder.maxErrors;
    }

    public static Builder builder(EntityAccessor accessor, ISnapshotSink sink) {
        return new Builder(accessor, sink);
    }

    /**
     * Runs one complete cycle and publishes its document.
     *
     * @return The outcome of the cycle.
     */
    public CycleOutcome runCycle() {
        long cycle = context.beginCycle();
        List<StageError> stageErrors = new ArrayList<>();
        Object gameTime = null;
        try {
            StationCatalog catalog = stage(cycle, PipelineStage.BUILDING_STATIONS,
                    stationResolver::build, StationCatalog::empty, stageErrors);
            List<Line> lines = stage(cycle, PipelineStage.RESOLVING_LINES,
                    () -> lineResolver.resolve(catalog), List::of, stageErrors);
            List<Vehicle> collected = stage(cycle, PipelineStage.COLLECTING_VEHICLES,
                    vehicleCollector::collect, List::of, stageErrors);
            List<Vehicle> vehicles = stage(cycle, PipelineStage.ENRICHING,
                    () -> vehicleEnricher.enrich(collected, lines), () -> collected, stageErrors);
            List<LinePath> paths = stage(cycle, PipelineStage.BUILDING_PATHS,
                    () -> pathBuilder.build(lines, catalog), List::of, stageErrors);
            CacheManager.Refresh refresh = stage(cycle, PipelineStage.REFRESHING_CACHES,
                    context.caches()::refresh, () -> null, stageErrors);
            if (refresh != null && refresh.anyFailed()) {
                recordError(cycle, "CACHE_REFRESH_FAILED", "Cache refresh failed, serving cached data",
                        "tracks=" + refresh.tracks() + ", signals=" + refresh.signals());
            }
            SnapshotStats stats = stage(cycle, PipelineStage.COMPUTING_STATS,
                    () -> statsCalculator.compute(vehicles, lines, catalog.stations()),
                    () -> SnapshotStats.EMPTY, stageErrors);
            gameTime = accessor.gameTime().orElse(null);

            context.enter(PipelineStage.SERIALIZING);
            Snapshot snapshot = new Snapshot(Snapshot.SCHEMA_VERSION, context.writeCount() + 1, gameTime, stats,
                    vehicles, lines, catalog.stations(), paths,
                    context.caches().tracks(), context.caches().signals());
            String document = encoder.encode(documentMapper.toDocument(snapshot));
            sink.write(document);
            context.recordWrite();
            context.enter(PipelineStage.WRITTEN);
            log.debug("Snapshot {}: {} vehicles, {} lines, {} stations, {} paths, {} tracks, {} signals",
                    context.writeCount(), vehicles.size(), lines.size(), snapshot.stations().size(), paths.size(),
                    snapshot.tracks().size(), snapshot.signals().size());
            return new CycleOutcome(context.writeCount(), PipelineStage.WRITTEN, stageErrors, true);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (IOException | RuntimeException | Error e) {
            log.error("Snapshot cycle {} failed in stage {}, writing fallback document", cycle, context.stage(), e);
            recordError(cycle, "CYCLE_FAILED", "Cycle failed in stage " + context.stage(), e.getMessage());
            return writeFallback(cycle, gameTime, stageErrors);
        }
    }

    private CycleOutcome writeFallback(long cycle, Object gameTime, List<StageError> stageErrors) {
        try {
            Snapshot fallback = Snapshot.empty(context.writeCount() + 1, gameTime);
            sink.write(encoder.encode(documentMapper.toDocument(fallback)));
            context.recordWrite();
            context.enter(PipelineStage.FALLBACK_WRITTEN);
            fallbackWrites.incrementAndGet();
            return new CycleOutcome(context.writeCount(), PipelineStage.FALLBACK_WRITTEN, stageErrors, true);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (IOException | RuntimeException | Error e) {
            log.error("Fallback document for cycle {} could not be written", cycle, e);
            recordError(cycle, "FALLBACK_FAILED", "Fallback document could not be written", e.getMessage());
            return new CycleOutcome(context.writeCount(), context.stage(), stageErrors, false);
        }
    }

    private <T> T stage(long cycle, PipelineStage stage, Supplier<T> body, Supplier<T> fallback,
                        List<StageError> stageErrors) {
        context.enter(stage);
        return StageResult.attempt(stage, body).orDefault(fallback, error -> {
            stageErrors.add(error);
            stageFailures.incrementAndGet();
            log.warn("Stage {} failed, continuing with its default output: {}", stage, error.message());
            recordError(cycle, "STAGE_FAILED", "Stage " + stage + " failed", error.message());
        });
    }

    private void recordError(long cycle, String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), cycle, code, message, details));
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    public SnapshotContext context() {
        return context;
    }

    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("cycles", context.cycles());
        metrics.put("write_count", context.writeCount());
        metrics.put("fallback_writes", fallbackWrites.get());
        metrics.put("stage_failures", stageFailures.get());
        metrics.put("error_count", errors.size());
        return metrics;
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * Healthy while no absorbed failure is on record; any recorded error means some
     * published data was degraded.
     */
    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    /**
     * Assembles an orchestrator and its pipeline components. Components not set
     * explicitly are created from the configuration, or from built-in defaults when no
     * configuration is given.
     */
    public static final class Builder {

        private final EntityAccessor accessor;
        private final ISnapshotSink sink;
        private TelemetryConfiguration configuration;
        private VehicleCollector vehicleCollector;
        private VehicleEnricher vehicleEnricher = new VehicleEnricher();
        private SnapshotDocumentMapper documentMapper = new SnapshotDocumentMapper();
        private DeterministicEncoder encoder;
        private int maxErrors = 100;

        private Builder(EntityAccessor accessor, ISnapshotSink sink) {
            this.accessor = accessor;
            this.sink = sink;
        }

        public Builder configuration(TelemetryConfiguration configuration) {
            this.configuration = configuration;
            this.maxErrors = configuration.maxErrors();
            return this;
        }

        public Builder vehicleCollector(VehicleCollector vehicleCollector) {
            this.vehicleCollector = vehicleCollector;
            return this;
        }

        public Builder vehicleEnricher(VehicleEnricher vehicleEnricher) {
            this.vehicleEnricher = vehicleEnricher;
            return this;
        }

        public Builder documentMapper(SnapshotDocumentMapper documentMapper) {
            this.documentMapper = documentMapper;
            return this;
        }

        public Builder encoder(DeterministicEncoder encoder) {
            this.encoder = encoder;
            return this;
        }

        public SnapshotOrchestrator build() {
            TelemetryConfiguration cfg = configuration;
            NameResolver names = cfg == null
                    ? new NameResolver(accessor)
                    : new NameResolver(accessor, cfg.nameSearchDepth());
            StationResolver stations = new StationResolver(accessor, names);
            LineResolver lines = cfg == null
                    ? new LineResolver(accessor, stations, names)
                    : new LineResolver(accessor, stations, names, cfg.stationSearchDepth());

            GeometryReconstructor reconstructor = cfg == null
                    ? new GeometryReconstructor()
                    : new GeometryReconstructor(cfg.arcSegments(), cfg.splineSegments(),
                            cfg.degenerateTangentThreshold());
            TrackCollector tracks = new TrackCollector(accessor, new EdgeGeometryReader(accessor, reconstructor),
                    cfg == null ? null : cfg.region().orElse(null),
                    cfg == null ? 0 : cfg.maxTrackEdges());
            CacheManager caches = new CacheManager(tracks, new SignalCollector(accessor),
                    cfg == null ? CacheManager.DEFAULT_TRACK_REFRESH_CYCLES : cfg.trackRefreshCycles(),
                    cfg == null ? CacheManager.DEFAULT_SIGNAL_REFRESH_CYCLES : cfg.signalRefreshCycles());

            VehicleCollector vehicles = vehicleCollector;
            if (vehicles == null) {
                vehicles = cfg == null
                        ? new VehicleCollector(accessor)
                        : new VehicleCollector(accessor, cfg.includeCargo(), cfg.includeRoadVehicles());
            }
            if (encoder == null) {
                encoder = cfg == null
                        ? new DeterministicEncoder()
                        : new DeterministicEncoder(cfg.serializerMaxDepth(), cfg.prettyPrint() ? cfg.indent() : "");
            }
            return new SnapshotOrchestrator(this, caches, stations, lines, vehicles);
        }
    }
}

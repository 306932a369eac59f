package org.transitscope.pipeline.model;

import java.util.List;

/**
 * One complete snapshot of the transport network. All collections are always present.
 *
 * @param schemaVersion The document schema version.
 * @param writeCount    Monotonic number of the written document, used instead of a wall clock.
 * @param gameTime      The host's game time, passed through opaquely; may be {@code null}.
 */
public record Snapshot(
        int schemaVersion,
        long writeCount,
        Object gameTime,
        SnapshotStats stats,
        List<Vehicle> vehicles,
        List<Line> lines,
        List<Station> stations,
        List<LinePath> paths,
        List<TrackEdge> tracks,
        List<Signal> signals) {

    public static final int SCHEMA_VERSION = 4;

    public Snapshot {
        stats = stats == null ? SnapshotStats.EMPTY : stats;
        vehicles = vehicles == null ? List.of() : List.copyOf(vehicles);
        lines = lines == null ? List.of() : List.copyOf(lines);
        stations = stations == null ? List.of() : List.copyOf(stations);
        paths = paths == null ? List.of() : List.copyOf(paths);
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    /**
     * Creates the minimal document with empty collections.
     */
    public static Snapshot empty(long writeCount, Object gameTime) {
        return new Snapshot(SCHEMA_VERSION, writeCount, gameTime, SnapshotStats.EMPTY,
                List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }
}

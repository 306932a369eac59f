package org.transitscope.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.transitscope.host.RegionBounds;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Typed view of the {@code transitscope} configuration block.
 */
public record TelemetryConfiguration(
        Path outputDirectory,
        String fileName,
        String diagnosticsFileName,
        String runtimeDiagnosticsFileName,
        boolean writeDiagnostics,
        boolean prettyPrint,
        String indent,
        double writeInterval,
        double eventUnit,
        int trackRefreshCycles,
        int signalRefreshCycles,
        int maxTrackEdges,
        boolean includeCargo,
        boolean includeRoadVehicles,
        int arcSegments,
        int splineSegments,
        double degenerateTangentThreshold,
        int nameSearchDepth,
        int stationSearchDepth,
        int serializerMaxDepth,
        Optional<RegionBounds> region,
        int maxErrors) {

    public static final String ROOT_PATH = "transitscope";

    /**
     * Reads and validates the {@code transitscope} block.
     *
     * @param root The resolved application configuration.
     * @return The typed configuration.
     * @throws ConfigException if a value is missing, has the wrong type or is out of range.
     */
    public static TelemetryConfiguration from(Config root) {
        Config c = root.getConfig(ROOT_PATH);

        Optional<RegionBounds> region = Optional.empty();
        if (c.getBoolean("region.enabled")) {
            double radius = c.getDouble("region.radius");
            if (radius <= 0) {
                throw new ConfigException.BadValue(c.origin(), "region.radius", "must be positive");
            }
            region = Optional.of(new RegionBounds(c.getDouble("region.center-x"), c.getDouble("region.center-y"), radius));
        }

        return new TelemetryConfiguration(
                Paths.get(c.getString("output.directory")),
                c.getString("output.file-name"),
                c.getString("output.diagnostics-file-name"),
                c.getString("output.runtime-diagnostics-file-name"),
                c.getBoolean("output.write-diagnostics"),
                c.getBoolean("output.pretty-print"),
                c.getString("output.indent"),
                positive(c, "snapshot.write-interval"),
                positive(c, "snapshot.event-unit"),
                atLeastOne(c, "cache.track-refresh-cycles"),
                atLeastOne(c, "cache.signal-refresh-cycles"),
                notNegative(c, "cache.max-track-edges"),
                c.getBoolean("collector.include-cargo"),
                c.getBoolean("collector.include-road-vehicles"),
                atLeastOne(c, "geometry.arc-segments"),
                atLeastOne(c, "geometry.spline-segments"),
                c.getDouble("geometry.degenerate-tangent-threshold"),
                notNegative(c, "resolver.name-search-depth"),
                notNegative(c, "resolver.station-search-depth"),
                notNegative(c, "serializer.max-depth"),
                region,
                atLeastOne(c, "monitoring.max-errors"));
    }

    /**
     * Returns a copy writing to another directory.
     */
    public TelemetryConfiguration withOutputDirectory(Path directory) {
        return new TelemetryConfiguration(directory, fileName, diagnosticsFileName, runtimeDiagnosticsFileName,
                writeDiagnostics, prettyPrint, indent, writeInterval, eventUnit, trackRefreshCycles,
                signalRefreshCycles, maxTrackEdges, includeCargo, includeRoadVehicles, arcSegments, splineSegments,
                degenerateTangentThreshold, nameSearchDepth, stationSearchDepth, serializerMaxDepth, region, maxErrors);
    }

    public TelemetryConfiguration withPrettyPrint(boolean pretty) {
        return new TelemetryConfiguration(outputDirectory, fileName, diagnosticsFileName, runtimeDiagnosticsFileName,
                writeDiagnostics, pretty, indent, writeInterval, eventUnit, trackRefreshCycles,
                signalRefreshCycles, maxTrackEdges, includeCargo, includeRoadVehicles, arcSegments, splineSegments,
                degenerateTangentThreshold, nameSearchDepth, stationSearchDepth, serializerMaxDepth, region, maxErrors);
    }

    private static double positive(Config c, String path) {
        double value = c.getDouble(path);
        if (!(value > 0)) {
            throw new ConfigException.BadValue(c.origin(), path, "must be greater than 0 but was " + value);
        }
        return value;
    }

    private static int atLeastOne(Config c, String path) {
        int value = c.getInt(path);
        if (value < 1) {
            throw new ConfigException.BadValue(c.origin(), path, "must be at least 1 but was " + value);
        }
        return value;
    }

    private static int notNegative(Config c, String path) {
        int value = c.getInt(path);
        if (value < 0) {
            throw new ConfigException.BadValue(c.origin(), path, "must not be negative but was " + value);
        }
        return value;
    }
}

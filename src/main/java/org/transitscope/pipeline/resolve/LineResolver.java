package org.transitscope.pipeline.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitscope.host.EntityAccessor;
import org.transitscope.host.EntityKind;
import org.transitscope.host.HostRecord;
import org.transitscope.host.HostValues;
import org.transitscope.pipeline.model.Line;
import org.transitscope.pipeline.model.Station;
import org.transitscope.pipeline.model.Stop;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects lines and resolves each of their stops to a station and a display name.
 */
public class LineResolver {

    private static final Logger log = LoggerFactory.getLogger(LineResolver.class);

    /** Fields of a stop record holding the stop's raw id, in priority order. */
    static final List<String> STOP_ID_FIELDS = List.of(
            "stationEntity", "stationEntityId", "station", "stationId",
            "terminalEntity", "terminalEntityId", "stopEntity", "stopEntityId",
            "stop", "stopId", "entity", "id");

    /** Keys examined first by the deep station search inside a stop record. */
    static final List<String> STATION_SEARCH_KEYS = List.of(
            "stationEntity", "stationEntityId", "station", "stationId",
            "station_id", "terminalEntity", "terminalEntityId", "terminal",
            "terminalId", "entity", "entityId", "id");

    public static final int DEFAULT_STATION_SEARCH_DEPTH = 5;
    static final String UNKNOWN_VEHICLE_TYPE = "UNKNOWN";

    private final EntityAccessor accessor;
    private final StationResolver stations;
    private final NameResolver names;
    private final BoundedGraphSearch stationSearch;

    public LineResolver(EntityAccessor accessor, StationResolver stations, NameResolver names) {
        this(accessor, stations, names, DEFAULT_STATION_SEARCH_DEPTH);
    }

    public LineResolver(EntityAccessor accessor, StationResolver stations, NameResolver names,
                        int stationSearchDepth) {
        this.accessor = accessor;
        this.stations = stations;
        this.names = names;
        this.stationSearch = new BoundedGraphSearch(stationSearchDepth, STATION_SEARCH_KEYS, true);
    }

    /**
     * Resolves all lines of the host.
     *
     * @param catalog The station catalog of the current cycle.
     * @return The lines in enumeration order.
     */
    public List<Line> resolve(StationCatalog catalog) {
        List<Line> lines = new ArrayList<>();
        for (long lineId : accessor.enumerate(EntityKind.LINE)) {
            lines.add(resolveLine(catalog, lineId));
        }
        log.debug("Resolved {} lines", lines.size());
        return lines;
    }

    Line resolveLine(StationCatalog catalog, long lineId) {
        Optional<HostRecord> entity = accessor.getLine(lineId);
        if (entity.isEmpty()) {
            return new Line(lineId, "Line #" + lineId, UNKNOWN_VEHICLE_TYPE, List.of());
        }
        HostRecord line = entity.get();
        String name = NameResolver.explicitName(line, List.of("name")).orElse("Line #" + lineId);
        String vehicleType = line.string("vehicleType", "transportMode");
        if (vehicleType.isBlank()) {
            vehicleType = UNKNOWN_VEHICLE_TYPE;
        }
        List<Object> rawStops = line.list("stops");
        if (rawStops.isEmpty()) {
            rawStops = line.list("waypoints");
        }
        List<Stop> stops = new ArrayList<>(rawStops.size());
        for (int i = 0; i < rawStops.size(); i++) {
            stops.add(resolveStop(catalog, i + 1, rawStops.get(i)));
        }
        return new Line(lineId, name, vehicleType, stops);
    }

    Stop resolveStop(StationCatalog catalog, int index, Object rawStop) {
        long rawId = rawStopId(rawStop);
        long stationId = resolveStationId(catalog, rawId, rawStop);
        return new Stop(index, stationId, rawId, displayName(catalog, stationId, rawId, rawStop));
    }

    private static long rawStopId(Object rawStop) {
        if (HostValues.isNumber(rawStop)) {
            return HostValues.safeInt(rawStop);
        }
        return HostRecord.of(rawStop).map(stop -> HostValues.toEntityId(stop.first(STOP_ID_FIELDS))).orElse(0L);
    }

    private long resolveStationId(StationCatalog catalog, long rawId, Object rawStop) {
        long resolved = stations.resolveToStationId(catalog, rawId);
        if (catalog.isStation(resolved)) {
            return resolved;
        }
        if (rawStop instanceof Map<?, ?>) {
            Optional<Long> deep = stationSearch.find(rawStop, value -> {
                if (!HostValues.isNumber(value)) {
                    return Optional.empty();
                }
                long candidate = stations.resolveToStationId(catalog, HostValues.safeInt(value));
                return catalog.isStation(candidate) ? Optional.of(candidate) : Optional.empty();
            });
            if (deep.isPresent()) {
                return deep.get();
            }
        }
        return resolved;
    }

    private String displayName(StationCatalog catalog, long stationId, long rawId, Object rawStop) {
        Optional<String> explicit = names.stopName(rawStop);
        if (explicit.isPresent()) {
            return explicit.get();
        }
        Optional<Station> cached = catalog.station(stationId);
        if (cached.isPresent() && !PlaceholderNames.isPlaceholder(cached.get().name())) {
            return cached.get().name();
        }
        Optional<String> entityName = names.entityName(stationId);
        if (entityName.isEmpty() && rawId != stationId) {
            entityName = names.entityName(rawId);
        }
        if (entityName.isPresent()) {
            return entityName.get();
        }
        if (cached.isPresent()) {
            return cached.get().name();
        }
        return "Stop #" + (stationId != 0 ? stationId : rawId);
    }
}

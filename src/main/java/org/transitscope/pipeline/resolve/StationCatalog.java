package org.transitscope.pipeline.resolve;

import org.transitscope.pipeline.model.Station;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The stations known in one snapshot cycle together with the alias maps that point
 * terminal and station group ids to their canonical station.
 * <p>
 * A catalog is rebuilt every cycle. Only {@link StationResolver} adds entries; terminal
 * aliases discovered while resolving line stops are cached here for the rest of the cycle.
 */
public final class StationCatalog {

    private final Map<Long, Station> stations = new LinkedHashMap<>();
    private final Map<Long, Long> terminalAliases = new HashMap<>();
    private final Map<Long, Long> groupAliases = new HashMap<>();

    public static StationCatalog empty() {
        return new StationCatalog();
    }

    public Optional<Station> station(long id) {
        return Optional.ofNullable(stations.get(id));
    }

    public boolean isStation(long id) {
        return stations.containsKey(id);
    }

    public Optional<Long> terminalAlias(long id) {
        return Optional.ofNullable(terminalAliases.get(id));
    }

    public Optional<Long> groupAlias(long id) {
        return Optional.ofNullable(groupAliases.get(id));
    }

    /**
     * Returns the stations in the order they were enumerated.
     */
    public List<Station> stations() {
        return List.copyOf(stations.values());
    }

    public int size() {
        return stations.size();
    }

    void addStation(Station station) {
        stations.putIfAbsent(station.id(), station);
    }

    /**
     * Records a terminal alias unless the terminal is already mapped; the first mapping wins.
     */
    void addTerminalAlias(long terminalId, long stationId) {
        if (terminalId > 0 && terminalId != stationId) {
            terminalAliases.putIfAbsent(terminalId, stationId);
        }
    }

    void addGroupAlias(long groupId, long stationId) {
        if (groupId > 0) {
            groupAliases.putIfAbsent(groupId, stationId);
        }
    }
}

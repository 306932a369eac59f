package org.transitscope.pipeline.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate counts of one snapshot.
 *
 * @param vehiclesByType Vehicle count per vehicle kind, sorted by kind.
 */
public record SnapshotStats(int totalVehicles, long totalPassengers, int totalLines, int totalStations,
                            Map<String, Integer> vehiclesByType) {

    public static final SnapshotStats EMPTY = new SnapshotStats(0, 0, 0, 0, Map.of());

    public SnapshotStats {
        vehiclesByType = Collections.unmodifiableMap(new TreeMap<>(vehiclesByType));
    }
}

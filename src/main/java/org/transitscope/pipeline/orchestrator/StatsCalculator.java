package org.transitscope.pipeline.orchestrator;

import org.transitscope.pipeline.model.Line;
import org.transitscope.pipeline.model.SnapshotStats;
import org.transitscope.pipeline.model.Station;
import org.transitscope.pipeline.model.Vehicle;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class StatsCalculator {

    public SnapshotStats compute(List<Vehicle> vehicles, List<Line> lines, List<Station> stations) {
        long passengers = 0;
        Map<String, Integer> byType = new TreeMap<>();
        for (Vehicle vehicle : vehicles) {
            passengers += vehicle.passengers();
            byType.merge(vehicle.type(), 1, Integer::sum);
        }
        return new SnapshotStats(vehicles.size(), passengers, lines.size(), stations.size(), byType);
    }
}

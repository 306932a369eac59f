package org.transitscope.pipeline.vehicle;

import org.transitscope.pipeline.model.Line;
import org.transitscope.pipeline.model.Stop;
import org.transitscope.pipeline.model.Vehicle;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds line names and last/next stops to collected vehicles.
 * <p>
 * The host reports the 0-based index of the stop a vehicle last served. With 1-based stop
 * positions that stop is {@code rawStopIndex + 1} and the next one follows it; both wrap
 * around the end of the stop list.
 */
public class VehicleEnricher {

    public List<Vehicle> enrich(List<Vehicle> vehicles, List<Line> lines) {
        Map<Long, Line> byId = new HashMap<>();
        for (Line line : lines) {
            byId.putIfAbsent(line.id(), line);
        }
        List<Vehicle> enriched = new ArrayList<>(vehicles.size());
        for (Vehicle vehicle : vehicles) {
            Line line = vehicle.lineId() != 0 ? byId.get(vehicle.lineId()) : null;
            enriched.add(line == null ? vehicle : enrich(vehicle, line));
        }
        return enriched;
    }

    Vehicle enrich(Vehicle vehicle, Line line) {
        Vehicle result = vehicle.withLine(line.name());
        int stopCount = line.stopCount();
        if (vehicle.rawStopIndex() < 0 || stopCount == 0) {
            return result;
        }
        int lastIndex = wrap(vehicle.rawStopIndex() + 1L, stopCount);
        int nextIndex = wrap(lastIndex + 1L, stopCount);
        Stop last = line.stopAt(lastIndex);
        Stop next = line.stopAt(nextIndex);
        return result.withStops(
                last == null ? 0 : last.effectiveId(), last == null ? "" : last.name(),
                next == null ? 0 : next.effectiveId(), next == null ? "" : next.name());
    }

    /**
     * Maps any index onto the 1-based range {@code 1..count}.
     */
    static int wrap(long index, int count) {
        if (index < 1) {
            return count;
        }
        return (int) ((index - 1) % count) + 1;
    }
}

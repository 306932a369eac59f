package org.transitscope.pipeline.model;

/**
 * A vehicle as collected from the host, optionally enriched with line and stop data.
 * <p>
 * The collector leaves {@code lineName} and the last/next stop fields empty; they are set
 * by the enrichment step through {@link #withLine(String)} and {@link #withStops}.
 */
public record Vehicle(
        long id,
        String name,
        String type,
        String state,
        long lineId,
        String lineName,
        Point position,
        double speedMs,
        double speedKmh,
        int direction,
        long passengers,
        long capacity,
        long cargo,
        long cargoCapacity,
        long lastStopId,
        String lastStopName,
        long nextStopId,
        String nextStopName,
        int rawStopIndex) {

    public Vehicle withLine(String newLineName) {
        return new Vehicle(id, name, type, state, lineId, newLineName, position, speedMs, speedKmh, direction,
                passengers, capacity, cargo, cargoCapacity, lastStopId, lastStopName, nextStopId, nextStopName,
                rawStopIndex);
    }

    public Vehicle withStops(long newLastStopId, String newLastStopName, long newNextStopId, String newNextStopName) {
        return new Vehicle(id, name, type, state, lineId, lineName, position, speedMs, speedKmh, direction,
                passengers, capacity, cargo, cargoCapacity, newLastStopId, newLastStopName, newNextStopId,
                newNextStopName, rawStopIndex);
    }

    /**
     * Returns a copy with the cargo fields zeroed.
     */
    public Vehicle withoutCargo() {
        return new Vehicle(id, name, type, state, lineId, lineName, position, speedMs, speedKmh, direction,
                passengers, capacity, 0, 0, lastStopId, lastStopName, nextStopId, nextStopName, rawStopIndex);
    }
}

package org.transitscope.pipeline.model;

import java.util.List;

/**
 * A transport line with its stops in host order.
 */
public record Line(long id, String name, String vehicleType, List<Stop> stops) {

    public Line {
        stops = List.copyOf(stops);
    }

    public int stopCount() {
        return stops.size();
    }

    /**
     * Returns the stop at a 1-based index.
     *
     * @param index The 1-based index.
     * @return The stop, or {@code null} if the index is out of range.
     */
    public Stop stopAt(int index) {
        if (index < 1 || index > stops.size()) {
            return null;
        }
        return stops.get(index - 1);
    }
}

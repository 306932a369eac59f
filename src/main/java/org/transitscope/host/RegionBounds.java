package org.transitscope.host;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A circular query region in world coordinates.
 *
 * @param centerX The x coordinate of the center.
 * @param centerY The y coordinate of the center.
 * @param radius  The radius of the region.
 */
public record RegionBounds(double centerX, double centerY, double radius) {

    public RegionBounds {
        if (radius <= 0 || Double.isNaN(radius)) {
            throw new IllegalArgumentException("Region radius must be positive: " + radius);
        }
    }

    /**
     * Converts the bounds to the record shape the host's region query expects.
     *
     * @return A mutable map with {@code pos} and {@code radius}.
     */
    public Map<String, Object> toHostArgument() {
        Map<String, Object> arg = new LinkedHashMap<>();
        arg.put("pos", List.of(centerX, centerY));
        arg.put("radius", radius);
        return arg;
    }
}

package org.transitscope.pipeline.model;

import java.util.List;

/**
 * The coarse route of a line through the positions of its stops.
 */
public record LinePath(long lineId, List<Point> points) {

    public LinePath {
        points = List.copyOf(points);
    }
}

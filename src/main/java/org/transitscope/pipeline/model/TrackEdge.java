package org.transitscope.pipeline.model;

import java.util.List;

/**
 * A network edge with its reconstructed polyline.
 */
public record TrackEdge(long id, TrackKind kind, List<Point> points) {

    public TrackEdge {
        points = List.copyOf(points);
    }
}

package org.transitscope.pipeline.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitscope.host.EntityAccessor;
import org.transitscope.host.EntityKind;
import org.transitscope.host.RegionBounds;
import org.transitscope.host.capability.Capability;
import org.transitscope.pipeline.geometry.EdgeGeometryReader;
import org.transitscope.pipeline.model.TrackEdge;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scans the network edges and reconstructs their geometry. This is the expensive load
 * behind the track cache.
 */
public class TrackCollector {

    private static final Logger log = LoggerFactory.getLogger(TrackCollector.class);

    private final EntityAccessor accessor;
    private final EdgeGeometryReader geometryReader;
    private final RegionBounds region;
    private final int maxEdges;

    /**
     * @param accessor       The host accessor.
     * @param geometryReader Reads the polyline of one edge.
     * @param region         The area scanned with a region query, or {@code null} to enumerate all edges.
     * @param maxEdges       The maximum number of edges read per scan; 0 for no limit.
     */
    public TrackCollector(EntityAccessor accessor, EdgeGeometryReader geometryReader, RegionBounds region,
                          int maxEdges) {
        this.accessor = accessor;
        this.geometryReader = geometryReader;
        this.region = region;
        this.maxEdges = maxEdges;
    }

    public List<TrackEdge> load() {
        List<Long> ids = List.of();
        if (region != null && accessor.supports(Capability.ENUMERATE_REGION)) {
            ids = accessor.enumerateRegion(region, EntityKind.EDGE);
        }
        if (ids.isEmpty()) {
            ids = accessor.enumerate(EntityKind.EDGE);
        }
        if (maxEdges > 0 && ids.size() > maxEdges) {
            log.debug("Limiting track scan to {} of {} edges", maxEdges, ids.size());
            ids = ids.subList(0, maxEdges);
        }
        List<TrackEdge> edges = new ArrayList<>(ids.size());
        for (long id : ids) {
            Optional<TrackEdge> edge = geometryReader.read(id);
            edge.ifPresent(edges::add);
        }
        return edges;
    }
}

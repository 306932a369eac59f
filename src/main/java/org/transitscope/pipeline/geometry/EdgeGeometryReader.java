package org.transitscope.pipeline.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitscope.host.ComponentKind;
import org.transitscope.host.EntityAccessor;
import org.transitscope.host.HostRecord;
import org.transitscope.host.HostValues;
import org.transitscope.pipeline.model.Point;
import org.transitscope.pipeline.model.TrackEdge;
import org.transitscope.pipeline.model.TrackKind;

import java.util.List;
import java.util.Optional;

/**
 * Reads the polyline and kind of a network edge from its components.
 * <p>
 * Geometry is looked up under {@code geometry | geo | geom}. Explicit coordinate lists are
 * used verbatim; otherwise the curve parameters are decoded and handed to the
 * {@link GeometryReconstructor}; as a last resort the two end nodes give a straight segment.
 */
public class EdgeGeometryReader {

    private static final Logger log = LoggerFactory.getLogger(EdgeGeometryReader.class);

    private static final List<ComponentKind> EDGE_COMPONENTS =
            List.of(ComponentKind.BASE_EDGE, ComponentKind.TRACK_EDGE, ComponentKind.STREET_EDGE);
    private static final List<String> GEOMETRY_FIELDS = List.of("geometry", "geo", "geom");
    private static final List<String> COORDINATE_FIELDS =
            List.of("coords", "points", "vertices", "samples", "middle", "positions");

    private final EntityAccessor accessor;
    private final GeometryReconstructor reconstructor;

    public EdgeGeometryReader(EntityAccessor accessor, GeometryReconstructor reconstructor) {
        this.accessor = accessor;
        this.reconstructor = reconstructor;
    }

    /**
     * Reads one edge.
     *
     * @param edgeId The edge entity id.
     * @return The edge, or empty if it has no component or fewer than two points.
     */
    public Optional<TrackEdge> read(long edgeId) {
        Optional<HostRecord> component = Optional.empty();
        for (ComponentKind kind : EDGE_COMPONENTS) {
            component = accessor.getComponent(edgeId, kind);
            if (component.isPresent()) {
                break;
            }
        }
        if (component.isEmpty()) {
            return Optional.empty();
        }
        List<Point> points = polyline(component.get());
        if (points.size() < 2) {
            log.debug("Edge {} has no usable geometry", edgeId);
            return Optional.empty();
        }
        return Optional.of(new TrackEdge(edgeId, kindOf(edgeId), points));
    }

    TrackKind kindOf(long edgeId) {
        if (accessor.getComponent(edgeId, ComponentKind.TRACK_EDGE).isPresent()) {
            return TrackKind.RAIL;
        }
        Optional<HostRecord> street = accessor.getComponent(edgeId, ComponentKind.STREET_EDGE);
        if (street.isPresent()) {
            HostRecord record = street.get();
            if (record.integer("tramTrackType") > 0 || Boolean.TRUE.equals(record.get("hasTram"))) {
                return TrackKind.TRAM;
            }
        }
        return TrackKind.OTHER;
    }

    private List<Point> polyline(HostRecord component) {
        Optional<HostRecord> geometry = component.record(GEOMETRY_FIELDS);
        if (geometry.isPresent()) {
            Object coords = geometry.get().first(COORDINATE_FIELDS);
            if (coords != null) {
                List<Point> points = PositionReader.readPoints(coords);
                if (!points.isEmpty()) {
                    return points;
                }
            }
            Optional<HostRecord> params = geometry.get().record("params");
            if (params.isPresent()) {
                List<Point> sampled = PositionReader.readPoints(params.get().get("pos"));
                if (sampled.size() > 2) {
                    return sampled;
                }
                Optional<CurveParams> curve = decode(params.get());
                if (curve.isPresent()) {
                    return reconstructor.reconstruct(curve.get());
                }
            }
        }
        return nodeSegment(component);
    }

    /**
     * Decodes the curve parameters of an edge geometry.
     *
     * @param params The {@code params} record.
     * @return The curve, or empty if the parameters are not recognized.
     */
    static Optional<CurveParams> decode(HostRecord params) {
        Optional<Point> center = PositionReader.readPoint(params.get("center"));
        if (center.isPresent() && HostValues.isNumber(params.get("radius"))) {
            return Optional.of(new CurveParams.Arc(center.get(),
                    HostValues.safeFloat(params.get("radius"), 6),
                    HostValues.safeFloat(params.first("startAngle", "angle0"), 6),
                    HostValues.safeFloat(params.first("endAngle", "angle1"), 6)));
        }
        List<Point> positions = PositionReader.readPoints(params.get("pos"));
        if (positions.size() < 2) {
            return Optional.empty();
        }
        List<Point> tangents = PositionReader.readPoints(params.first("tangent", "tangents"));
        if (tangents.size() >= 2) {
            return Optional.of(new CurveParams.TangentSpline(positions.get(0), positions.get(1),
                    tangents.get(0), tangents.get(1)));
        }
        return Optional.of(new CurveParams.Straight(positions.get(0), positions.get(1)));
    }

    private List<Point> nodeSegment(HostRecord component) {
        long node0 = component.integer("node0");
        long node1 = component.integer("node1");
        if (node0 <= 0 || node1 <= 0) {
            return List.of();
        }
        Optional<Point> p0 = nodePosition(node0);
        Optional<Point> p1 = nodePosition(node1);
        if (p0.isEmpty() || p1.isEmpty()) {
            return List.of();
        }
        return reconstructor.reconstruct(new CurveParams.Straight(p0.get(), p1.get()));
    }

    private Optional<Point> nodePosition(long nodeId) {
        return accessor.getComponent(nodeId, ComponentKind.BASE_NODE)
                .flatMap(node -> PositionReader.readPoint(node.get("position")));
    }
}

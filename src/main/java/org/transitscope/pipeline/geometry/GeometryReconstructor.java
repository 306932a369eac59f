package org.transitscope.pipeline.geometry;

import org.transitscope.host.HostValues;
import org.transitscope.pipeline.model.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@link CurveParams} into renderable 2D polylines.
 * <p>
 * Arcs are sampled with {@code arcSegments} subdivisions and tangent splines with
 * {@code splineSegments} subdivisions of the cubic Hermite basis. A spline whose end
 * tangents both have a squared magnitude below {@code degenerateTangentThreshold} is
 * emitted as its 2-point chord, so degenerate tangents never produce NaN coordinates.
 */
public class GeometryReconstructor {

    public static final int DEFAULT_ARC_SEGMENTS = 10;
    public static final int DEFAULT_SPLINE_SEGMENTS = 8;
    public static final double DEFAULT_DEGENERATE_TANGENT_THRESHOLD = 0.01;

    private final int arcSegments;
    private final int splineSegments;
    private final double degenerateTangentThreshold;

    public GeometryReconstructor() {
        this(DEFAULT_ARC_SEGMENTS, DEFAULT_SPLINE_SEGMENTS, DEFAULT_DEGENERATE_TANGENT_THRESHOLD);
    }

    public GeometryReconstructor(int arcSegments, int splineSegments, double degenerateTangentThreshold) {
        if (arcSegments < 1 || splineSegments < 1) {
            throw new IllegalArgumentException("Segment counts must be at least 1");
        }
        this.arcSegments = arcSegments;
        this.splineSegments = splineSegments;
        this.degenerateTangentThreshold = degenerateTangentThreshold;
    }

    /**
     * Reconstructs the polyline of a curve.
     *
     * @param params The curve description.
     * @return The polyline, at least two points.
     */
    public List<Point> reconstruct(CurveParams params) {
        if (params instanceof CurveParams.Straight straight) {
            return List.of(flat(straight.p0()), flat(straight.p1()));
        }
        if (params instanceof CurveParams.Arc arc) {
            return arc(arc);
        }
        if (params instanceof CurveParams.TangentSpline spline) {
            return spline(spline);
        }
        throw new IllegalArgumentException("Unsupported curve: " + params);
    }

    private List<Point> arc(CurveParams.Arc arc) {
        List<Point> points = new ArrayList<>(arcSegments + 1);
        double span = arc.endAngle() - arc.startAngle();
        for (int i = 0; i <= arcSegments; i++) {
            double angle = arc.startAngle() + span * i / arcSegments;
            points.add(rounded(
                    arc.center().x() + arc.radius() * Math.cos(angle),
                    arc.center().y() + arc.radius() * Math.sin(angle)));
        }
        return points;
    }

    private List<Point> spline(CurveParams.TangentSpline spline) {
        Point p0 = spline.p0();
        Point p1 = spline.p1();
        Point t0 = spline.t0();
        Point t1 = spline.t1();
        if (magnitudeSquared(t0) < degenerateTangentThreshold && magnitudeSquared(t1) < degenerateTangentThreshold) {
            return List.of(flat(p0), flat(p1));
        }
        List<Point> points = new ArrayList<>(splineSegments + 1);
        for (int i = 0; i <= splineSegments; i++) {
            double t = (double) i / splineSegments;
            double t2 = t * t;
            double t3 = t2 * t;
            double h00 = 2 * t3 - 3 * t2 + 1;
            double h10 = t3 - 2 * t2 + t;
            double h01 = -2 * t3 + 3 * t2;
            double h11 = t3 - t2;
            points.add(rounded(
                    h00 * p0.x() + h10 * t0.x() + h01 * p1.x() + h11 * t1.x(),
                    h00 * p0.y() + h10 * t0.y() + h01 * p1.y() + h11 * t1.y()));
        }
        return points;
    }

    private static double magnitudeSquared(Point v) {
        return v.x() * v.x() + v.y() * v.y();
    }

    private static Point flat(Point p) {
        return rounded(p.x(), p.y());
    }

    private static Point rounded(double x, double y) {
        return Point.of(HostValues.safeFloat(x), HostValues.safeFloat(y));
    }
}

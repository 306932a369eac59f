package org.transitscope.pipeline.geometry;

import org.transitscope.pipeline.model.Point;

/**
 * The curve description of a network edge, as decoded from the host's edge geometry.
 */
public sealed interface CurveParams permits CurveParams.Straight, CurveParams.Arc, CurveParams.TangentSpline {

    /**
     * A straight segment between two points.
     */
    record Straight(Point p0, Point p1) implements CurveParams {}

    /**
     * A circular arc.
     *
     * @param center     The arc center.
     * @param radius     The arc radius.
     * @param startAngle Start angle in radians.
     * @param endAngle   End angle in radians.
     */
    record Arc(Point center, double radius, double startAngle, double endAngle) implements CurveParams {}

    /**
     * A cubic Hermite curve between two points with the given end tangents.
     */
    record TangentSpline(Point p0, Point p1, Point t0, Point t1) implements CurveParams {}
}

package org.transitscope.pipeline.model;

/**
 * A world position. Two-dimensional polylines use {@code z = 0}.
 */
public record Point(double x, double y, double z) {

    public static final Point ORIGIN = new Point(0, 0, 0);

    public static Point of(double x, double y) {
        return new Point(x, y, 0);
    }

    /**
     * Returns the squared distance to another point in the xy plane.
     */
    public double distanceSquared2d(Point other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return dx * dx + dy * dy;
    }
}

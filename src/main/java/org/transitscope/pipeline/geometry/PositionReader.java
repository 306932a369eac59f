package org.transitscope.pipeline.geometry;

import org.transitscope.host.HostRecord;
import org.transitscope.host.HostValues;
import org.transitscope.pipeline.model.Point;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads positions out of host records. Coordinates are rounded to two decimals.
 */
public final class PositionReader {

    private PositionReader() {
    }

    /**
     * Reads the position of an entity: {@code position} as a sequence or an {@code x,y,z}
     * record, otherwise the translation of the 4x4 {@code transform} matrix.
     *
     * @param entity The entity record.
     * @return The position, or empty if the entity carries neither field.
     */
    public static Optional<Point> entityPosition(HostRecord entity) {
        Object position = entity.get("position");
        if (position != null) {
            return Optional.of(readPoint(position).orElse(Point.ORIGIN));
        }
        Object transform = entity.get("transform");
        if (transform != null) {
            return Optional.of(fromTransform(HostValues.asList(transform)));
        }
        return Optional.empty();
    }

    /**
     * Reads a single point given as a sequence {@code [x, y, z?]} or a record with
     * {@code x, y, z?} fields. A missing z is 0.
     *
     * @param value The host value.
     * @return The point, or empty if x or y is missing.
     */
    public static Optional<Point> readPoint(Object value) {
        if (value instanceof Map<?, ?> map && map.get("x") != null) {
            Object y = map.get("y");
            if (y == null) {
                return Optional.empty();
            }
            return Optional.of(new Point(HostValues.safeFloat(map.get("x")), HostValues.safeFloat(y),
                    HostValues.safeFloat(map.get("z"))));
        }
        List<Object> coordinates = HostValues.asList(value);
        if (coordinates.size() < 2) {
            return Optional.empty();
        }
        Object z = coordinates.size() > 2 ? coordinates.get(2) : null;
        return Optional.of(new Point(HostValues.safeFloat(coordinates.get(0)),
                HostValues.safeFloat(coordinates.get(1)), HostValues.safeFloat(z)));
    }

    /**
     * Reads a list of points, skipping elements that are not points.
     */
    public static List<Point> readPoints(Object value) {
        return HostValues.asList(value).stream()
                .map(PositionReader::readPoint)
                .flatMap(Optional::stream)
                .map(p -> Point.of(p.x(), p.y()))
                .toList();
    }

    // translation sits in elements 12..14 of a column-major matrix, 3/7/11 of a row-major one
    private static Point fromTransform(List<Object> matrix) {
        return new Point(
                HostValues.safeFloat(element(matrix, 12, 3)),
                HostValues.safeFloat(element(matrix, 13, 7)),
                HostValues.safeFloat(element(matrix, 14, 11)));
    }

    private static Object element(List<Object> matrix, int index, int fallbackIndex) {
        if (matrix.size() > index && matrix.get(index) != null) {
            return matrix.get(index);
        }
        if (matrix.size() > fallbackIndex) {
            return matrix.get(fallbackIndex);
        }
        return null;
    }
}

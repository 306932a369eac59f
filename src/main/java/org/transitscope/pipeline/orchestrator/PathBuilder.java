package org.transitscope.pipeline.orchestrator;

import org.transitscope.host.EntityAccessor;
import org.transitscope.pipeline.geometry.PositionReader;
import org.transitscope.pipeline.model.Line;
import org.transitscope.pipeline.model.LinePath;
import org.transitscope.pipeline.model.Point;
import org.transitscope.pipeline.model.Station;
import org.transitscope.pipeline.model.Stop;
import org.transitscope.pipeline.resolve.StationCatalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the coarse path of each line through the positions of its stops.
 * <p>
 * A stop is positioned at its resolved station, else at the entity of its raw id. Lines
 * without any positioned stop get no path.
 */
public class PathBuilder {

    private final EntityAccessor accessor;

    public PathBuilder(EntityAccessor accessor) {
        this.accessor = accessor;
    }

    public List<LinePath> build(List<Line> lines, StationCatalog catalog) {
        List<LinePath> paths = new ArrayList<>();
        for (Line line : lines) {
            List<Point> points = new ArrayList<>();
            for (Stop stop : line.stops()) {
                stopPosition(stop, catalog).ifPresent(p -> points.add(Point.of(p.x(), p.y())));
            }
            if (!points.isEmpty()) {
                paths.add(new LinePath(line.id(), points));
            }
        }
        return paths;
    }

    private Optional<Point> stopPosition(Stop stop, StationCatalog catalog) {
        Optional<Station> station = catalog.station(stop.stationId());
        if (station.isPresent()) {
            return Optional.of(station.get().position());
        }
        if (stop.rawStopId() > 0) {
            return accessor.getEntity(stop.rawStopId()).flatMap(PositionReader::entityPosition);
        }
        return Optional.empty();
    }
}

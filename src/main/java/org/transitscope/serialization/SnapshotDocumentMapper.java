package org.transitscope.serialization;

import org.transitscope.pipeline.model.Line;
import org.transitscope.pipeline.model.LinePath;
import org.transitscope.pipeline.model.Point;
import org.transitscope.pipeline.model.Signal;
import org.transitscope.pipeline.model.Snapshot;
import org.transitscope.pipeline.model.SnapshotStats;
import org.transitscope.pipeline.model.Station;
import org.transitscope.pipeline.model.Stop;
import org.transitscope.pipeline.model.TrackEdge;
import org.transitscope.pipeline.model.Vehicle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps a {@link Snapshot} onto the generic value tree consumed by the
 * {@link DeterministicEncoder}. Field names are the snake_case keys of the published
 * document.
 */
public class SnapshotDocumentMapper {

    public Map<String, Object> toDocument(Snapshot snapshot) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("schema_version", snapshot.schemaVersion());
        doc.put("write_count", snapshot.writeCount());
        doc.put("game_time", snapshot.gameTime());
        doc.put("stats", stats(snapshot.stats()));
        doc.put("vehicles", list(snapshot.vehicles(), this::vehicle));
        doc.put("lines", list(snapshot.lines(), this::line));
        doc.put("stations", list(snapshot.stations(), this::station));
        doc.put("paths", list(snapshot.paths(), this::path));
        doc.put("tracks", list(snapshot.tracks(), this::track));
        doc.put("signals", list(snapshot.signals(), this::signal));
        return doc;
    }

    private Map<String, Object> stats(SnapshotStats stats) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("total_vehicles", stats.totalVehicles());
        m.put("total_passengers", stats.totalPassengers());
        m.put("total_lines", stats.totalLines());
        m.put("total_stations", stats.totalStations());
        m.put("vehicles_by_type", new LinkedHashMap<String, Object>(stats.vehiclesByType()));
        return m;
    }

    private Map<String, Object> vehicle(Vehicle v) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", v.id());
        m.put("name", v.name());
        m.put("type", v.type());
        m.put("state", v.state());
        m.put("line_id", v.lineId());
        m.put("line_name", v.lineName());
        m.put("position", point3(v.position()));
        m.put("speed_ms", v.speedMs());
        m.put("speed_kmh", v.speedKmh());
        m.put("direction", v.direction());
        m.put("passengers", v.passengers());
        m.put("capacity", v.capacity());
        m.put("cargo", v.cargo());
        m.put("cargo_capacity", v.cargoCapacity());
        m.put("last_stop_id", v.lastStopId());
        m.put("last_stop_name", v.lastStopName());
        m.put("next_stop_id", v.nextStopId());
        m.put("next_stop_name", v.nextStopName());
        m.put("raw_stop_index", v.rawStopIndex());
        return m;
    }

    private Map<String, Object> line(Line line) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", line.id());
        m.put("name", line.name());
        m.put("vehicle_type", line.vehicleType());
        m.put("stop_count", line.stopCount());
        m.put("stops", list(line.stops(), this::stop));
        return m;
    }

    private Map<String, Object> stop(Stop stop) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("index", stop.index());
        m.put("station_id", stop.stationId());
        m.put("raw_stop_id", stop.rawStopId());
        m.put("name", stop.name());
        return m;
    }

    private Map<String, Object> station(Station station) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", station.id());
        m.put("name", station.name());
        m.put("pos", point3(station.position()));
        m.put("is_group", station.isGroup());
        return m;
    }

    private Map<String, Object> path(LinePath path) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("line_id", path.lineId());
        m.put("points", list(path.points(), SnapshotDocumentMapper::point2));
        return m;
    }

    private Map<String, Object> track(TrackEdge edge) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", edge.id());
        m.put("kind", edge.kind().wireName());
        m.put("points", list(edge.points(), SnapshotDocumentMapper::point2));
        return m;
    }

    private Map<String, Object> signal(Signal signal) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", signal.id());
        m.put("pos", point3(signal.position()));
        m.put("state", signal.state().code());
        return m;
    }

    private static Map<String, Object> point3(Point p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("x", p.x());
        m.put("y", p.y());
        m.put("z", p.z());
        return m;
    }

    private static Map<String, Object> point2(Point p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("x", p.x());
        m.put("y", p.y());
        return m;
    }

    private static <T> List<Object> list(List<T> items, Function<T, Map<String, Object>> mapper) {
        List<Object> out = new ArrayList<>(items.size());
        for (T item : items) {
            out.add(mapper.apply(item));
        }
        return out;
    }
}

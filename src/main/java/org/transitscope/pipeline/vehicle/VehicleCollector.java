package org.transitscope.pipeline.vehicle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitscope.host.EntityAccessor;
import org.transitscope.host.EntityKind;
import org.transitscope.host.HostRecord;
import org.transitscope.host.HostValues;
import org.transitscope.pipeline.geometry.PositionReader;
import org.transitscope.pipeline.model.Point;
import org.transitscope.pipeline.model.Vehicle;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the runtime state of every vehicle from the host.
 * <p>
 * Missing fields fall back to zero or {@code UNKNOWN}; line name and stop fields are left
 * empty for the {@link VehicleEnricher}.
 */
public class VehicleCollector {

    private static final Logger log = LoggerFactory.getLogger(VehicleCollector.class);

    /** Fields that may carry the vehicle's line id, in priority order. */
    static final List<String> LINE_ID_FIELDS =
            List.of("lineIdx", "line", "lineId", "lineEntity", "lineEntityId");

    static final String UNKNOWN = "UNKNOWN";
    static final String ROAD_CARRIER = "ROAD";

    private final EntityAccessor accessor;
    private final boolean includeCargo;
    private final boolean includeRoadVehicles;

    public VehicleCollector(EntityAccessor accessor) {
        this(accessor, true, true);
    }

    /**
     * @param accessor            The host accessor.
     * @param includeCargo        Whether cargo load and capacity are reported; if not they are zeroed.
     * @param includeRoadVehicles Whether vehicles with carrier {@code ROAD} are reported.
     */
    public VehicleCollector(EntityAccessor accessor, boolean includeCargo, boolean includeRoadVehicles) {
        this.accessor = accessor;
        this.includeCargo = includeCargo;
        this.includeRoadVehicles = includeRoadVehicles;
    }

    /**
     * Collects all vehicles in enumeration order. Vehicles whose record cannot be fetched
     * are skipped.
     *
     * @return The collected vehicles.
     */
    public List<Vehicle> collect() {
        List<Vehicle> vehicles = new ArrayList<>();
        for (long id : accessor.enumerate(EntityKind.VEHICLE)) {
            Optional<HostRecord> record = accessor.getVehicle(id);
            if (record.isEmpty()) {
                continue;
            }
            Vehicle vehicle = toVehicle(id, record.get());
            if (!includeRoadVehicles && ROAD_CARRIER.equals(vehicle.type())) {
                continue;
            }
            vehicles.add(includeCargo ? vehicle : vehicle.withoutCargo());
        }
        log.debug("Collected {} vehicles", vehicles.size());
        return vehicles;
    }

    static Vehicle toVehicle(long id, HostRecord record) {
        String name = record.string("name");
        if (name.isEmpty()) {
            name = "Vehicle #" + id;
        }
        Point position = PositionReader.entityPosition(record).orElse(Point.ORIGIN);

        double speedMs = HostValues.safeFloat(record.first("speed", "velocity"), 3);
        double speedKmh = HostValues.safeFloat(speedMs * 3.6, 1);

        long lineId = HostValues.safeInt(record.first(LINE_ID_FIELDS));
        if (record.first(LINE_ID_FIELDS) == null) {
            lineId = record.record("transportVehicle").map(tv -> tv.integer("lineIdx")).orElse(0L);
        }

        LoadSplit load = LoadSplit.of(record.get("cargoLoad"));
        LoadSplit capacities = LoadSplit.of(record.get("capacities"));

        String state = record.string("state");
        if (state.isEmpty()) {
            state = UNKNOWN;
        }
        String carrier = record.string("carrier");
        if (carrier.isEmpty()) {
            carrier = UNKNOWN;
        }
        int rawStopIndex = stopIndex(record);

        return new Vehicle(id, name, carrier, state, lineId, "", position, speedMs, speedKmh, 1,
                load.passengers(), capacities.passengers(), load.cargo(), capacities.cargo(),
                0, "", 0, "", rawStopIndex);
    }

    /**
     * Reads the 0-based index of the last served stop; anything that is not a valid int
     * index means no stop data.
     */
    private static int stopIndex(HostRecord record) {
        if (!record.has("stopIndex")) {
            return -1;
        }
        long index = HostValues.safeInt(record.get("stopIndex"));
        return index < 0 || index > Integer.MAX_VALUE ? -1 : (int) index;
    }

    /**
     * Passenger and cargo totals of a per-cargo-type table.
     */
    record LoadSplit(long passengers, long cargo) {

        static LoadSplit of(Object table) {
            if (!(table instanceof Map<?, ?> map)) {
                return new LoadSplit(0, 0);
            }
            Object passengerValue = map.get("PASSENGERS");
            if (passengerValue == null) {
                passengerValue = map.get("passengers");
            }
            long cargo = 0;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (!"PASSENGERS".equals(key) && !"passengers".equals(key)) {
                    cargo += HostValues.safeInt(entry.getValue());
                }
            }
            return new LoadSplit(HostValues.safeInt(passengerValue), cargo);
        }
    }
}

package org.transitscope.host.capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitscope.host.HostFunctions;
import org.transitscope.host.IHostApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The ordered capability probe table of one host build.
 * <p>
 * The table is built once by {@link #probe(IHostApi)}. For every {@link Capability} it keeps
 * the candidate host calls whose function (and, where needed, constant) exists on the
 * host, in the order they must be tried. Capabilities without any available candidate are
 * logged once at INFO level during probing and never re-probed.
 * <p>
 * The candidate orders encode knowledge about host versions and are load-bearing.
 */
public final class CapabilityTable {

    private static final Logger log = LoggerFactory.getLogger(CapabilityTable.class);

    private static final List<String> VEHICLE_TYPE_KEYS = List.of("VEHICLE", "TRANSPORT_VEHICLE", "Vehicle", "vehicle");
    private static final List<Integer> VEHICLE_RAW_TYPES = List.of(10, 9, 8, 7, 6, 5, 4, 3, 11, 12, 13, 14, 15, 2, 1);
    private static final List<String> LINE_LIST_TYPES = List.of("LINE", "entity.LINE", "TRANSPORT_LINE");
    private static final List<String> STATION_LIST_TYPES = List.of("STATION", "entity.STATION");
    private static final List<String> SIGNAL_TYPE_KEYS = List.of("SIGNAL", "RAIL_SIGNAL", "RAILROAD_SIGNAL");
    private static final List<Integer> SIGNAL_RAW_TYPES = List.of(18, 17, 16, 19, 20);
    private static final List<String> EDGE_TYPE_KEYS = List.of("BASE_EDGE", "EDGE");
    private static final int REPORTED_COMPONENT_TYPES = 20;

    private final Map<Capability, List<ProbeCandidate>> available;
    private final Map<String, Object> entityTypes;
    private final Map<String, Object> componentTypes;
    private final Set<String> functions;

    private CapabilityTable(Map<Capability, List<ProbeCandidate>> available,
                            Map<String, Object> entityTypes,
                            Map<String, Object> componentTypes,
                            Set<String> functions) {
        this.available = available;
        this.entityTypes = entityTypes;
        this.componentTypes = componentTypes;
        this.functions = functions;
    }

    /**
     * Probes the host once and builds the table.
     *
     * @param host The host to probe.
     * @return The probed table.
     */
    public static CapabilityTable probe(IHostApi host) {
        Set<String> functions = safeFunctions(host);
        Map<String, Object> entityTypes = safeConstants(host, HostFunctions.ENTITY_TYPES);
        Map<String, Object> componentTypes = safeConstants(host, HostFunctions.COMPONENT_TYPES);

        Map<Capability, List<ProbeCandidate>> declared = declareCandidates(entityTypes);
        Map<Capability, List<ProbeCandidate>> available = new EnumMap<>(Capability.class);
        for (Capability capability : Capability.values()) {
            List<ProbeCandidate> usable = new ArrayList<>();
            for (ProbeCandidate candidate : declared.getOrDefault(capability, List.of())) {
                if (functions.contains(candidate.function())) {
                    usable.add(candidate);
                }
            }
            if (capability == Capability.GET_COMPONENT && componentTypes.isEmpty()) {
                usable.clear();
            }
            available.put(capability, Collections.unmodifiableList(usable));
            if (usable.isEmpty()) {
                log.info("Host capability {} is unavailable; dependent data will be empty", capability);
            }
        }
        log.debug("Probed {} host functions, {} entity types, {} component types",
                functions.size(), entityTypes.size(), componentTypes.size());
        return new CapabilityTable(available, entityTypes, componentTypes, functions);
    }

    private static Map<Capability, List<ProbeCandidate>> declareCandidates(Map<String, Object> entityTypes) {
        Map<Capability, List<ProbeCandidate>> declared = new EnumMap<>(Capability.class);

        declared.put(Capability.GET_ENTITY, List.of(ProbeCandidate.call(HostFunctions.GI_GET_ENTITY)));
        declared.put(Capability.GET_VEHICLE, List.of(
                ProbeCandidate.call(HostFunctions.GI_GET_VEHICLE),
                ProbeCandidate.call(HostFunctions.GI_GET_ENTITY)));
        declared.put(Capability.GET_LINE, List.of(
                ProbeCandidate.call(HostFunctions.GI_GET_LINE),
                ProbeCandidate.call(HostFunctions.GI_GET_ENTITY)));
        declared.put(Capability.GET_COMPONENT, List.of(ProbeCandidate.call(HostFunctions.ENGINE_GET_COMPONENT)));

        List<ProbeCandidate> vehicles = new ArrayList<>();
        vehicles.add(ProbeCandidate.call(HostFunctions.GI_GET_VEHICLES));
        addEntityTypeCandidates(vehicles, entityTypes, VEHICLE_TYPE_KEYS, "VEHICLE");
        addRawTypeCandidates(vehicles, VEHICLE_RAW_TYPES);
        declared.put(Capability.ENUMERATE_VEHICLES, vehicles);

        List<ProbeCandidate> lines = new ArrayList<>();
        lines.add(ProbeCandidate.call(HostFunctions.GI_GET_LINES));
        for (String type : LINE_LIST_TYPES) {
            lines.add(ProbeCandidate.callWith(HostFunctions.GI_GET_ENTITY_LIST, type, "\"" + type + "\""));
        }
        declared.put(Capability.ENUMERATE_LINES, lines);

        List<ProbeCandidate> stations = new ArrayList<>();
        stations.add(ProbeCandidate.call(HostFunctions.GI_GET_STATIONS));
        for (String type : STATION_LIST_TYPES) {
            stations.add(ProbeCandidate.callWith(HostFunctions.GI_GET_ENTITY_LIST, type, "\"" + type + "\""));
        }
        declared.put(Capability.ENUMERATE_STATIONS, stations);

        List<ProbeCandidate> groups = new ArrayList<>();
        groups.add(ProbeCandidate.call(HostFunctions.GI_GET_STATION_GROUPS));
        addEntityTypeCandidates(groups, entityTypes, List.of("STATION_GROUP"), null);
        declared.put(Capability.ENUMERATE_STATION_GROUPS, groups);

        List<ProbeCandidate> signals = new ArrayList<>();
        addEntityTypeCandidates(signals, entityTypes, SIGNAL_TYPE_KEYS, "SIGNAL");
        addRawTypeCandidates(signals, SIGNAL_RAW_TYPES);
        declared.put(Capability.ENUMERATE_SIGNALS, signals);

        List<ProbeCandidate> edges = new ArrayList<>();
        addEntityTypeCandidates(edges, entityTypes, EDGE_TYPE_KEYS, null);
        declared.put(Capability.ENUMERATE_EDGES, edges);

        declared.put(Capability.ENUMERATE_REGION, List.of(ProbeCandidate.call(HostFunctions.GI_GET_ENTITIES)));
        declared.put(Capability.GAME_TIME, List.of(
                ProbeCandidate.call(HostFunctions.GI_GET_GAME_TIME),
                ProbeCandidate.call(HostFunctions.ENGINE_GET_GAME_TIME)));
        return declared;
    }

    private static void addEntityTypeCandidates(List<ProbeCandidate> target, Map<String, Object> entityTypes,
                                                List<String> preferredKeys, String containedKeyword) {
        Set<String> used = new LinkedHashSet<>();
        for (String key : preferredKeys) {
            Object value = entityTypes.get(key);
            if (value != null) {
                target.add(ProbeCandidate.callWith(HostFunctions.ENGINE_GET_ENTITY_LIST, value, "ET." + key));
                used.add(key);
            }
        }
        if (containedKeyword == null) {
            return;
        }
        // sorted for a stable order across runs
        for (Map.Entry<String, Object> entry : new TreeMap<>(entityTypes).entrySet()) {
            String key = entry.getKey();
            if (!used.contains(key) && entry.getValue() != null
                    && key.toUpperCase(Locale.ROOT).contains(containedKeyword)) {
                target.add(ProbeCandidate.callWith(HostFunctions.ENGINE_GET_ENTITY_LIST, entry.getValue(), "ET." + key));
            }
        }
    }

    private static void addRawTypeCandidates(List<ProbeCandidate> target, List<Integer> rawTypes) {
        for (Integer raw : rawTypes) {
            target.add(ProbeCandidate.callWith(HostFunctions.ENGINE_GET_ENTITY_LIST, raw, String.valueOf(raw)));
        }
    }

    private static Set<String> safeFunctions(IHostApi host) {
        try {
            Set<String> functions = host.functions();
            return functions == null ? Set.of() : Set.copyOf(functions);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.debug("Host refused to list its functions: {}", e.getMessage());
            return Set.of();
        }
    }

    private static Map<String, Object> safeConstants(IHostApi host, String table) {
        try {
            Map<String, Object> constants = host.constants(table);
            if (constants == null) {
                return Map.of();
            }
            Map<String, Object> copy = new TreeMap<>();
            constants.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
            return Collections.unmodifiableMap(copy);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.debug("Host constant table {} unreadable: {}", table, e.getMessage());
            return Map.of();
        }
    }

    /**
     * Returns the available candidates of a capability in try order.
     *
     * @param capability The capability.
     * @return The candidates, empty if the capability is unavailable.
     */
    public List<ProbeCandidate> candidates(Capability capability) {
        return available.getOrDefault(capability, List.of());
    }

    public boolean isAvailable(Capability capability) {
        return !candidates(capability).isEmpty();
    }

    /**
     * Looks up a component type constant.
     *
     * @param name The constant name, e.g. {@code TRACK_EDGE}.
     * @return The host's constant value, or {@code null} if unknown.
     */
    public Object componentType(String name) {
        return componentTypes.get(name);
    }

    public Object entityType(String name) {
        return entityTypes.get(name);
    }

    /**
     * Renders a plain-text report of the probe results: one line per capability, followed
     * by the entity type table and the first component type constants.
     *
     * @return The report text.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("TransitScope host capability report\n");
        sb.append("functions: ").append(functions.size()).append('\n');
        sb.append(HostFunctions.ENTITY_TYPES).append(": ")
                .append(entityTypes.isEmpty() ? "missing" : entityTypes.size() + " entries").append('\n');
        sb.append(HostFunctions.COMPONENT_TYPES).append(": ")
                .append(componentTypes.isEmpty() ? "missing" : componentTypes.size() + " entries").append('\n');
        for (Capability capability : Capability.values()) {
            List<ProbeCandidate> candidates = candidates(capability);
            sb.append(capability).append(": ");
            if (candidates.isEmpty()) {
                sb.append("UNAVAILABLE");
            } else {
                sb.append("AVAILABLE via ");
                for (int i = 0; i < candidates.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(candidates.get(i).label());
                }
            }
            sb.append('\n');
        }
        if (!entityTypes.isEmpty()) {
            sb.append("entity types:\n");
            entityTypes.forEach((key, value) -> sb.append("  ").append(key).append(" = ").append(value).append('\n'));
        }
        if (!componentTypes.isEmpty()) {
            sb.append("component types (first ").append(REPORTED_COMPONENT_TYPES).append("):\n");
            componentTypes.entrySet().stream()
                    .limit(REPORTED_COMPONENT_TYPES)
                    .forEach(e -> sb.append("  ").append(e.getKey()).append(" = ").append(e.getValue()).append('\n'));
        }
        return sb.toString();
    }
}

package org.transitscope.host.fixture;

import org.transitscope.host.ComponentKind;
import org.transitscope.host.EntityKind;
import org.transitscope.host.HostFunctions;
import org.transitscope.host.HostRecord;
import org.transitscope.host.HostValues;
import org.transitscope.host.IHostApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An in-memory host that answers the host functions from a fixed world state.
 * <p>
 * Used by the command line tools (loaded from a JSON fixture by {@link FixtureHostLoader})
 * and by tests (built programmatically). Functions can be hidden to emulate older host
 * builds, or marked as failing to emulate host errors.
 */
public final class FixtureHostApi implements IHostApi {

    /**
     * Functions exposed when the builder is not told otherwise.
     */
    public static final Set<String> DEFAULT_FUNCTIONS = Set.of(
            HostFunctions.GI_GET_ENTITY,
            HostFunctions.GI_GET_ENTITIES,
            HostFunctions.GI_GET_VEHICLE,
            HostFunctions.GI_GET_VEHICLES,
            HostFunctions.GI_GET_LINE,
            HostFunctions.GI_GET_LINES,
            HostFunctions.GI_GET_STATIONS,
            HostFunctions.GI_GET_STATION_GROUPS,
            HostFunctions.GI_GET_GAME_TIME,
            HostFunctions.ENGINE_GET_ENTITY_LIST,
            HostFunctions.ENGINE_GET_COMPONENT);

    private final Set<String> functions;
    private final Set<String> failing;
    private final Map<EntityKind, Map<Long, Map<String, Object>>> entities;
    private final Map<ComponentKind, Map<Long, Map<String, Object>>> components;
    private final Map<String, Object> entityTypes;
    private final Map<String, Object> componentTypes;
    private final Object gameTime;
    private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
    private final AtomicInteger functionQueries = new AtomicInteger();

    private FixtureHostApi(Builder builder) {
        this.functions = Collections.unmodifiableSet(new LinkedHashSet<>(builder.functions));
        this.failing = Set.copyOf(builder.failing);
        this.entities = builder.entities;
        this.components = builder.components;
        this.entityTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.entityTypes));
        this.componentTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.componentTypes));
        this.gameTime = builder.gameTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Set<String> functions() {
        functionQueries.incrementAndGet();
        return functions;
    }

    @Override
    public Map<String, Object> constants(String table) {
        if (HostFunctions.ENTITY_TYPES.equals(table)) {
            return entityTypes;
        }
        if (HostFunctions.COMPONENT_TYPES.equals(table)) {
            return componentTypes;
        }
        return Map.of();
    }

    @Override
    public Object invoke(String function, Object... args) {
        invocations.computeIfAbsent(function, f -> new AtomicInteger()).incrementAndGet();
        if (!functions.contains(function)) {
            throw new UnsupportedOperationException("Function not exposed by this host: " + function);
        }
        if (failing.contains(function)) {
            throw new IllegalStateException("Simulated host failure in " + function);
        }
        switch (function) {
            case HostFunctions.GI_GET_ENTITY:
            case HostFunctions.GI_GET_VEHICLE:
            case HostFunctions.GI_GET_LINE:
                return findEntity(HostValues.safeInt(argument(args, 0)));
            case HostFunctions.GI_GET_VEHICLES:
                return ids(EntityKind.VEHICLE);
            case HostFunctions.GI_GET_LINES:
                return ids(EntityKind.LINE);
            case HostFunctions.GI_GET_STATIONS:
                return ids(EntityKind.STATION);
            case HostFunctions.GI_GET_STATION_GROUPS:
                return ids(EntityKind.STATION_GROUP);
            case HostFunctions.GI_GET_ENTITY_LIST:
                return entityListByName(HostValues.safeStr(argument(args, 0)));
            case HostFunctions.ENGINE_GET_ENTITY_LIST:
                return entityListByType(argument(args, 0));
            case HostFunctions.ENGINE_GET_COMPONENT:
                return component(HostValues.safeInt(argument(args, 0)), argument(args, 1));
            case HostFunctions.GI_GET_ENTITIES:
                return region(argument(args, 0), argument(args, 1));
            case HostFunctions.GI_GET_GAME_TIME:
            case HostFunctions.ENGINE_GET_GAME_TIME:
                return gameTime;
            default:
                throw new UnsupportedOperationException("Fixture host cannot answer " + function);
        }
    }

    /**
     * Returns how often a function was invoked.
     */
    public int invocationCount(String function) {
        AtomicInteger count = invocations.get(function);
        return count == null ? 0 : count.get();
    }

    /**
     * Returns how often the function list was queried, which happens once per probe.
     */
    public int functionQueryCount() {
        return functionQueries.get();
    }

    private static Object argument(Object[] args, int index) {
        return args != null && args.length > index ? args[index] : null;
    }

    private Map<String, Object> findEntity(long id) {
        for (Map<Long, Map<String, Object>> byId : entities.values()) {
            Map<String, Object> record = byId.get(id);
            if (record != null) {
                return record;
            }
        }
        return null;
    }

    private List<Long> ids(EntityKind kind) {
        return List.copyOf(entities.getOrDefault(kind, Map.of()).keySet());
    }

    private List<Long> entityListByName(String name) {
        String normalized = name.toUpperCase(Locale.ROOT);
        if (normalized.startsWith("ENTITY.")) {
            normalized = normalized.substring("ENTITY.".length());
        }
        if (normalized.startsWith("TRANSPORT_")) {
            normalized = normalized.substring("TRANSPORT_".length());
        }
        return kindByName(normalized).map(this::ids).orElse(List.of());
    }

    private List<Long> entityListByType(Object typeValue) {
        for (Map.Entry<String, Object> entry : entityTypes.entrySet()) {
            if (sameConstant(entry.getValue(), typeValue)) {
                return kindByName(entry.getKey().toUpperCase(Locale.ROOT)).map(this::ids).orElse(List.of());
            }
        }
        return List.of();
    }

    private Map<String, Object> component(long id, Object typeValue) {
        for (Map.Entry<String, Object> entry : componentTypes.entrySet()) {
            if (sameConstant(entry.getValue(), typeValue)) {
                for (ComponentKind kind : ComponentKind.values()) {
                    if (kind.name().equals(entry.getKey())) {
                        return components.getOrDefault(kind, Map.of()).get(id);
                    }
                }
            }
        }
        return null;
    }

    private List<Long> region(Object bounds, Object filter) {
        String type = HostRecord.of(filter).map(f -> f.string("type")).orElse("");
        EntityKind kind = null;
        for (EntityKind candidate : EntityKind.values()) {
            if (candidate.regionFilterType().equals(type)) {
                kind = candidate;
            }
        }
        if (kind == null) {
            return List.of();
        }
        HostRecord area = HostRecord.of(bounds).orElse(null);
        List<Long> result = new ArrayList<>();
        for (Map.Entry<Long, Map<String, Object>> entry : entities.getOrDefault(kind, Map.of()).entrySet()) {
            if (area == null || withinRegion(area, entry.getValue())) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    private static boolean withinRegion(HostRecord area, Map<String, Object> record) {
        List<Object> center = area.list("pos");
        List<Object> position = HostValues.asList(record.get("position"));
        if (center.size() < 2 || position.size() < 2) {
            return true;
        }
        double dx = HostValues.safeFloat(position.get(0), 6) - HostValues.safeFloat(center.get(0), 6);
        double dy = HostValues.safeFloat(position.get(1), 6) - HostValues.safeFloat(center.get(1), 6);
        double radius = HostValues.safeFloat(area.get("radius"), 6);
        return dx * dx + dy * dy <= radius * radius;
    }

    private static boolean sameConstant(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return HostValues.safeInt(a) == HostValues.safeInt(b);
        }
        return Objects.equals(a, b);
    }

    private static Optional<EntityKind> kindByName(String name) {
        if ("BASE_EDGE".equals(name)) {
            return Optional.of(EntityKind.EDGE);
        }
        for (EntityKind kind : EntityKind.values()) {
            if (kind.name().equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Builder for {@link FixtureHostApi}. Entity and component type tables default to
     * integer constants.
     */
    public static final class Builder {

        private final Set<String> functions = new LinkedHashSet<>(DEFAULT_FUNCTIONS);
        private final Set<String> failing = new LinkedHashSet<>();
        private final Map<EntityKind, Map<Long, Map<String, Object>>> entities = new EnumMap<>(EntityKind.class);
        private final Map<ComponentKind, Map<Long, Map<String, Object>>> components = new EnumMap<>(ComponentKind.class);
        private final Map<String, Object> entityTypes = new LinkedHashMap<>();
        private final Map<String, Object> componentTypes = new LinkedHashMap<>();
        private Object gameTime;

        private Builder() {
            // outside the raw type ids probed as a last resort
            entityTypes.put("VEHICLE", 101);
            entityTypes.put("LINE", 102);
            entityTypes.put("STATION", 103);
            entityTypes.put("STATION_GROUP", 104);
            entityTypes.put("SIGNAL", 105);
            entityTypes.put("BASE_EDGE", 106);
            int next = 1;
            for (ComponentKind kind : ComponentKind.values()) {
                componentTypes.put(kind.name(), next++);
            }
        }

        /**
         * Adds an entity. Entities of each kind keep insertion order.
         */
        public Builder entity(EntityKind kind, long id, Map<String, ?> record) {
            entities.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(id, copy(record));
            return this;
        }

        public Builder component(ComponentKind kind, long id, Map<String, ?> record) {
            components.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(id, copy(record));
            return this;
        }

        public Builder gameTime(Object gameTime) {
            this.gameTime = gameTime;
            return this;
        }

        /**
         * Replaces the set of exposed functions.
         */
        public Builder functions(Set<String> exposed) {
            functions.clear();
            functions.addAll(exposed);
            return this;
        }

        public Builder withoutFunction(String function) {
            functions.remove(function);
            return this;
        }

        public Builder withFunction(String function) {
            functions.add(function);
            return this;
        }

        /**
         * Makes every call to the function throw.
         */
        public Builder failing(String function) {
            failing.add(function);
            return this;
        }

        /**
         * Replaces the entity type table.
         */
        public Builder entityTypes(Map<String, ?> table) {
            entityTypes.clear();
            entityTypes.putAll(table);
            return this;
        }

        public Builder componentTypes(Map<String, ?> table) {
            componentTypes.clear();
            componentTypes.putAll(table);
            return this;
        }

        public FixtureHostApi build() {
            return new FixtureHostApi(this);
        }

        private static Map<String, Object> copy(Map<String, ?> record) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(record));
        }
    }
}

package org.transitscope.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitscope.host.capability.Capability;
import org.transitscope.host.capability.CapabilityTable;
import org.transitscope.host.capability.ProbeCandidate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * The only gateway between the pipeline and the host.
 * <p>
 * Every operation goes through the {@link CapabilityTable} probed at construction: the
 * available candidates of a capability are tried in order and the first non-empty
 * result wins. Host failures are wrapped in a {@link HostCallException}, logged at DEBUG
 * and turned into an empty result, linkage errors included. No method of this class throws
 * anything but a {@link VirtualMachineError}.
 */
public class EntityAccessor {

    private static final Logger log = LoggerFactory.getLogger(EntityAccessor.class);

    private final IHostApi host;
    private final CapabilityTable capabilities;

    /**
     * Creates an accessor and probes the host's capabilities once.
     *
     * @param host The host API.
     */
    public EntityAccessor(IHostApi host) {
        this(host, CapabilityTable.probe(host));
    }

    public EntityAccessor(IHostApi host, CapabilityTable capabilities) {
        this.host = host;
        this.capabilities = capabilities;
    }

    public CapabilityTable capabilities() {
        return capabilities;
    }

    public boolean supports(Capability capability) {
        return capabilities.isAvailable(capability);
    }

    public Optional<HostRecord> getEntity(long id) {
        return fetchRecord(Capability.GET_ENTITY, id);
    }

    /**
     * Fetches a vehicle record, preferring the dedicated vehicle getter over the generic
     * entity getter.
     */
    public Optional<HostRecord> getVehicle(long id) {
        return fetchRecord(Capability.GET_VEHICLE, id);
    }

    public Optional<HostRecord> getLine(long id) {
        return fetchRecord(Capability.GET_LINE, id);
    }

    /**
     * Lists the ids of all entities of a kind.
     *
     * @param kind The entity kind.
     * @return The ids in host order without duplicates; empty if no candidate produced any.
     */
    public List<Long> enumerate(EntityKind kind) {
        Capability capability = enumerationCapability(kind);
        for (ProbeCandidate candidate : capabilities.candidates(capability)) {
            Optional<Object> result = call(candidate.function(), candidate.arguments());
            if (result.isPresent()) {
                List<Long> ids = extractIds(result.get());
                if (!ids.isEmpty()) {
                    return ids;
                }
            }
        }
        return List.of();
    }

    /**
     * Fetches a component facet of an entity.
     *
     * @param id   The entity id.
     * @param kind The component kind, resolved through the host's component type table.
     * @return The component record, or empty if absent or unsupported.
     */
    public Optional<HostRecord> getComponent(long id, ComponentKind kind) {
        Object componentType = capabilities.componentType(kind.name());
        if (componentType == null) {
            return Optional.empty();
        }
        for (ProbeCandidate candidate : capabilities.candidates(Capability.GET_COMPONENT)) {
            Optional<HostRecord> record = call(candidate.function(), candidate.arguments(id, componentType))
                    .flatMap(HostRecord::of);
            if (record.isPresent()) {
                return record;
            }
        }
        return Optional.empty();
    }

    /**
     * Lists the ids of entities of a kind inside a region.
     *
     * @param bounds The query region.
     * @param kind   The entity kind used as the query filter.
     * @return The ids found, empty if the region query is unsupported.
     */
    public List<Long> enumerateRegion(RegionBounds bounds, EntityKind kind) {
        Map<String, Object> filter = Map.of("type", kind.regionFilterType(), "includeData", false);
        for (ProbeCandidate candidate : capabilities.candidates(Capability.ENUMERATE_REGION)) {
            Optional<Object> result = call(candidate.function(), candidate.arguments(bounds.toHostArgument(), filter));
            if (result.isPresent()) {
                List<Long> ids = extractIds(result.get());
                if (!ids.isEmpty()) {
                    return ids;
                }
            }
        }
        return List.of();
    }

    /**
     * Returns the host's game time value, passed through opaquely.
     */
    public Optional<Object> gameTime() {
        for (ProbeCandidate candidate : capabilities.candidates(Capability.GAME_TIME)) {
            Optional<Object> result = call(candidate.function(), candidate.arguments());
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    private Optional<HostRecord> fetchRecord(Capability capability, long id) {
        if (id <= 0) {
            return Optional.empty();
        }
        for (ProbeCandidate candidate : capabilities.candidates(capability)) {
            Optional<HostRecord> record = call(candidate.function(), candidate.arguments(id))
                    .flatMap(HostRecord::of)
                    .filter(r -> !r.raw().isEmpty());
            if (record.isPresent()) {
                return record;
            }
        }
        return Optional.empty();
    }

    private Optional<Object> call(String function, Object[] args) {
        try {
            return Optional.ofNullable(invoke(function, args));
        } catch (HostCallException e) {
            log.debug("{}", e.getMessage());
            return Optional.empty();
        }
    }

    private Object invoke(String function, Object[] args) throws HostCallException {
        try {
            return host.invoke(function, args);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            // a host of another version can fail with linkage errors as well
            throw new HostCallException(function, e);
        }
    }

    private static Capability enumerationCapability(EntityKind kind) {
        return switch (kind) {
            case VEHICLE -> Capability.ENUMERATE_VEHICLES;
            case LINE -> Capability.ENUMERATE_LINES;
            case STATION -> Capability.ENUMERATE_STATIONS;
            case STATION_GROUP -> Capability.ENUMERATE_STATION_GROUPS;
            case SIGNAL -> Capability.ENUMERATE_SIGNALS;
            case EDGE -> Capability.ENUMERATE_EDGES;
        };
    }

    /**
     * Reads entity ids from an enumeration result. Sequences contribute their elements;
     * keyed results contribute their integer keys, or their values when the keys are not
     * ids.
     */
    static List<Long> extractIds(Object result) {
        Set<Long> ids = new LinkedHashSet<>();
        List<Object> sequence = HostValues.asList(result);
        if (!sequence.isEmpty()) {
            addIds(ids, sequence);
        } else if (result instanceof Map<?, ?> map) {
            List<Object> values = new ArrayList<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                OptionalLong key = HostValues.integerKey(entry.getKey());
                if (key.isPresent() && key.getAsLong() > 0) {
                    ids.add(key.getAsLong());
                } else {
                    values.add(entry.getValue());
                }
            }
            if (ids.isEmpty()) {
                addIds(ids, values);
            }
        }
        return List.copyOf(ids);
    }

    private static void addIds(Set<Long> ids, Collection<Object> values) {
        for (Object value : values) {
            long id = HostValues.toEntityId(value);
            if (id > 0) {
                ids.add(id);
            }
        }
    }
}

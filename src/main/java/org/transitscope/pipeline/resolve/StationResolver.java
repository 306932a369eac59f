package org.transitscope.pipeline.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitscope.host.EntityAccessor;
import org.transitscope.host.EntityKind;
import org.transitscope.host.HostRecord;
import org.transitscope.host.HostValues;
import org.transitscope.pipeline.geometry.PositionReader;
import org.transitscope.pipeline.model.Point;
import org.transitscope.pipeline.model.Station;

import java.util.List;
import java.util.Optional;

/**
 * Builds the per-cycle {@link StationCatalog} and maps indirect ids (terminals, station
 * groups) to canonical stations.
 * <p>
 * The field lists below reflect how the host names its references and are tried in
 * exactly this order; the first match wins.
 */
public class StationResolver {

    private static final Logger log = LoggerFactory.getLogger(StationResolver.class);

    /** Fields of a station entity that list its sub-entities (terminals and the like). */
    static final List<String> SUB_ENTITY_FIELDS =
            List.of("terminals", "components", "platforms", "nodes", "stops", "tracks");

    /** Fields of an arbitrary entity that may reference its owning station. */
    static final List<String> OWNER_FIELDS =
            List.of("station", "stationGroup", "stationEntity", "owner", "parent", "group");

    /** Fields of a station group entity that list its member stations. */
    static final List<String> GROUP_MEMBER_FIELDS = List.of("stations", "members", "stationList");

    private final EntityAccessor accessor;
    private final NameResolver names;

    public StationResolver(EntityAccessor accessor, NameResolver names) {
        this.accessor = accessor;
        this.names = names;
    }

    /**
     * Enumerates stations and station groups and builds a fresh catalog.
     *
     * @return The catalog for this cycle.
     */
    public StationCatalog build() {
        StationCatalog catalog = new StationCatalog();
        for (long id : accessor.enumerate(EntityKind.STATION)) {
            Optional<HostRecord> entity = accessor.getEntity(id);
            String name = entity.flatMap(names::nameOf).orElse("Station #" + id);
            Point position = entity.flatMap(PositionReader::entityPosition).orElse(Point.ORIGIN);
            boolean group = entity.map(e -> !e.list("stations").isEmpty()).orElse(false);
            catalog.addStation(new Station(id, name, position, group));
            entity.ifPresent(e -> registerSubEntities(catalog, id, e));
        }
        for (long groupId : accessor.enumerate(EntityKind.STATION_GROUP)) {
            accessor.getEntity(groupId).ifPresent(group -> registerGroup(catalog, groupId, group));
        }
        log.debug("Station catalog built with {} stations", catalog.size());
        return catalog;
    }

    private static void registerSubEntities(StationCatalog catalog, long stationId, HostRecord entity) {
        for (String field : SUB_ENTITY_FIELDS) {
            for (Object sub : entity.list(field)) {
                long subId = HostValues.toEntityId(sub);
                if (subId > 0) {
                    catalog.addTerminalAlias(subId, stationId);
                }
            }
        }
    }

    private static void registerGroup(StationCatalog catalog, long groupId, HostRecord group) {
        for (String field : GROUP_MEMBER_FIELDS) {
            for (Object member : group.list(field)) {
                long memberId = HostValues.toEntityId(member);
                if (catalog.isStation(memberId)) {
                    catalog.addGroupAlias(groupId, memberId);
                    return;
                }
            }
        }
    }

    /**
     * Maps an id to its canonical station id.
     * <p>
     * Known stations map to themselves, then group aliases and terminal aliases are
     * consulted. Failing that, the entity is fetched once and its owner references are
     * looked up through the same three maps; a hit is cached as a terminal alias. Ids that
     * cannot be resolved, and ids {@code <= 0}, are returned unchanged. The function never
     * recurses and is idempotent.
     *
     * @param catalog The catalog of the current cycle.
     * @param id      The id to resolve.
     * @return The canonical station id, or {@code id} itself.
     */
    public long resolveToStationId(StationCatalog catalog, long id) {
        if (id <= 0) {
            return id;
        }
        Optional<Long> known = lookup(catalog, id);
        if (known.isPresent()) {
            return known.get();
        }
        Optional<HostRecord> entity = accessor.getEntity(id);
        if (entity.isPresent()) {
            for (String field : OWNER_FIELDS) {
                long referenced = HostValues.toEntityId(entity.get().get(field));
                if (referenced <= 0) {
                    continue;
                }
                Optional<Long> owner = lookup(catalog, referenced);
                if (owner.isPresent()) {
                    catalog.addTerminalAlias(id, owner.get());
                    return owner.get();
                }
            }
        }
        return id;
    }

    private static Optional<Long> lookup(StationCatalog catalog, long id) {
        if (catalog.isStation(id)) {
            return Optional.of(id);
        }
        Optional<Long> group = catalog.groupAlias(id);
        if (group.isPresent()) {
            return group;
        }
        return catalog.terminalAlias(id);
    }
}

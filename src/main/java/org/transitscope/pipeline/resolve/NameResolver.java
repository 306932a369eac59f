package org.transitscope.pipeline.resolve;

import org.transitscope.host.EntityAccessor;
import org.transitscope.host.HostRecord;

import java.util.List;
import java.util.Optional;

/**
 * Finds display names for entities and stop records.
 * <p>
 * Explicit name fields are tried first, in their fixed order; then a bounded depth-first
 * search looks for the same fields in nested records. Placeholder names are rejected at
 * every step.
 */
public class NameResolver {

    /** Name fields of station and terminal entities, in priority order. */
    public static final List<String> ENTITY_NAME_FIELDS = List.of("name", "stationName", "terminalName");

    /** Name fields of the stop records inside a line, in priority order. */
    public static final List<String> STOP_NAME_FIELDS =
            List.of("name", "stopName", "stationName", "terminalName", "label");

    public static final int DEFAULT_SEARCH_DEPTH = 4;

    private final EntityAccessor accessor;
    private final BoundedGraphSearch deepSearch;

    public NameResolver(EntityAccessor accessor) {
        this(accessor, DEFAULT_SEARCH_DEPTH);
    }

    public NameResolver(EntityAccessor accessor, int searchDepth) {
        this.accessor = accessor;
        this.deepSearch = new BoundedGraphSearch(searchDepth, ENTITY_NAME_FIELDS, false);
    }

    /**
     * Returns the first real name among the given fields of a record.
     */
    public static Optional<String> explicitName(HostRecord record, List<String> fields) {
        for (String field : fields) {
            Object candidate = record.get(field);
            if (PlaceholderNames.isRealName(candidate)) {
                return Optional.of((String) candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the name of an entity record: explicit fields, then the bounded deep search.
     */
    public Optional<String> nameOf(HostRecord entity) {
        Optional<String> explicit = explicitName(entity, ENTITY_NAME_FIELDS);
        if (explicit.isPresent()) {
            return explicit;
        }
        return deepSearch.find(entity.raw(),
                value -> PlaceholderNames.isRealName(value) ? Optional.of((String) value) : Optional.empty());
    }

    /**
     * Fetches an entity and resolves its name.
     *
     * @param id The entity id.
     * @return The name, or empty if the entity is unknown or only has placeholder names.
     */
    public Optional<String> entityName(long id) {
        if (id <= 0) {
            return Optional.empty();
        }
        return accessor.getEntity(id).flatMap(this::nameOf);
    }

    /**
     * Returns the explicit name carried by a raw stop value, if it is a record.
     */
    public Optional<String> stopName(Object rawStop) {
        return HostRecord.of(rawStop).flatMap(stop -> explicitName(stop, STOP_NAME_FIELDS));
    }
}

package org.transitscope.host;

/**
 * Component facets fetched separately from an entity's main record. The enum constant
 * name is the key looked up in the host's {@code api.type.ComponentType} table.
 */
public enum ComponentKind {
    BASE_EDGE,
    TRACK_EDGE,
    STREET_EDGE,
    BASE_NODE,
    SIGNAL
}

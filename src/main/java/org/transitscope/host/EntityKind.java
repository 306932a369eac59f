package org.transitscope.host;

/**
 * Kinds of host entities that the pipeline enumerates.
 */
public enum EntityKind {
    VEHICLE("VEHICLE"),
    LINE("LINE"),
    STATION("STATION"),
    STATION_GROUP("STATION_GROUP"),
    SIGNAL("SIGNAL"),
    EDGE("BASE_EDGE");

    private final String regionFilterType;

    EntityKind(String regionFilterType) {
        this.regionFilterType = regionFilterType;
    }

    /**
     * Returns the type name the host expects in a region query filter.
     *
     * @return The host-side type name.
     */
    public String regionFilterType() {
        return regionFilterType;
    }
}

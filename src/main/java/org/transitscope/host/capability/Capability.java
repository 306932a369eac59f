package org.transitscope.host.capability;

/**
 * Operations the accessor needs from the host. Each capability is backed by an ordered
 * list of candidate host calls in the {@link CapabilityTable}.
 */
public enum Capability {
    GET_ENTITY,
    GET_VEHICLE,
    GET_LINE,
    GET_COMPONENT,
    ENUMERATE_VEHICLES,
    ENUMERATE_LINES,
    ENUMERATE_STATIONS,
    ENUMERATE_STATION_GROUPS,
    ENUMERATE_SIGNALS,
    ENUMERATE_EDGES,
    ENUMERATE_REGION,
    GAME_TIME
}

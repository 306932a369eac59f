package org.transitscope.host;

/**
 * Names of the host functions and constant tables the accessor knows how to use.
 */
public final class HostFunctions {

    public static final String GI_GET_ENTITY = "game.interface.getEntity";
    public static final String GI_GET_ENTITIES = "game.interface.getEntities";
    public static final String GI_GET_ENTITY_LIST = "game.interface.getEntityList";
    public static final String GI_GET_VEHICLES = "game.interface.getVehicles";
    public static final String GI_GET_VEHICLE = "game.interface.getVehicle";
    public static final String GI_GET_LINES = "game.interface.getLines";
    public static final String GI_GET_LINE = "game.interface.getLine";
    public static final String GI_GET_STATIONS = "game.interface.getStations";
    public static final String GI_GET_STATION_GROUPS = "game.interface.getStationGroups";
    public static final String GI_GET_GAME_TIME = "game.interface.getGameTime";

    public static final String ENGINE_GET_ENTITY_LIST = "api.engine.getEntityList";
    public static final String ENGINE_GET_COMPONENT = "api.engine.getComponent";
    public static final String ENGINE_GET_GAME_TIME = "api.engine.getGameTime";

    public static final String ENTITY_TYPES = "api.type.EntityType";
    public static final String COMPONENT_TYPES = "api.type.ComponentType";

    private HostFunctions() {
        // constants only
    }
}

package org.transitscope.pipeline.model;

/**
 * A canonical station.
 *
 * @param id       The station entity id.
 * @param name     The display name, never blank.
 * @param position The station position.
 * @param isGroup  Whether the host entity aggregates other stations.
 */
public record Station(long id, String name, Point position, boolean isGroup) {
}

package org.transitscope.pipeline.model;

/**
 * Kind tag of a track edge.
 */
public enum TrackKind {
    RAIL("rail"),
    TRAM("tram"),
    OTHER("other");

    private final String wireName;

    TrackKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

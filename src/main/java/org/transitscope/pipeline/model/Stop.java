package org.transitscope.pipeline.model;

/**
 * One stop of a line.
 *
 * @param index     1-based position in the line's stop list.
 * @param stationId The resolved station id, or the raw id if it could not be resolved.
 * @param rawStopId The id as reported by the host.
 * @param name      The display name.
 */
public record Stop(int index, long stationId, long rawStopId, String name) {

    /**
     * Returns the id to publish for this stop: the station id when known, else the raw id.
     */
    public long effectiveId() {
        return stationId != 0 ? stationId : rawStopId;
    }
}

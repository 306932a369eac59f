package org.transitscope.runtime;

/**
 * Decides when host callbacks should trigger a snapshot cycle.
 * <p>
 * Frame deltas and events advance one shared counter. A tick fires once the counter has
 * moved at least {@code writeInterval} past the last tick that fired; an event adds one
 * {@code eventUnit} and fires at most once per unit.
 */
public final class TickAccumulator {

    private final double writeInterval;
    private final double eventUnit;
    private double accumulated;
    private double lastTick;
    private double lastEvent;

    public TickAccumulator(double writeInterval, double eventUnit) {
        if (writeInterval <= 0 || eventUnit <= 0) {
            throw new IllegalArgumentException("writeInterval and eventUnit must be positive");
        }
        this.writeInterval = writeInterval;
        this.eventUnit = eventUnit;
    }

    /**
     * Advances the counter by a frame delta.
     *
     * @param dt The elapsed time in seconds. Negative or non-finite values are ignored.
     * @return {@code true} if a cycle is due.
     */
    public boolean onTick(double dt) {
        if (Double.isFinite(dt) && dt > 0) {
            accumulated += dt;
        }
        if (accumulated - lastTick >= writeInterval) {
            lastTick = accumulated;
            return true;
        }
        return false;
    }

    /**
     * Advances the counter by one event unit.
     *
     * @return {@code true} if a cycle is due.
     */
    public boolean onEvent() {
        accumulated += eventUnit;
        if (accumulated - lastEvent >= eventUnit) {
            lastEvent = accumulated;
            return true;
        }
        return false;
    }

    public double accumulated() {
        return accumulated;
    }
}

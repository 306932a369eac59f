package org.transitscope.pipeline.model;

/**
 * Normalized signal aspect.
 */
public enum SignalState {
    STOP(0),
    PROCEED(1),
    UNKNOWN(-1);

    private final int code;

    SignalState(int code) {
        this.code = code;
    }

    /**
     * Returns the numeric code written to the snapshot document.
     */
    public int code() {
        return code;
    }

    /**
     * Normalizes a raw host state: positive values mean proceed, anything else stop.
     */
    public static SignalState fromHostValue(long raw) {
        return raw > 0 ? PROCEED : STOP;
    }
}

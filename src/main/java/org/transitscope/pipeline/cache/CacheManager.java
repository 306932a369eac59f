package org.transitscope.pipeline.cache;

import org.transitscope.pipeline.model.Signal;
import org.transitscope.pipeline.model.TrackEdge;

import java.util.List;

/**
 * Owns the two independently aged caches: track geometry and signal state.
 */
public class CacheManager {

    public static final int DEFAULT_TRACK_REFRESH_CYCLES = 30;
    public static final int DEFAULT_SIGNAL_REFRESH_CYCLES = 10;

    private final AgedCache<TrackEdge> tracks;
    private final AgedCache<Signal> signals;
    private final TrackCollector trackCollector;
    private final SignalCollector signalCollector;

    public CacheManager(TrackCollector trackCollector, SignalCollector signalCollector,
                        int trackRefreshCycles, int signalRefreshCycles) {
        this.trackCollector = trackCollector;
        this.signalCollector = signalCollector;
        this.tracks = new AgedCache<>("track", trackRefreshCycles);
        this.signals = new AgedCache<>("signal", signalRefreshCycles);
    }

    /**
     * Advances both caches by one cycle, reloading whichever is due.
     *
     * @return The outcome per cache.
     */
    public Refresh refresh() {
        RefreshOutcome trackOutcome = tracks.advance(trackCollector::load);
        RefreshOutcome signalOutcome = signals.advance(signalCollector::load);
        return new Refresh(trackOutcome, signalOutcome);
    }

    public List<TrackEdge> tracks() {
        return tracks.contents();
    }

    public List<Signal> signals() {
        return signals.contents();
    }

    /**
     * Outcome of one {@link #refresh()}.
     */
    public record Refresh(RefreshOutcome tracks, RefreshOutcome signals) {

        public boolean anyFailed() {
            return tracks == RefreshOutcome.FAILED || signals == RefreshOutcome.FAILED;
        }
    }
}

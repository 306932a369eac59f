package org.transitscope.pipeline.orchestrator;

import org.transitscope.pipeline.cache.CacheManager;

/**
 * The state kept across snapshot cycles: the caches and the counters. Owned by one
 * {@link SnapshotOrchestrator}.
 */
public final class SnapshotContext {

    private final CacheManager caches;
    private long writeCount;
    private long cycles;
    private PipelineStage stage = PipelineStage.IDLE;

    public SnapshotContext(CacheManager caches) {
        this.caches = caches;
    }

    public CacheManager caches() {
        return caches;
    }

    /**
     * Returns the number of documents written so far, fallback documents included.
     */
    public long writeCount() {
        return writeCount;
    }

    public long cycles() {
        return cycles;
    }

    public PipelineStage stage() {
        return stage;
    }

    void enter(PipelineStage next) {
        this.stage = next;
    }

    long beginCycle() {
        return ++cycles;
    }

    void recordWrite() {
        writeCount++;
    }
}

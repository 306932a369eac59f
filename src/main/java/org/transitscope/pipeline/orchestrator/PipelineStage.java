package org.transitscope.pipeline.orchestrator;

/**
 * States of one snapshot cycle, in execution order. {@link #FALLBACK_WRITTEN} is reached
 * from any stage when a failure escapes the stage boundaries.
 */
public enum PipelineStage {
    IDLE,
    BUILDING_STATIONS,
    RESOLVING_LINES,
    COLLECTING_VEHICLES,
    ENRICHING,
    BUILDING_PATHS,
    REFRESHING_CACHES,
    COMPUTING_STATS,
    SERIALIZING,
    WRITTEN,
    FALLBACK_WRITTEN
}

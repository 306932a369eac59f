package org.transitscope.pipeline.orchestrator;

import java.util.List;

/**
 * Summary of one snapshot cycle.
 *
 * @param writeCount  The write counter carried by the written document, or the current
 *                    counter if nothing could be written.
 * @param finalStage  {@link PipelineStage#WRITTEN}, {@link PipelineStage#FALLBACK_WRITTEN},
 *                    or the stage reached when even the fallback could not be written.
 * @param stageErrors The stage failures absorbed during the cycle.
 * @param written     Whether a document was published.
 */
public record CycleOutcome(long writeCount, PipelineStage finalStage, List<StageError> stageErrors, boolean written) {

    public CycleOutcome {
        stageErrors = List.copyOf(stageErrors);
    }

    public boolean isFallback() {
        return finalStage == PipelineStage.FALLBACK_WRITTEN;
    }
}

package org.transitscope.pipeline.orchestrator;

/**
 * A failure of one pipeline stage.
 *
 * @param stage The stage that failed.
 * @param cause The exception thrown by the stage.
 */
public record StageError(PipelineStage stage, Throwable cause) {

    public String message() {
        String detail = cause.getMessage();
        return cause.getClass().getSimpleName() + (detail == null ? "" : ": " + detail);
    }
}

package org.transitscope.pipeline.orchestrator;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The output of a pipeline stage, or the {@link StageError} it failed with.
 *
 * @param <T> The stage's output type.
 */
public final class StageResult<T> {

    private final PipelineStage stage;
    private final T value;
    private final StageError error;

    private StageResult(PipelineStage stage, T value, StageError error) {
        this.stage = stage;
        this.value = value;
        this.error = error;
    }

    /**
     * Runs a stage body and captures any exception or error it throws, except a
     * {@link VirtualMachineError}.
     *
     * @param stage The stage being run.
     * @param body  The stage body.
     * @param <T>   The output type.
     * @return A successful result with the body's output, or a failed result.
     */
    public static <T> StageResult<T> attempt(PipelineStage stage, Supplier<T> body) {
        try {
            return new StageResult<>(stage, body.get(), null);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            return new StageResult<>(stage, null, new StageError(stage, e));
        }
    }

    public PipelineStage stage() {
        return stage;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<StageError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the stage output, or the stage default if the stage failed. A successful
     * {@code null} output also yields the default.
     *
     * @param fallback Produces the stage default.
     * @param onError  Notified of the failure before the default is produced.
     * @return The output or the default.
     */
    public T orDefault(Supplier<T> fallback, Consumer<StageError> onError) {
        if (error != null) {
            onError.accept(error);
            return fallback.get();
        }
        return value != null ? value : fallback.get();
    }
}

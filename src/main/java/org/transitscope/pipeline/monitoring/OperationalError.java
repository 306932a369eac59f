package org.transitscope.pipeline.monitoring;

import java.time.Instant;

/**
 * A failure that was absorbed by the pipeline instead of being propagated.
 *
 * @param timestamp When the error was recorded.
 * @param cycle     The snapshot cycle in which it happened.
 * @param errorType A category such as {@code STAGE_FAILED} or {@code CACHE_REFRESH_FAILED}.
 * @param message   A short description, usually naming the stage or cache.
 * @param details   The underlying exception message, or {@code null}.
 */
public record OperationalError(
    Instant timestamp,
    long cycle,
    String errorType,
    String message,
    String details
) {
}

package org.transitscope.pipeline.monitoring;

import java.util.List;
import java.util.Map;

/**
 * A pipeline component that exposes counters, recorded errors and a health flag.
 */
public interface IMonitorable {

    /**
     * Returns the component's counters keyed by snake_case metric name, e.g.
     * {@code cycles} or {@code stage_failures}.
     *
     * @return A snapshot of the current metric values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the most recent operational errors, oldest first. The list is bounded; older
     * errors are dropped once the bound is reached.
     *
     * @return The recorded errors.
     */
    List<OperationalError> getErrors();

    /**
     * Forgets all recorded errors.
     */
    void clearErrors();

    /**
     * Indicates whether the component is producing complete output.
     *
     * @return false while the component degrades its output.
     */
    boolean isHealthy();
}

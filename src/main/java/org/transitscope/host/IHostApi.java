package org.transitscope.host;

import java.util.Map;
import java.util.Set;

/**
 * The scripting surface exposed by the host simulation.
 * <p>
 * The host API is flat and dynamically shaped: which functions exist depends on the host
 * version and on the lifecycle phase the extraction code runs in. Values crossing this
 * boundary are plain Java values: {@code null}, {@link Boolean}, {@link Number},
 * {@link String}, {@link java.util.List} (sequences) and {@link Map} (records, whose keys
 * may be strings or integers).
 * <p>
 * Implementations are free to throw from {@link #invoke(String, Object...)}; callers must
 * never let such failures escape. {@link EntityAccessor} is the only class that talks to
 * this interface directly.
 */
public interface IHostApi {

    /**
     * Returns the names of all functions this host build exposes, e.g.
     * {@code game.interface.getEntity} or {@code api.engine.getEntityList}.
     *
     * @return The available function names, never {@code null}.
     */
    Set<String> functions();

    /**
     * Invokes a host function.
     *
     * @param function The fully qualified function name.
     * @param args     The call arguments.
     * @return The raw host result, possibly {@code null}.
     * @throws Exception if the host call fails for any reason.
     */
    Object invoke(String function, Object... args) throws Exception;

    /**
     * Returns a host constant table such as {@code api.type.EntityType}.
     *
     * @param table The fully qualified table name.
     * @return The table contents, or an empty map if the host does not provide it.
     */
    Map<String, Object> constants(String table);
}

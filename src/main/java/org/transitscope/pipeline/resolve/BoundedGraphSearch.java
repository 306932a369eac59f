package org.transitscope.pipeline.resolve;

import org.transitscope.host.HostValues;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Depth-first search over nested host values with an explicit depth bound and an identity
 * visited set, so reference cycles in host data cannot cause unbounded recursion.
 * <p>
 * At every record the preferred keys are examined first, in order, then all remaining
 * values. Scalars under a preferred key are offered to the matcher; scalars under other
 * keys or inside sequences are only offered when {@code matchAnyScalar} is set.
 */
public final class BoundedGraphSearch {

    private final int maxDepth;
    private final List<String> preferredKeys;
    private final boolean matchAnyScalar;

    /**
     * @param maxDepth       The deepest nesting level that is still visited (root is 0).
     * @param preferredKeys  Keys examined first at every record, in priority order.
     * @param matchAnyScalar Whether scalars outside preferred keys are offered to the matcher.
     */
    public BoundedGraphSearch(int maxDepth, List<String> preferredKeys, boolean matchAnyScalar) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.preferredKeys = List.copyOf(preferredKeys);
        this.matchAnyScalar = matchAnyScalar;
    }

    /**
     * Searches a value tree.
     *
     * @param root    The value to search; a scalar root is offered to the matcher directly.
     * @param matcher Maps a scalar to a result, or empty if it does not match.
     * @param <T>     The result type.
     * @return The first match in search order.
     */
    public <T> Optional<T> find(Object root, Function<Object, Optional<T>> matcher) {
        Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        return visit(root, 0, matcher, visited, true);
    }

    private <T> Optional<T> visit(Object value, int depth, Function<Object, Optional<T>> matcher,
                                  Set<Object> visited, boolean offerScalar) {
        if (depth > maxDepth || value == null) {
            return Optional.empty();
        }
        if (value instanceof Map<?, ?> map) {
            if (!visited.add(map)) {
                return Optional.empty();
            }
            for (String key : preferredKeys) {
                Optional<T> found = visit(map.get(key), isContainer(map.get(key)) ? depth + 1 : depth,
                        matcher, visited, true);
                if (found.isPresent()) {
                    return found;
                }
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (preferredKeys.contains(String.valueOf(entry.getKey()))) {
                    continue;
                }
                Optional<T> found = visit(entry.getValue(), depth + 1, matcher, visited, matchAnyScalar);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        if (value instanceof List<?> list) {
            if (!visited.add(list)) {
                return Optional.empty();
            }
            for (Object element : HostValues.asList(list)) {
                Optional<T> found = visit(element, depth + 1, matcher, visited, matchAnyScalar);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        return offerScalar ? matcher.apply(value) : Optional.empty();
    }

    private static boolean isContainer(Object value) {
        return value instanceof Map<?, ?> || value instanceof List<?>;
    }
}

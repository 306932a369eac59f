package org.transitscope.pipeline.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A list cache that is reloaded every {@code refreshInterval} cycles.
 * <p>
 * The cache starts empty and due. Each call to {@link #advance(Supplier)} is one cycle: the
 * age grows by one and, if the cache is due, the loader runs. A successful load replaces
 * the contents and resets the age. A failed load (an exception, or an empty result while
 * the cache holds data) keeps the previous contents and leaves the cache due, so the next
 * cycle retries. Readers always see the last good contents.
 * <p>
 * Not thread-safe; owned by a single orchestrator.
 *
 * @param <T> The element type.
 */
public class AgedCache<T> {

    private static final Logger log = LoggerFactory.getLogger(AgedCache.class);

    private final String name;
    private final int refreshInterval;
    private List<T> contents = List.of();
    private int age;
    private boolean loaded;
    private boolean lastRefreshFailed;
    private Throwable lastFailure;

    public AgedCache(String name, int refreshInterval) {
        if (refreshInterval < 1) {
            throw new IllegalArgumentException("refreshInterval must be at least 1 for cache " + name);
        }
        this.name = name;
        this.refreshInterval = refreshInterval;
    }

    /**
     * Runs one cycle of the cache.
     *
     * @param loader Produces fresh contents; may throw.
     * @return What happened during this cycle.
     */
    public RefreshOutcome advance(Supplier<List<T>> loader) {
        age++;
        if (!isDue()) {
            return RefreshOutcome.SKIPPED;
        }
        List<T> fresh;
        try {
            fresh = loader.get();
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            lastRefreshFailed = true;
            lastFailure = e;
            log.warn("Refresh of {} cache failed, keeping {} cached entries: {}", name, contents.size(), e.getMessage());
            return RefreshOutcome.FAILED;
        }
        if (fresh == null || (fresh.isEmpty() && !contents.isEmpty())) {
            lastRefreshFailed = true;
            lastFailure = null;
            log.info("Refresh of {} cache returned no data, keeping {} cached entries", name, contents.size());
            return RefreshOutcome.FAILED;
        }
        contents = List.copyOf(fresh);
        age = 0;
        loaded = true;
        lastRefreshFailed = false;
        lastFailure = null;
        log.debug("Refreshed {} cache with {} entries", name, contents.size());
        return RefreshOutcome.REFRESHED;
    }

    /**
     * Returns whether the cache wants a reload: never loaded, last refresh failed, or
     * older than the refresh interval.
     */
    public boolean isDue() {
        return !loaded || lastRefreshFailed || age >= refreshInterval;
    }

    public List<T> contents() {
        return contents;
    }

    public int age() {
        return age;
    }

    public String name() {
        return name;
    }

    /**
     * Returns the exception or error of the last failed refresh, if it failed by throwing.
     */
    public Optional<Throwable> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }
}

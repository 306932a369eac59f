package org.transitscope.pipeline.cache;

/**
 * Result of asking an {@link AgedCache} to refresh itself.
 */
public enum RefreshOutcome {
    /** The cache was not due; contents unchanged. */
    SKIPPED,
    /** The loader succeeded and replaced the contents. */
    REFRESHED,
    /** The loader failed; the previous contents were kept and the cache stays due. */
    FAILED
}

package com.questrail.matchsync.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every delay in the sync core.
 *
 * <h2>Binding invariant</h2>
 * Timeouts, debounce windows and inter-chunk pacing MUST use a monotonic time
 * source. Wall-clock time is reserved for record timestamps
 * ({@code synced_at}, {@code deleted_at}, {@code lastSyncAt}) and logging.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}

package com.questrail.matchsync.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a delayed task (chunk pacing, confirmation timeouts, debounces,
 * completion resets).
 *
 * <p>
 * Kept deliberately small so it can be backed by:
 * <ul>
 *   <li>a deterministic test scheduler</li>
 *   <li>a JVM {@code ScheduledExecutorService}</li>
 *   <li>a subscription that has nothing to do with timers (change feeds)</li>
 * </ul>
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}

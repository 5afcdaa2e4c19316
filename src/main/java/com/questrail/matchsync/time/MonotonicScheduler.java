package com.questrail.matchsync.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Delayed work for the sync paths: chunk pacing, the confirmation timeout, the
 * post-completion reset, upload and change debounces, and change-feed polling.
 *
 * <p>Deadlines are monotonic nanoseconds. Wall-clock instants are for record
 * timestamps only and never drive a timer.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} once, no earlier than {@code deadlineNanos} on the
     * caller's {@link MonotonicClock}.
     *
     * @return handle that stops the task if it has not started
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} once after {@code delay}; zero means as soon as possible.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}

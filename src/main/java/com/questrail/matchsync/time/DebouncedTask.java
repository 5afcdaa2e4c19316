package com.questrail.matchsync.time;

import java.time.Duration;
import java.util.Objects;

/**
 * DebouncedTask
 * =============================================================================
 * A delayed task that fires at most once per quiet window.
 *
 * <p>Each call to {@link #arm()} cancels the previously stored handle and
 * schedules a fresh one, so a burst of signals collapses into a single run
 * {@code delay} after the last signal. After {@link #close()} the task never
 * fires again and further {@code arm()} calls are ignored.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code arm}, {@code cancel} and {@code close} are synchronized; the task
 * body runs on whatever thread the scheduler uses.</p>
 */
public final class DebouncedTask implements AutoCloseable
{
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration delay;
    private final Runnable task;

    private Cancellable pending;
    private long generation;
    private boolean closed;

    public DebouncedTask(MonotonicScheduler scheduler, MonotonicClock clock, Duration delay, Runnable task) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.delay = Objects.requireNonNull(delay, "delay");
        this.task = Objects.requireNonNull(task, "task");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
    }

    /**
     * (Re)start the quiet window.
     */
    public synchronized void arm() {
        if (closed) {
            return;
        }
        if (pending != null) {
            pending.cancel();
        }
        long armedGeneration = ++generation;
        pending = scheduler.scheduleAfter(delay, clock, () -> fire(armedGeneration));
    }

    /**
     * Drop the pending run, if any. The task can be armed again afterwards.
     */
    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
        generation++;
    }

    public synchronized boolean isArmed() {
        return pending != null;
    }

    @Override
    public synchronized void close() {
        cancel();
        closed = true;
    }

    private void fire(long armedGeneration) {
        synchronized (this) {
            // A newer arm() superseded this run.
            if (closed || armedGeneration != generation) {
                return;
            }
            pending = null;
        }
        task.run();
    }
}

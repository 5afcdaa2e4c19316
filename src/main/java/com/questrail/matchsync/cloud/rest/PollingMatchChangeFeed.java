package com.questrail.matchsync.cloud.rest;

import com.questrail.matchsync.cloud.BackendException;
import com.questrail.matchsync.cloud.CloudMatchRow;
import com.questrail.matchsync.cloud.MatchChangeNotification;
import com.questrail.matchsync.time.Cancellable;
import com.questrail.matchsync.time.MonotonicClock;
import com.questrail.matchsync.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * PollingMatchChangeFeed
 * -----------------------------------------------------------------------------
 * Change feed on match rows, built by polling for rows whose
 * {@code synced_at} is newer than a cursor.
 *
 * <ul>
 *   <li>The cursor starts at subscription time; older rows are never reported.</li>
 *   <li>After each poll the cursor advances to the newest {@code synced_at} seen.</li>
 *   <li>A failed poll is logged and retried at the next interval.</li>
 *   <li>{@link #cancel()} stops polling; a poll already running finishes
 *       without notifying.</li>
 * </ul>
 */
public final class PollingMatchChangeFeed implements Cancellable
{
    private static final Logger log = LoggerFactory.getLogger(PollingMatchChangeFeed.class);

    private final Function<Instant, List<CloudMatchRow>> source;
    private final Consumer<MatchChangeNotification> listener;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration interval;

    private Instant cursor;
    private Cancellable pending;
    private boolean cancelled;

    public PollingMatchChangeFeed(Function<Instant, List<CloudMatchRow>> source,
                                  Consumer<MatchChangeNotification> listener,
                                  MonotonicScheduler scheduler,
                                  MonotonicClock clock,
                                  Duration interval,
                                  Instant startCursor)
    {
        this.source = Objects.requireNonNull(source, "source");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.cursor = Objects.requireNonNull(startCursor, "startCursor");
    }

    public synchronized void start() {
        if (!cancelled && pending == null) {
            scheduleNext();
        }
    }

    @Override
    public synchronized boolean cancel() {
        if (cancelled) {
            return false;
        }
        cancelled = true;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
        return true;
    }

    synchronized Instant cursor() {
        return cursor;
    }

    private void scheduleNext() {
        pending = scheduler.scheduleAfter(interval, clock, this::poll);
    }

    private void poll() {
        Instant since;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            since = cursor;
        }

        try {
            List<CloudMatchRow> rows = source.apply(since);
            Instant newest = since;
            for (CloudMatchRow row : rows) {
                if (row.syncedAt() != null && row.syncedAt().isAfter(newest)) {
                    newest = row.syncedAt();
                }
            }
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                cursor = newest;
            }
            for (CloudMatchRow row : rows) {
                notifyListener(new MatchChangeNotification(row.id(), row.ownerId(), row.deviceId()));
            }
        } catch (BackendException e) {
            log.warn("Match change poll failed: {}", e.getMessage());
        } finally {
            synchronized (this) {
                if (!cancelled) {
                    scheduleNext();
                }
            }
        }
    }

    private void notifyListener(MatchChangeNotification change) {
        try {
            listener.accept(change);
        } catch (RuntimeException e) {
            log.error("Match change listener failed for {}", change, e);
        }
    }
}

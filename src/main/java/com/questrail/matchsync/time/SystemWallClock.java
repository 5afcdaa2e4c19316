package com.questrail.matchsync.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p><strong>Not for delays.</strong> Debounce windows and timeouts go through
 * {@link MonotonicClock}.</p>
 */
public enum SystemWallClock implements WallClock
{
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}

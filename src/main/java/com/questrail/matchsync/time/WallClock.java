package com.questrail.matchsync.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for persisted timestamps, status messages and logging.
 */
public interface WallClock
{
    Instant now();
}

package com.questrail.matchsync.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the sync stack.
 */
public record SyncErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

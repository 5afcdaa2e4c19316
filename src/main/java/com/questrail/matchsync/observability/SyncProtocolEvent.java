package com.questrail.matchsync.observability;

import java.time.Instant;

/**
 * Record representing a protocol-level occurrence that does not change state:
 * a discarded message, an ignored command, a stale timer.
 *
 * @param operationId operation the occurrence relates to, or {@code null}
 */
public record SyncProtocolEvent(
    Instant timestamp,
    String operationId,
    String description
) {
}

package com.questrail.matchsync.observability;

import com.questrail.matchsync.peer.transport.ConnectionState;

import java.time.Instant;

/**
 * Record representing a peer transport state change.
 */
public record SyncTransportEvent(
    Instant timestamp,
    ConnectionState state
) {
}

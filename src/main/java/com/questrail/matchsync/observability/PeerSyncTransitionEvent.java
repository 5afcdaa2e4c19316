package com.questrail.matchsync.observability;

import com.questrail.matchsync.peer.sync.events.PeerSyncEvent;
import com.questrail.matchsync.peer.sync.state.PeerSyncIntents;
import com.questrail.matchsync.peer.sync.state.PeerSyncState;

import java.time.Instant;

/**
 * Record representing one reducer step of the peer sync engine.
 */
public record PeerSyncTransitionEvent(
    Instant timestamp,
    PeerSyncState oldState,
    PeerSyncState newState,
    PeerSyncEvent triggeringEvent,
    PeerSyncIntents resultingIntents
) {
    /**
     * Checks if the phase changed during this transition.
     */
    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }
}

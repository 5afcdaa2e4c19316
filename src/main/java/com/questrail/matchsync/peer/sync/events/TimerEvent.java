package com.questrail.matchsync.peer.sync.events;

import java.time.Instant;

/**
 * Expiry of a delay armed by the executor.
 */
public sealed interface TimerEvent extends PeerSyncEvent
        permits TimerEvent.ConfirmationTimedOut, TimerEvent.ResetElapsed
{
    /** The peer never answered our request. */
    final class ConfirmationTimedOut extends PeerSyncEvent.OperationBound implements TimerEvent {
        public ConfirmationTimedOut(Instant timestamp, String operationId) {
            super(timestamp, operationId);
        }
    }

    /** The completed operation has been visible long enough. */
    final class ResetElapsed extends PeerSyncEvent.OperationBound implements TimerEvent {
        public ResetElapsed(Instant timestamp, String operationId) {
            super(timestamp, operationId);
        }
    }
}

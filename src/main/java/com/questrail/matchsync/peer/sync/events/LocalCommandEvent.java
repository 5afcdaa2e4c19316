package com.questrail.matchsync.peer.sync.events;

import java.time.Instant;

/**
 * Commands issued by the local user.
 */
public sealed interface LocalCommandEvent extends PeerSyncEvent
        permits LocalCommandEvent.PullRequested,
                LocalCommandEvent.PushRequested,
                LocalCommandEvent.PendingConfirmed,
                LocalCommandEvent.PendingRejected,
                LocalCommandEvent.CancelRequested
{
    /** Ask the peer to send us its snapshot. */
    final class PullRequested extends PeerSyncEvent.OperationBound implements LocalCommandEvent {
        public PullRequested(Instant timestamp, String operationId) {
            super(timestamp, operationId);
        }
    }

    /** Offer our snapshot to the peer. */
    final class PushRequested extends PeerSyncEvent.OperationBound implements LocalCommandEvent {
        public PushRequested(Instant timestamp, String operationId) {
            super(timestamp, operationId);
        }
    }

    /** Accept the request waiting for our decision. */
    final class PendingConfirmed extends PeerSyncEvent.Base implements LocalCommandEvent {
        public PendingConfirmed(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Decline the request waiting for our decision. */
    final class PendingRejected extends PeerSyncEvent.Base implements LocalCommandEvent {
        private final String reason;

        public PendingRejected(Instant timestamp, String reason) {
            super(timestamp);
            this.reason = reason != null ? reason : "Request declined";
        }

        public String reason() {
            return reason;
        }
    }

    /** Abandon the current operation. */
    final class CancelRequested extends PeerSyncEvent.Base implements LocalCommandEvent {
        public CancelRequested(Instant timestamp) {
            super(timestamp);
        }
    }
}

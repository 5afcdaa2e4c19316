package com.questrail.matchsync.peer.sync.events;

import java.time.Instant;

/**
 * Transport lifecycle changes relevant to an operation in flight.
 */
public sealed interface PeerLinkEvent extends PeerSyncEvent
        permits PeerLinkEvent.PeerDisconnected
{
    /** A channel to the peer closed or the transport failed. */
    final class PeerDisconnected extends PeerSyncEvent.Base implements PeerLinkEvent {
        public PeerDisconnected(Instant timestamp) {
            super(timestamp);
        }
    }
}

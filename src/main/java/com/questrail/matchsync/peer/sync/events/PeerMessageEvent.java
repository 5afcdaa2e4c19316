package com.questrail.matchsync.peer.sync.events;

import com.questrail.matchsync.peer.protocol.SyncMessage;

import java.time.Instant;
import java.util.Objects;

/**
 * A decoded protocol message arrived from the peer.
 *
 * <p>Decoding happens before this event exists: malformed text never reaches
 * the reducer.</p>
 */
public sealed interface PeerMessageEvent extends PeerSyncEvent
        permits PeerMessageEvent.MessageReceived
{
    final class MessageReceived extends PeerSyncEvent.Base implements PeerMessageEvent
    {
        private final SyncMessage message;

        public MessageReceived(Instant timestamp, SyncMessage message) {
            super(timestamp);
            this.message = Objects.requireNonNull(message, "message");
        }

        public SyncMessage message() {
            return message;
        }

        @Override
        public String toString() {
            return "MessageReceived[" + message.type() + ", " + message.operationId() + "]";
        }
    }
}

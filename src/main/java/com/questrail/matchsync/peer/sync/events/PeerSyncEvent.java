package com.questrail.matchsync.peer.sync.events;

import java.time.Instant;
import java.util.Objects;

/**
 * PeerSyncEvent
 * -----------------------------------------------------------------------------
 * Marker interface for everything the peer sync state machine reacts to.
 *
 * <h2>Role in the architecture</h2>
 * Events are the <em>only</em> way information enters the sync engine:
 * <ul>
 *   <li>local user commands (pull, push, confirm, reject, cancel)</li>
 *   <li>decoded protocol messages from the peer</li>
 *   <li>transport lifecycle changes</li>
 *   <li>outcomes of effects the engine asked for (chunks sent, merge done)</li>
 *   <li>timer expiry</li>
 * </ul>
 *
 * Events are immutable and carry only what is needed to advance state. The
 * timestamp is wall-clock time and is used for duration messages and tracing,
 * never for scheduling.
 */
public interface PeerSyncEvent
{
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements PeerSyncEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName();
        }
    }

    /**
     * Base class for events bound to one operation.
     */
    abstract class OperationBound extends Base {
        private final String operationId;

        protected OperationBound(Instant timestamp, String operationId) {
            super(timestamp);
            this.operationId = Objects.requireNonNull(operationId, "operationId");
        }

        public String operationId() {
            return operationId;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "[" + operationId + "]";
        }
    }
}

package com.questrail.matchsync.peer.transport;

import java.util.Objects;

/**
 * Typed connection failure. Always recoverable by retrying the handshake.
 */
public final class PeerTransportException extends RuntimeException
{
    public enum Kind {
        /** The local endpoint did not open in time. */
        INIT_TIMEOUT,

        /** The local endpoint could not be opened at all. */
        INIT_FAILED,

        /** No free connection code was found. */
        CODE_COLLISION,

        /** The code does not resolve to a live host, or the host refused. */
        PEER_UNAVAILABLE,

        /** Connecting to the host did not complete in time. */
        TIMEOUT,

        /** The channel closed unexpectedly. */
        CHANNEL_CLOSED,

        /** An operation needed an open channel and there was none. */
        NOT_CONNECTED
    }

    private final Kind kind;

    public PeerTransportException(Kind kind, String message) {
        this(kind, message, null);
    }

    public PeerTransportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }
}

package com.questrail.matchsync.peer.protocol;

/**
 * Message types of the peer sync protocol. The enum name is the wire value.
 */
public enum SyncMessageType
{
    /** Pull: ask the peer for its snapshot. */
    REQUEST_DATA,
    /** Pull: the peer agreed and is about to send. */
    REQUEST_CONFIRM,
    /** Pull: the peer declined (payload: reason). */
    REQUEST_REJECT,

    /** Push: offer our snapshot to the peer. */
    SEND_DATA_REQUEST,
    /** Push: the peer agreed to receive. */
    SEND_DATA_CONFIRM,
    /** Push: the peer declined (payload: reason). */
    SEND_DATA_REJECT,

    /** Whole snapshot in one message (payload: snapshot object). */
    DATA,
    /** One fragment of a serialized snapshot (payload: text). */
    CHUNK,

    /** The operation failed on the sender's side (payload: reason). */
    ERROR,
    /** Diagnostic text; logged, never changes state. */
    INFO,
    /** The sender abandoned the operation. */
    CANCEL;

    /**
     * Types that open a new operation on the receiving side.
     */
    public boolean isRequest() {
        return this == REQUEST_DATA || this == SEND_DATA_REQUEST;
    }

    /**
     * The reject answering this request type.
     */
    public SyncMessageType rejection() {
        return switch (this) {
            case REQUEST_DATA -> REQUEST_REJECT;
            case SEND_DATA_REQUEST -> SEND_DATA_REJECT;
            default -> throw new IllegalStateException(this + " is not a request");
        };
    }

    /**
     * The confirm answering this request type.
     */
    public SyncMessageType confirmation() {
        return switch (this) {
            case REQUEST_DATA -> REQUEST_CONFIRM;
            case SEND_DATA_REQUEST -> SEND_DATA_CONFIRM;
            default -> throw new IllegalStateException(this + " is not a request");
        };
    }
}

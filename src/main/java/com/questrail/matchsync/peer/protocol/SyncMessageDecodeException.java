package com.questrail.matchsync.peer.protocol;

/**
 * Inbound text is not a well-formed sync message.
 */
public final class SyncMessageDecodeException extends RuntimeException
{
    public SyncMessageDecodeException(String message) {
        super(message);
    }

    public SyncMessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

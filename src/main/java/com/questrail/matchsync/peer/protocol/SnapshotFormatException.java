package com.questrail.matchsync.peer.protocol;

/**
 * Received data is not a valid snapshot. Local storage is never touched when
 * this is raised.
 */
public final class SnapshotFormatException extends RuntimeException
{
    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

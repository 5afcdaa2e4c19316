package com.questrail.matchsync.api;

import java.util.Objects;

/**
 * Read-only progress projection of a peer sync operation. Never persisted.
 *
 * @param percent 0..100
 * @param status  coarse phase shown to the user
 * @param message human-readable detail
 */
public record SyncProgress(int percent, Status status, String message)
{
    public enum Status {
        IDLE,
        PREPARING,
        PENDING_CONFIRMATION,
        SENDING,
        RECEIVING,
        PROCESSING,
        COMPLETE,
        ERROR
    }

    public SyncProgress {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("percent must be within 0..100: " + percent);
        }
    }

    public static SyncProgress idle() {
        return new SyncProgress(0, Status.IDLE, "");
    }

    public static SyncProgress error(String message) {
        return new SyncProgress(0, Status.ERROR, message);
    }
}

package com.questrail.matchsync.cloud;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Current condition of the backend sync service, broadcast on every change.
 *
 * @param status     coarse phase
 * @param percent    0..100
 * @param message    human-readable detail
 * @param error      failure detail when {@code status} is {@code ERROR}, or the
 *                   partial-failure summary of a {@code COMPLETE} operation
 * @param lastSyncAt completion time of the last successful operation, if any
 */
public record CloudSyncStatus(State status, int percent, String message, String error, Instant lastSyncAt)
{
    public enum State { IDLE, UPLOADING, DOWNLOADING, MERGING, COMPLETE, ERROR }

    public CloudSyncStatus {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("percent must be within 0..100: " + percent);
        }
    }

    public static CloudSyncStatus initial(Instant lastSyncAt) {
        return new CloudSyncStatus(State.IDLE, 0, "Ready to sync", null, lastSyncAt);
    }

    /**
     * Next status in an operation; {@code lastSyncAt} carries over and the error clears.
     */
    public CloudSyncStatus next(State newStatus, int newPercent, String newMessage) {
        return new CloudSyncStatus(newStatus, newPercent, newMessage, null, lastSyncAt);
    }

    public CloudSyncStatus completed(String newMessage, Instant completedAt) {
        return new CloudSyncStatus(State.COMPLETE, 100, newMessage, null, completedAt);
    }

    public CloudSyncStatus completedWithErrors(String newMessage, String newError, Instant completedAt) {
        return new CloudSyncStatus(State.COMPLETE, 100, newMessage, newError, completedAt);
    }

    public CloudSyncStatus failed(String newMessage, String newError) {
        return new CloudSyncStatus(State.ERROR, 0, newMessage, newError, lastSyncAt);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public Optional<Instant> lastSync() {
        return Optional.ofNullable(lastSyncAt);
    }
}

package com.questrail.matchsync.cloud;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one backend sync operation.
 *
 * @param recordsAdded   rows uploaded or records downloaded
 * @param recordsUpdated local records removed by tombstones (downloads only)
 * @param error          failure description, or {@code null} when every row went through;
 *                       set alongside {@code success} when only some rows failed
 */
public record SyncResult(boolean success, int recordsAdded, int recordsUpdated, String error)
{
    public static SyncResult success(int recordsAdded, int recordsUpdated) {
        return new SyncResult(true, recordsAdded, recordsUpdated, null);
    }

    /**
     * The operation completed but some rows were not written.
     */
    public static SyncResult partial(int recordsAdded, int recordsUpdated, String error) {
        return new SyncResult(true, recordsAdded, recordsUpdated, Objects.requireNonNull(error, "error"));
    }

    public static SyncResult failure(String error) {
        return new SyncResult(false, 0, 0, error);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}

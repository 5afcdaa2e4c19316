package com.questrail.matchsync.api;

import java.util.Optional;

/**
 * RecordStoreGateway
 * =============================================================================
 * Contract of the local record store as seen by both sync paths.
 *
 * <h2>Role in the architecture</h2>
 * The peer engine and the backend service never touch storage directly. They
 * obtain a {@link Snapshot} via {@link #exportAll()} and hand received data to
 * {@link #mergeData(Snapshot)}. The two paths converge only here.
 *
 * <h2>Atomicity</h2>
 * Every operation is atomic from the caller's point of view. Callers never
 * perform partial writes and never retry a merge that reported success.
 */
public interface RecordStoreGateway
{
    /**
     * Export every local record.
     */
    Snapshot exportAll();

    /**
     * Combine {@code snapshot} with local data according to {@code mode}.
     *
     * <p>{@link MergeMode#MERGE} is id-keyed add-if-absent: records whose id
     * already exists locally are left untouched, so merging the same snapshot
     * twice is a no-op the second time.</p>
     *
     * @return {@code true} if the store accepted the snapshot
     */
    boolean importMerge(Snapshot snapshot, MergeMode mode);

    /**
     * Entry point used by both sync paths. Same as
     * {@code importMerge(snapshot, MergeMode.MERGE)}.
     */
    default boolean mergeData(Snapshot snapshot) {
        return importMerge(snapshot, MergeMode.MERGE);
    }

    /**
     * Look up a match by id.
     */
    Optional<MatchRecord> getRecord(String matchId);

    /**
     * Remove a match and its dependent match players. Never triggers a
     * backend deletion.
     *
     * @return {@code true} if a match was removed
     */
    boolean deleteRecordCascade(String matchId);

    /**
     * Recompute per-player derived statistics from match history.
     */
    void recomputeDerivedStats();
}

package com.questrail.matchsync.cloud;

import com.questrail.matchsync.time.Cancellable;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * BackendClient
 * =============================================================================
 * Port for the hosted backend: a table store with per-account rows and a
 * change feed on match rows.
 *
 * <h2>Tables</h2>
 * <ul>
 *   <li>{@code cloud_players}, {@code cloud_matches}, {@code cloud_match_players}: record rows</li>
 *   <li>{@code deleted_matches}: tombstones</li>
 *   <li>{@code friends}: accepted friendships</li>
 *   <li>{@code profiles}: per-account metadata ({@code last_sync_at})</li>
 * </ul>
 *
 * Every method is blocking and throws {@link BackendException} on failure.
 * Upserts insert or overwrite by the table's natural key.
 */
public interface BackendClient
{
    void upsertPlayer(CloudPlayerRow row);

    void upsertMatch(CloudMatchRow row);

    void upsertMatchPlayer(CloudMatchPlayerRow row);

    List<CloudPlayerRow> selectPlayers(RowFilter filter);

    List<CloudMatchRow> selectMatches(RowFilter filter);

    List<CloudMatchPlayerRow> selectMatchPlayers(RowFilter filter);

    void deleteMatchPlayers(String ownerId, String matchId);

    void deleteMatch(String ownerId, String matchId);

    void upsertTombstone(TombstoneRow row);

    /**
     * Ids of every match tombstoned by {@code ownerId}.
     */
    List<String> selectTombstonedMatchIds(String ownerId);

    List<String> selectFriendIds(String userId);

    /**
     * Record the time of the user's last successful upload on their profile.
     */
    void touchLastSync(String userId, Instant at);

    /**
     * Receive a notification for every match row written from now on.
     *
     * @return handle that ends the subscription
     */
    Cancellable subscribeMatchChanges(Consumer<MatchChangeNotification> listener);
}

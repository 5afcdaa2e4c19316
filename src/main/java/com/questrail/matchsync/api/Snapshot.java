package com.questrail.matchsync.api;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot
 * =============================================================================
 * The unit of transfer: every player, match and match participation known to
 * one store, as produced by {@link RecordStoreGateway#exportAll()}.
 *
 * <p>Wire shape (JSON):</p>
 * <pre>
 *   { "players": [...], "matches": [...], "matchPlayers": [...],
 *     "exportDate": "2024-05-01T10:15:30Z", "version": "1.0" }
 * </pre>
 *
 * <p>Collections are ordered and keyed by record id. A {@code null} collection
 * is normalized to an empty list here; rejecting snapshots with missing
 * collections is the job of {@code SnapshotCodec}.</p>
 */
public record Snapshot(
        List<PlayerRecord> players,
        List<MatchRecord> matches,
        List<MatchPlayerRecord> matchPlayers,
        Instant exportDate,
        String version
) {
    public static final String CURRENT_VERSION = "1.0";

    public Snapshot {
        players = players == null ? List.of() : List.copyOf(players);
        matches = matches == null ? List.of() : List.copyOf(matches);
        matchPlayers = matchPlayers == null ? List.of() : List.copyOf(matchPlayers);
        version = version == null ? CURRENT_VERSION : version;
    }

    public static Snapshot of(List<PlayerRecord> players,
                              List<MatchRecord> matches,
                              List<MatchPlayerRecord> matchPlayers,
                              Instant exportDate) {
        return new Snapshot(players, matches, matchPlayers, exportDate, CURRENT_VERSION);
    }

    public static Snapshot empty(Instant exportDate) {
        return of(List.of(), List.of(), List.of(), exportDate);
    }

    public int recordCount() {
        return players.size() + matches.size() + matchPlayers.size();
    }
}

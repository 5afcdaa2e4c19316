package com.questrail.matchsync.cloud;

import com.questrail.matchsync.time.Cancellable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * FakeBackendClient
 * -----------------------------------------------------------------------------
 * In-memory {@link BackendClient} with the natural keys of the hosted tables.
 *
 * <ul>
 *   <li>Failure injection per table, per match id or per player id</li>
 *   <li>A hook that runs inside the first player upsert (re-entrancy tests)</li>
 *   <li>Change subscriptions captured so tests can publish notifications</li>
 * </ul>
 */
public final class FakeBackendClient implements BackendClient {

    private final Map<String, CloudPlayerRow> players = new LinkedHashMap<>();
    private final Map<String, CloudMatchRow> matches = new LinkedHashMap<>();
    private final Map<String, CloudMatchPlayerRow> matchPlayers = new LinkedHashMap<>();
    private final Map<String, TombstoneRow> tombstones = new LinkedHashMap<>();
    private final Map<String, Set<String>> friends = new HashMap<>();
    private final Map<String, Instant> lastSync = new HashMap<>();

    private final List<Consumer<MatchChangeNotification>> subscribers = new CopyOnWriteArrayList<>();

    private final Set<String> failingPlayerIds = new HashSet<>();
    private boolean failTombstoneReads;
    private boolean failTombstoneWrites;
    private boolean failDeletes;
    private boolean failTouch;
    private boolean failSelects;
    private Runnable onFirstPlayerUpsert;

    private int upsertCount;
    private int selectCount;

    // ---------------------------------------------------------------------
    // Test controls
    // ---------------------------------------------------------------------

    public synchronized void addFriend(String userId, String friendId) {
        friends.computeIfAbsent(userId, k -> new HashSet<>()).add(friendId);
    }

    public synchronized void failPlayerUpsert(String localId) {
        failingPlayerIds.add(localId);
    }

    public synchronized void failTombstoneReads() {
        failTombstoneReads = true;
    }

    public synchronized void failTombstoneWrites() {
        failTombstoneWrites = true;
    }

    public synchronized void failDeletes() {
        failDeletes = true;
    }

    public synchronized void failTouch() {
        failTouch = true;
    }

    public synchronized void failSelects() {
        failSelects = true;
    }

    public synchronized void onFirstPlayerUpsert(Runnable hook) {
        this.onFirstPlayerUpsert = hook;
    }

    public void publish(MatchChangeNotification notification) {
        for (Consumer<MatchChangeNotification> s : subscribers) {
            s.accept(notification);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public synchronized List<CloudPlayerRow> playerRows() {
        return new ArrayList<>(players.values());
    }

    public synchronized List<CloudMatchRow> matchRows() {
        return new ArrayList<>(matches.values());
    }

    public synchronized List<CloudMatchPlayerRow> matchPlayerRows() {
        return new ArrayList<>(matchPlayers.values());
    }

    public synchronized List<TombstoneRow> tombstoneRows() {
        return new ArrayList<>(tombstones.values());
    }

    public synchronized Instant lastSyncOf(String userId) {
        return lastSync.get(userId);
    }

    public synchronized int upsertCount() {
        return upsertCount;
    }

    public synchronized int selectCount() {
        return selectCount;
    }

    // ---------------------------------------------------------------------
    // BackendClient
    // ---------------------------------------------------------------------

    @Override
    public void upsertPlayer(CloudPlayerRow row) {
        Runnable hook;
        synchronized (this) {
            hook = onFirstPlayerUpsert;
            onFirstPlayerUpsert = null;
        }
        if (hook != null) {
            hook.run();
        }
        synchronized (this) {
            if (failingPlayerIds.contains(row.localId())) {
                throw new BackendException(500, "player upsert rejected: " + row.localId());
            }
            upsertCount++;
            players.put(key(row.ownerId(), row.localId()), row);
        }
    }

    @Override
    public synchronized void upsertMatch(CloudMatchRow row) {
        upsertCount++;
        matches.put(key(row.ownerId(), row.id()), row);
    }

    @Override
    public synchronized void upsertMatchPlayer(CloudMatchPlayerRow row) {
        upsertCount++;
        matchPlayers.put(key(row.ownerId(), row.id()), row);
    }

    @Override
    public synchronized List<CloudPlayerRow> selectPlayers(RowFilter filter) {
        checkSelect();
        return players.values().stream()
                .filter(r -> filter.matches(r.ownerId(), r.deviceId()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<CloudMatchRow> selectMatches(RowFilter filter) {
        checkSelect();
        return matches.values().stream()
                .filter(r -> filter.matches(r.ownerId(), r.deviceId()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<CloudMatchPlayerRow> selectMatchPlayers(RowFilter filter) {
        checkSelect();
        return matchPlayers.values().stream()
                .filter(r -> filter.matches(r.ownerId(), r.deviceId()))
                .collect(Collectors.toList());
    }

    private void checkSelect() {
        selectCount++;
        if (failSelects) {
            throw new BackendException(503, "backend unavailable");
        }
    }

    @Override
    public synchronized void deleteMatchPlayers(String ownerId, String matchId) {
        if (failDeletes) {
            throw new BackendException(500, "delete rejected");
        }
        matchPlayers.values().removeIf(r -> r.ownerId().equals(ownerId) && r.matchId().equals(matchId));
    }

    @Override
    public synchronized void deleteMatch(String ownerId, String matchId) {
        if (failDeletes) {
            throw new BackendException(500, "delete rejected");
        }
        matches.remove(key(ownerId, matchId));
    }

    @Override
    public synchronized void upsertTombstone(TombstoneRow row) {
        if (failTombstoneWrites) {
            throw new BackendException(500, "tombstone rejected");
        }
        tombstones.put(key(row.ownerId(), row.matchId()), row);
    }

    @Override
    public synchronized List<String> selectTombstonedMatchIds(String ownerId) {
        if (failTombstoneReads) {
            throw new BackendException(503, "tombstones unavailable");
        }
        return tombstones.values().stream()
                .filter(t -> t.ownerId().equals(ownerId))
                .map(TombstoneRow::matchId)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<String> selectFriendIds(String userId) {
        return new ArrayList<>(friends.getOrDefault(userId, Set.of()));
    }

    @Override
    public synchronized void touchLastSync(String userId, Instant at) {
        if (failTouch) {
            throw new BackendException(500, "profile update rejected");
        }
        lastSync.put(userId, at);
    }

    @Override
    public Cancellable subscribeMatchChanges(Consumer<MatchChangeNotification> listener) {
        subscribers.add(listener);
        return () -> subscribers.remove(listener);
    }

    private static String key(String ownerId, String id) {
        return ownerId + "/" + id;
    }
}

package com.questrail.matchsync.store;

import com.questrail.matchsync.api.DeviceIdentity;
import com.questrail.matchsync.api.MatchPlayerRecord;
import com.questrail.matchsync.api.MatchRecord;
import com.questrail.matchsync.api.MergeMode;
import com.questrail.matchsync.api.PlayerRecord;
import com.questrail.matchsync.api.RecordStoreGateway;
import com.questrail.matchsync.api.Snapshot;
import com.questrail.matchsync.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * InMemoryRecordStore
 * =============================================================================
 * Reference {@link RecordStoreGateway}: an id-keyed, insertion-ordered store of
 * players, matches and match players.
 *
 * <h2>Merge semantics</h2>
 * <ul>
 *   <li>Players are added if their id is unknown. New players start with zeroed
 *       stats and are stamped {@code imported_<local device>}.</li>
 *   <li>Matches are added if their id is unknown; a match carrying no device id
 *       is stamped {@code imported_<local device>}.</li>
 *   <li>Match players are stored only together with their newly added match.
 *       Rows whose player resolves neither locally nor in the snapshot are
 *       skipped.</li>
 *   <li>Derived stats are recomputed once at the end.</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * Every operation holds one store-level {@link ReentrantLock}, so a merge from
 * the peer path can never interleave with a merge or delete from the backend
 * path.
 */
public final class InMemoryRecordStore implements RecordStoreGateway
{
    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordStore.class);

    private final DeviceIdentity localDevice;
    private final WallClock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, PlayerRecord> players = new LinkedHashMap<>();
    private final Map<String, MatchRecord> matches = new LinkedHashMap<>();
    private final Map<String, MatchPlayerRecord> matchPlayers = new LinkedHashMap<>();

    public InMemoryRecordStore(DeviceIdentity localDevice, WallClock clock) {
        this.localDevice = Objects.requireNonNull(localDevice, "localDevice");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ---------------------------------------------------------------------
    // Local mutations (used by the application and by tests)
    // ---------------------------------------------------------------------

    public void savePlayer(PlayerRecord player) {
        Objects.requireNonNull(player, "player");
        lock.lock();
        try {
            players.put(player.id(), player);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store a match with its participants and refresh derived stats.
     */
    public void saveMatch(MatchRecord match, List<MatchPlayerRecord> participants) {
        Objects.requireNonNull(match, "match");
        Objects.requireNonNull(participants, "participants");
        lock.lock();
        try {
            matches.put(match.id(), match);
            for (MatchPlayerRecord mp : participants) {
                if (!mp.matchId().equals(match.id())) {
                    throw new IllegalArgumentException(
                            "match player " + mp.id() + " belongs to " + mp.matchId() + ", not " + match.id());
                }
                matchPlayers.put(mp.id(), mp);
            }
            recomputeDerivedStats();
        } finally {
            lock.unlock();
        }
    }

    public Optional<PlayerRecord> getPlayer(String playerId) {
        lock.lock();
        try {
            return Optional.ofNullable(players.get(playerId));
        } finally {
            lock.unlock();
        }
    }

    public List<MatchPlayerRecord> getMatchPlayers(String matchId) {
        lock.lock();
        try {
            List<MatchPlayerRecord> result = new ArrayList<>();
            for (MatchPlayerRecord mp : matchPlayers.values()) {
                if (mp.matchId().equals(matchId)) {
                    result.add(mp);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // RecordStoreGateway
    // ---------------------------------------------------------------------

    @Override
    public Snapshot exportAll() {
        lock.lock();
        try {
            return Snapshot.of(
                    new ArrayList<>(players.values()),
                    new ArrayList<>(matches.values()),
                    new ArrayList<>(matchPlayers.values()),
                    clock.now());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean importMerge(Snapshot snapshot, MergeMode mode) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(mode, "mode");

        lock.lock();
        try {
            switch (mode) {
                case REPLACE -> replaceWith(snapshot);
                case MERGE -> mergeWith(snapshot);
            }
            recomputeDerivedStats();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<MatchRecord> getRecord(String matchId) {
        Objects.requireNonNull(matchId, "matchId");
        lock.lock();
        try {
            return Optional.ofNullable(matches.get(matchId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean deleteRecordCascade(String matchId) {
        Objects.requireNonNull(matchId, "matchId");
        lock.lock();
        try {
            if (matches.remove(matchId) == null) {
                return false;
            }
            matchPlayers.values().removeIf(mp -> mp.matchId().equals(matchId));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recomputeDerivedStats() {
        lock.lock();
        try {
            Map<String, int[]> tallies = new HashMap<>();
            Map<String, Instant> lastPlayed = new HashMap<>();

            List<MatchRecord> ordered = new ArrayList<>(matches.values());
            ordered.sort(Comparator.comparing(MatchRecord::date));

            Map<String, List<MatchPlayerRecord>> byMatch = new HashMap<>();
            for (MatchPlayerRecord mp : matchPlayers.values()) {
                byMatch.computeIfAbsent(mp.matchId(), k -> new ArrayList<>()).add(mp);
            }

            for (MatchRecord match : ordered) {
                for (MatchPlayerRecord mp : byMatch.getOrDefault(match.id(), List.of())) {
                    // [games, wins, losses]
                    int[] t = tallies.computeIfAbsent(mp.playerId(), k -> new int[3]);
                    t[0]++;
                    if (mp.team() == match.winningTeam()) {
                        t[1]++;
                    } else {
                        t[2]++;
                    }
                    lastPlayed.put(mp.playerId(), match.date());
                }
            }

            for (Map.Entry<String, PlayerRecord> e : players.entrySet()) {
                PlayerRecord p = e.getValue();
                int[] t = tallies.getOrDefault(e.getKey(), new int[3]);
                Instant last = lastPlayed.getOrDefault(e.getKey(), p.lastPlayed());
                e.setValue(p.withStats(t[0], t[1], t[2], last));
            }
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void replaceWith(Snapshot snapshot) {
        players.clear();
        matches.clear();
        matchPlayers.clear();
        snapshot.players().forEach(p -> players.put(p.id(), p));
        snapshot.matches().forEach(m -> matches.put(m.id(), m));
        snapshot.matchPlayers().forEach(mp -> matchPlayers.put(mp.id(), mp));
    }

    private void mergeWith(Snapshot snapshot) {
        String imported = localDevice.importedMarker();
        Instant now = clock.now();

        for (PlayerRecord incoming : snapshot.players()) {
            if (players.containsKey(incoming.id())) {
                continue;
            }
            players.put(incoming.id(), new PlayerRecord(
                    incoming.id(),
                    incoming.name(),
                    0, 0, 0,
                    PlayerRecord.INITIAL_ELO,
                    null, null, null,
                    now,
                    now,
                    imported,
                    incoming.level() != null ? incoming.level() : 1));
        }

        Map<String, List<MatchPlayerRecord>> incomingByMatch = new HashMap<>();
        for (MatchPlayerRecord mp : snapshot.matchPlayers()) {
            incomingByMatch.computeIfAbsent(mp.matchId(), k -> new ArrayList<>()).add(mp);
        }

        for (MatchRecord incoming : snapshot.matches()) {
            if (matches.containsKey(incoming.id())) {
                continue;
            }
            matches.put(incoming.id(), incoming.deviceId() == null ? incoming.withDeviceId(imported) : incoming);

            for (MatchPlayerRecord mp : incomingByMatch.getOrDefault(incoming.id(), List.of())) {
                if (!players.containsKey(mp.playerId())) {
                    log.warn("Skipping match player {}: player {} is unknown", mp.id(), mp.playerId());
                    continue;
                }
                matchPlayers.put(mp.id(), mp.deviceId() == null ? mp.withDeviceId(imported) : mp);
            }
        }
    }
}

package com.questrail.matchsync.store;

import com.questrail.matchsync.api.DeviceIdentity;
import com.questrail.matchsync.api.MatchRecord;
import com.questrail.matchsync.api.MergeMode;
import com.questrail.matchsync.api.PlayerRecord;
import com.questrail.matchsync.api.Snapshot;
import com.questrail.matchsync.api.Team;
import com.questrail.matchsync.api.TestRecords;
import com.questrail.matchsync.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryRecordStoreTest
 * -----------------------------------------------------------------------------
 * Merge, cascade delete and derived statistics of the reference store.
 */
class InMemoryRecordStoreTest {

    private ManualWallClock clock;
    private InMemoryRecordStore store;

    @BeforeEach
    void setUp() {
        clock = new ManualWallClock(Instant.parse("2024-06-01T00:00:00Z"));
        store = new InMemoryRecordStore(DeviceIdentity.of("device_local"), clock);
    }

    @Test
    void mergingTheSameSnapshotTwiceIsANoOp() {
        Snapshot incoming = TestRecords.oneMatch("m-1", "device_remote");

        assertTrue(store.mergeData(incoming));
        Snapshot afterFirst = store.exportAll();

        clock.advance(Duration.ofHours(1));
        assertTrue(store.mergeData(incoming));
        Snapshot afterSecond = store.exportAll();

        assertEquals(afterFirst.players(), afterSecond.players());
        assertEquals(afterFirst.matches(), afterSecond.matches());
        assertEquals(afterFirst.matchPlayers(), afterSecond.matchPlayers());
    }

    @Test
    void mergeNeverOverwritesExistingRecords() {
        store.savePlayer(TestRecords.player("p-alice", "Alice (local)", "device_local"));

        store.mergeData(TestRecords.oneMatch("m-1", "device_remote"));

        assertEquals("Alice (local)", store.getPlayer("p-alice").orElseThrow().name());
    }

    @Test
    void mergedPlayersStartFreshAndAreStampedAsImported() {
        store.mergeData(TestRecords.oneMatch("m-1", "device_remote"));

        PlayerRecord bob = store.getPlayer("p-bob").orElseThrow();
        assertEquals("imported_device_local", bob.deviceId());
        assertEquals(PlayerRecord.INITIAL_ELO, bob.elo());
        // derived stats come from the merged match
        assertEquals(1, bob.totalGames());
        assertEquals(0, bob.wins());
        assertEquals(1, bob.losses());
    }

    @Test
    void matchesKeepTheirDeviceOrGetTheImportedMarker() {
        MatchRecord unstamped = TestRecords.match("m-2", TestRecords.T0, Team.ATLANTEANS, null);
        store.mergeData(Snapshot.of(List.of(), List.of(unstamped), List.of(), TestRecords.T0));
        store.mergeData(TestRecords.oneMatch("m-1", "device_remote"));

        assertEquals("imported_device_local", store.getRecord("m-2").orElseThrow().deviceId());
        assertEquals("device_remote", store.getRecord("m-1").orElseThrow().deviceId());
    }

    @Test
    void participantsOfUnknownPlayersAreSkipped() {
        Snapshot full = TestRecords.oneMatch("m-1", "device_remote");
        Snapshot withoutBob = Snapshot.of(List.of(full.players().get(0)), full.matches(), full.matchPlayers(),
                TestRecords.T0);

        store.mergeData(withoutBob);

        assertTrue(store.getRecord("m-1").isPresent());
        assertEquals(1, store.getMatchPlayers("m-1").size());
    }

    @Test
    void cascadeDeleteRemovesParticipantsAndReportsAbsence() {
        store.mergeData(TestRecords.oneMatch("m-1", "device_remote"));

        assertTrue(store.deleteRecordCascade("m-1"));
        assertTrue(store.getRecord("m-1").isEmpty());
        assertTrue(store.getMatchPlayers("m-1").isEmpty());

        assertFalse(store.deleteRecordCascade("m-1"));
    }

    @Test
    void recomputeReflectsDeletedMatches() {
        store.mergeData(TestRecords.oneMatch("m-1", "device_remote"));
        store.deleteRecordCascade("m-1");

        store.recomputeDerivedStats();

        assertEquals(0, store.getPlayer("p-alice").orElseThrow().totalGames());
    }

    @Test
    void replaceClearsLocalData() {
        store.savePlayer(TestRecords.player("p-local", "Local", "device_local"));

        store.importMerge(TestRecords.oneMatch("m-1", "device_remote"), MergeMode.REPLACE);

        assertTrue(store.getPlayer("p-local").isEmpty());
        assertEquals(5, store.exportAll().recordCount());
    }

    @Test
    void saveMatchRejectsForeignParticipants() {
        MatchRecord match = TestRecords.match("m-1", TestRecords.T0, Team.TITANS, "device_local");

        assertThrows(IllegalArgumentException.class, () -> store.saveMatch(match,
                List.of(TestRecords.participant("mp-x", "m-other", "p-alice", Team.TITANS, "device_local"))));
    }
}

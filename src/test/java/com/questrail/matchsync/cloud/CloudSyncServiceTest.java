package com.questrail.matchsync.cloud;

import com.questrail.matchsync.api.DeviceIdentity;
import com.questrail.matchsync.api.MatchPlayerRecord;
import com.questrail.matchsync.api.MatchRecord;
import com.questrail.matchsync.api.MergeMode;
import com.questrail.matchsync.api.PlayerRecord;
import com.questrail.matchsync.api.Snapshot;
import com.questrail.matchsync.api.TestRecords;
import com.questrail.matchsync.prefs.InMemoryPreferenceStore;
import com.questrail.matchsync.store.InMemoryRecordStore;
import com.questrail.matchsync.time.Cancellable;
import com.questrail.matchsync.time.DeterministicScheduler;
import com.questrail.matchsync.time.ManualMonotonicClock;
import com.questrail.matchsync.time.ManualWallClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CloudSyncServiceTest
 * -----------------------------------------------------------------------------
 * Backend sync against an in-memory backend.
 *
 * Covered here:
 * <ul>
 *   <li>upload, own-devices download, friends download and deletion</li>
 *   <li>tombstones: excluded from uploads, applied on download, never merged back</li>
 *   <li>the single in-progress guard</li>
 *   <li>debounced automatic upload and change-driven downloads</li>
 * </ul>
 */
class CloudSyncServiceTest {

    private static final String USER = "user-1";
    private static final String FRIEND = "friend-1";
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private FakeBackendClient backend;
    private InMemoryRecordStore store;
    private CloudSyncPreferences preferences;
    private DeterministicScheduler scheduler;
    private ManualWallClock wallClock;
    private CloudSyncService service;

    @BeforeEach
    void setUp() {
        backend = new FakeBackendClient();
        wallClock = new ManualWallClock(NOW);
        store = new InMemoryRecordStore(DeviceIdentity.of("device_local"), wallClock);
        preferences = new CloudSyncPreferences(new InMemoryPreferenceStore());
        scheduler = new DeterministicScheduler(new ManualMonotonicClock());
        service = service(FixedAccountSession.signedIn(USER, "token"));
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private CloudSyncService service(AccountSession session) {
        return new CloudSyncService(backend, session, store, DeviceIdentity.of("device_local"), preferences,
                scheduler, scheduler.clock(), wallClock, CloudSyncTimingPolicy.defaults());
    }

    /**
     * Write a snapshot to the backend as if uploaded by {@code deviceId} of {@code ownerId}.
     */
    private void seed(String ownerId, String deviceId, Snapshot snapshot) {
        CloudRecordMapper remote = new CloudRecordMapper(DeviceIdentity.of(deviceId));
        for (PlayerRecord p : snapshot.players()) {
            backend.upsertPlayer(remote.toRow(ownerId, p.withDeviceId(deviceId), NOW));
        }
        for (MatchRecord m : snapshot.matches()) {
            backend.upsertMatch(remote.toRow(ownerId, m.withDeviceId(deviceId), NOW));
        }
        for (MatchPlayerRecord mp : snapshot.matchPlayers()) {
            backend.upsertMatchPlayer(remote.toRow(ownerId, mp.withDeviceId(deviceId), NOW));
        }
    }

    private void localMatch(String matchId) {
        store.mergeData(TestRecords.oneMatch(matchId, "device_local"));
    }

    private void tombstone(String ownerId, String matchId) {
        backend.upsertTombstone(new TombstoneRow(ownerId, matchId, NOW, "device_other"));
    }

    // ---------------------------------------------------------------------
    // Upload
    // ---------------------------------------------------------------------

    @Test
    void uploadWritesEveryRowStampedWithOwnerAndDevice() {
        store.importMerge(TestRecords.oneMatch("m-1", null), MergeMode.REPLACE);

        SyncResult result = service.upload();

        assertTrue(result.success());
        assertEquals(5, result.recordsAdded());
        assertEquals(2, backend.playerRows().size());
        CloudMatchRow match = backend.matchRows().get(0);
        assertEquals(USER, match.ownerId());
        assertEquals("device_local", match.deviceId());
        assertEquals("local", match.syncSource());
        assertEquals("titans", match.winningTeam());
        assertEquals(NOW, match.syncedAt());
        assertEquals(2, backend.matchPlayerRows().size());

        assertEquals(CloudSyncStatus.State.COMPLETE, service.status().status());
        assertEquals("Upload complete! 5 records synced.", service.status().message());
        assertTrue(service.status().errorMessage().isEmpty());
        assertTrue(result.errorMessage().isEmpty());
        assertEquals(NOW, service.status().lastSyncAt());
        assertEquals(NOW, backend.lastSyncOf(USER));
        assertEquals(NOW, preferences.lastSyncAt().orElseThrow());
    }

    @Test
    void uploadSkipsTombstonedMatchesAndTheirParticipants() {
        localMatch("m-1");
        localMatch("m-2");
        localMatch("m-3");
        tombstone(USER, "m-1");
        tombstone(USER, "m-3");
        Snapshot local = store.exportAll();
        assertEquals(3, local.matches().size());

        SyncResult result = service.upload();

        Set<String> tombstoned = Set.of("m-1", "m-3");
        Set<String> expectedMatches = local.matches().stream()
                .map(MatchRecord::id)
                .filter(id -> !tombstoned.contains(id))
                .collect(Collectors.toSet());
        Set<String> expectedMatchPlayers = local.matchPlayers().stream()
                .filter(mp -> !tombstoned.contains(mp.matchId()))
                .map(MatchPlayerRecord::id)
                .collect(Collectors.toSet());
        assertEquals(Set.of("m-2"), expectedMatches);
        assertEquals(expectedMatches,
                backend.matchRows().stream().map(CloudMatchRow::id).collect(Collectors.toSet()));
        assertEquals(expectedMatchPlayers,
                backend.matchPlayerRows().stream().map(CloudMatchPlayerRow::id).collect(Collectors.toSet()));
        assertEquals(local.players().size() + expectedMatches.size() + expectedMatchPlayers.size(),
                result.recordsAdded());
        assertTrue(result.errorMessage().isEmpty());
    }

    @Test
    void failedRowDoesNotStopTheOthers() {
        localMatch("m-1");
        backend.failPlayerUpsert("p-bob");

        SyncResult result = service.upload();

        assertTrue(result.success());
        assertEquals(4, result.recordsAdded());
        assertEquals(1, backend.playerRows().size());
        assertEquals(1, backend.matchRows().size());
        assertEquals("1 record failed to upload", result.errorMessage().orElseThrow());

        CloudSyncStatus status = service.status();
        assertEquals(CloudSyncStatus.State.COMPLETE, status.status());
        assertEquals("Upload complete! 4 records synced.", status.message());
        assertEquals("1 record failed to upload", status.errorMessage().orElseThrow());
        assertEquals(NOW, status.lastSyncAt());
    }

    @Test
    void everyFailedRowIsCountedInTheError() {
        localMatch("m-1");
        backend.failPlayerUpsert("p-alice");
        backend.failPlayerUpsert("p-bob");

        SyncResult result = service.upload();

        assertTrue(result.success());
        assertEquals(3, result.recordsAdded());
        assertEquals("2 records failed to upload", result.error());
        assertEquals("2 records failed to upload", service.status().error());
    }

    @Test
    void profileUpdateFailureDoesNotFailTheUpload() {
        localMatch("m-1");
        backend.failTouch();

        assertTrue(service.upload().success());
        assertEquals(NOW, preferences.lastSyncAt().orElseThrow());
    }

    @Test
    void uploadRequiresAnAccount() {
        service = service(FixedAccountSession.signedOut());
        localMatch("m-1");

        SyncResult result = service.upload();

        assertFalse(result.success());
        assertEquals("Not authenticated", result.error());
        assertEquals(CloudSyncStatus.State.ERROR, service.status().status());
        assertEquals("Upload failed", service.status().message());
        assertEquals(0, backend.upsertCount());
    }

    @Test
    void unreadableTombstonesFailTheUploadBeforeWriting() {
        localMatch("m-1");
        backend.failTombstoneReads();

        SyncResult result = service.upload();

        assertFalse(result.success());
        assertEquals(0, backend.upsertCount());
        assertFalse(service.isSyncInProgress());
    }

    @Test
    void uploadProgressNeverGoesBackwards() {
        localMatch("m-1");
        List<CloudSyncStatus> updates = new ArrayList<>();
        service.addStatusListener(updates::add);

        service.upload();

        assertEquals(CloudSyncStatus.State.IDLE, updates.get(0).status());
        List<Integer> percents = updates.stream().skip(1).map(CloudSyncStatus::percent).collect(Collectors.toList());
        assertEquals(0, percents.get(0));
        assertEquals(100, percents.get(percents.size() - 1));
        for (int i = 1; i < percents.size(); i++) {
            assertTrue(percents.get(i) >= percents.get(i - 1), "progress went backwards: " + percents);
        }
        assertTrue(updates.stream().anyMatch(s -> s.message().equals("Uploading players (2/2)...")));
    }

    @Test
    void secondOperationIsRefusedWhileOneRuns() {
        localMatch("m-1");
        SyncResult[] nested = new SyncResult[1];
        backend.onFirstPlayerUpsert(() -> nested[0] = service.downloadOwnDevices());

        SyncResult outer = service.upload();

        assertTrue(outer.success());
        assertFalse(nested[0].success());
        assertEquals("Sync already in progress", nested[0].error());
        assertFalse(service.isSyncInProgress());
    }

    // ---------------------------------------------------------------------
    // Own devices
    // ---------------------------------------------------------------------

    @Test
    void ownDevicesDownloadSkipsRowsWrittenByThisDevice() {
        seed(USER, "device_local", TestRecords.oneMatch("m-mine", null));
        seed(USER, "device_other", TestRecords.oneMatch("m-remote", null));

        SyncResult result = service.downloadOwnDevices();

        assertTrue(result.success());
        assertEquals(5, result.recordsAdded());
        assertTrue(store.getRecord("m-remote").isPresent());
        assertTrue(store.getRecord("m-mine").isEmpty());
        assertEquals(2, store.getMatchPlayers("m-remote").size());
        assertEquals("Synced: 5 records downloaded.", service.status().message());
        assertEquals(NOW, preferences.lastOwnSyncAt().orElseThrow());
    }

    @Test
    void tombstonedMatchIsDeletedLocallyAndNeverMergedBack() {
        localMatch("m-1");
        seed(USER, "device_other", TestRecords.oneMatch("m-1", null));
        tombstone(USER, "m-1");

        SyncResult result = service.downloadOwnDevices();

        assertTrue(result.success());
        assertEquals(1, result.recordsUpdated());
        assertTrue(store.getRecord("m-1").isEmpty());
        assertTrue(store.getMatchPlayers("m-1").isEmpty());
        assertEquals("Synced: 2 records downloaded, 1 deleted.", service.status().message());

        // a second pass finds nothing left to delete and still does not resurrect it
        SyncResult again = service.downloadOwnDevices();
        assertEquals(0, again.recordsUpdated());
        assertTrue(store.getRecord("m-1").isEmpty());
    }

    @Test
    void emptyBackendReportsNothingNew() {
        SyncResult result = service.downloadOwnDevices();

        assertEquals(SyncResult.success(0, 0), result);
        assertEquals("No new data found from other devices.", service.status().message());
    }

    @Test
    void backendOutageFailsTheDownload() {
        backend.failSelects();

        SyncResult result = service.downloadOwnDevices();

        assertFalse(result.success());
        assertEquals("Download failed", service.status().message());
        assertEquals("backend unavailable", service.status().error());
    }

    // ---------------------------------------------------------------------
    // Friends
    // ---------------------------------------------------------------------

    @Test
    void noFriendsCompletesWithoutDownloading() {
        SyncResult result = service.downloadFromFriends();

        assertEquals(SyncResult.success(0, 0), result);
        assertEquals("No friends to sync from", service.status().message());
        assertEquals(0, backend.selectCount());
    }

    @Test
    void friendsDownloadHonoursOwnTombstones() {
        backend.addFriend(USER, FRIEND);
        seed(FRIEND, "device_friend", TestRecords.oneMatch("m-f1", null));
        seed(FRIEND, "device_friend", TestRecords.oneMatch("m-f2", null));
        tombstone(USER, "m-f2");

        SyncResult result = service.downloadFromFriends();

        assertTrue(result.success());
        assertEquals(3, result.recordsAdded());
        assertTrue(store.getRecord("m-f1").isPresent());
        assertTrue(store.getRecord("m-f2").isEmpty());
        assertEquals("Sync complete! Merged data from 1 friends.", service.status().message());
    }

    @Test
    void explicitFriendSelectionSkipsTheFriendList() {
        seed("friend-2", "device_friend", TestRecords.oneMatch("m-f", null));

        SyncResult result = service.downloadFromFriends(List.of("friend-2"));

        assertTrue(result.success());
        assertTrue(store.getRecord("m-f").isPresent());
    }

    // ---------------------------------------------------------------------
    // Deletion
    // ---------------------------------------------------------------------

    @Test
    void deleteRemovesBackendRowsWritesTombstoneAndDeletesLocally() {
        localMatch("m-1");
        service.upload();

        SyncResult result = service.deleteMatch("m-1");

        assertEquals(SyncResult.success(0, 1), result);
        assertTrue(backend.matchRows().isEmpty());
        assertTrue(backend.matchPlayerRows().isEmpty());
        TombstoneRow tomb = backend.tombstoneRows().get(0);
        assertEquals(USER, tomb.ownerId());
        assertEquals("m-1", tomb.matchId());
        assertEquals("device_local", tomb.deviceId());
        assertTrue(store.getRecord("m-1").isEmpty());
    }

    @Test
    void backendDeleteFailureKeepsTheLocalMatch() {
        localMatch("m-1");
        backend.failDeletes();

        SyncResult result = service.deleteMatch("m-1");

        assertFalse(result.success());
        assertTrue(store.getRecord("m-1").isPresent());
        assertTrue(backend.tombstoneRows().isEmpty());
    }

    @Test
    void tombstoneWriteFailureStillDeletesLocally() {
        localMatch("m-1");
        backend.failTombstoneWrites();

        SyncResult result = service.deleteMatch("m-1");

        assertTrue(result.success());
        assertTrue(store.getRecord("m-1").isEmpty());
    }

    @Test
    void signedOutDeleteIsLocalOnly() {
        service = service(FixedAccountSession.signedOut());
        localMatch("m-1");
        seed(USER, "device_local", TestRecords.oneMatch("m-1", null));

        SyncResult result = service.deleteMatch("m-1");

        assertEquals(1, result.recordsUpdated());
        assertEquals(1, backend.matchRows().size());
        assertTrue(backend.tombstoneRows().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Background triggers
    // ---------------------------------------------------------------------

    @Test
    void burstOfMutationsUploadsOnceAfterTheQuietWindow() {
        localMatch("m-1");

        service.onLocalMutation();
        scheduler.advance(Duration.ofSeconds(1));
        service.onLocalMutation();
        scheduler.advance(Duration.ofSeconds(1));
        service.onLocalMutation();

        scheduler.advance(Duration.ofMillis(2999));
        assertEquals(0, backend.upsertCount());

        scheduler.advance(Duration.ofMillis(1));
        assertEquals(5, backend.upsertCount());

        scheduler.advance(Duration.ofSeconds(10));
        assertEquals(5, backend.upsertCount());
    }

    @Test
    void disabledAutoUploadIgnoresMutations() {
        localMatch("m-1");
        service.setAutoUpload(false);

        service.onLocalMutation();
        scheduler.advance(Duration.ofSeconds(10));

        assertEquals(0, backend.upsertCount());
        assertFalse(service.isAutoUploadEnabled());
    }

    @Test
    void changeFromAnotherOwnDeviceTriggersDebouncedDownload() {
        seed(USER, "device_other", TestRecords.oneMatch("m-remote", null));
        service.start();
        assertEquals(1, backend.subscriberCount());

        backend.publish(new MatchChangeNotification("m-remote", USER, "device_other"));
        backend.publish(new MatchChangeNotification("m-remote", USER, "device_other"));
        scheduler.advance(Duration.ofMillis(1999));
        assertTrue(store.getRecord("m-remote").isEmpty());

        scheduler.advance(Duration.ofMillis(1));
        assertTrue(store.getRecord("m-remote").isPresent());
        assertEquals(3, backend.selectCount());
    }

    @Test
    void changeWrittenByThisDeviceIsIgnored() {
        service.start();

        backend.publish(new MatchChangeNotification("m-1", USER, "device_local"));
        scheduler.advance(Duration.ofSeconds(5));

        assertEquals(0, backend.selectCount());
    }

    @Test
    void friendChangesFollowTheGlobalAndPerFriendSwitches() {
        backend.addFriend(USER, FRIEND);
        seed(FRIEND, "device_friend", TestRecords.oneMatch("m-f1", null));
        service.start();

        // friends auto-sync is off by default
        backend.publish(new MatchChangeNotification("m-f1", FRIEND, "device_friend"));
        scheduler.advance(Duration.ofSeconds(5));
        assertTrue(store.getRecord("m-f1").isEmpty());

        service.setAutoSyncFriends(true);
        service.setFriendAutoSync(FRIEND, false);
        backend.publish(new MatchChangeNotification("m-f1", FRIEND, "device_friend"));
        scheduler.advance(Duration.ofSeconds(5));
        assertTrue(store.getRecord("m-f1").isEmpty());

        service.setFriendAutoSync(FRIEND, true);
        backend.publish(new MatchChangeNotification("m-f1", FRIEND, "device_friend"));
        scheduler.advance(Duration.ofSeconds(2));
        assertTrue(store.getRecord("m-f1").isPresent());
    }

    @Test
    void subscriptionFollowsAutoSyncSettings() {
        service.start();
        assertEquals(1, backend.subscriberCount());

        service.setAutoSyncOwnDevices(false);
        assertEquals(0, backend.subscriberCount());

        service.setAutoSyncFriends(true);
        assertEquals(1, backend.subscriberCount());

        service.close();
        assertEquals(0, backend.subscriberCount());
    }

    @Test
    void statusListenerGetsCurrentStatusAndCanUnsubscribe() {
        List<CloudSyncStatus> updates = new ArrayList<>();

        Cancellable handle = service.addStatusListener(updates::add);
        assertEquals(List.of(CloudSyncStatus.initial(null)), updates);

        assertTrue(handle.cancel());
        service.downloadOwnDevices();
        assertEquals(1, updates.size());
    }
}

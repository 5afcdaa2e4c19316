package com.questrail.matchsync.cloud;

import com.questrail.matchsync.api.DeviceIdentity;
import com.questrail.matchsync.api.MatchPlayerRecord;
import com.questrail.matchsync.api.MatchRecord;
import com.questrail.matchsync.api.PlayerRecord;
import com.questrail.matchsync.api.RecordStoreGateway;
import com.questrail.matchsync.api.Snapshot;
import com.questrail.matchsync.time.Cancellable;
import com.questrail.matchsync.time.DebouncedTask;
import com.questrail.matchsync.time.MonotonicClock;
import com.questrail.matchsync.time.MonotonicScheduler;
import com.questrail.matchsync.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CloudSyncService
 * =============================================================================
 * Synchronizes the local record store with the hosted backend.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@link #upload()}: push every local record that is not tombstoned</li>
 *   <li>{@link #downloadOwnDevices()}: pull own rows written by other devices,
 *       applying own tombstones locally first</li>
 *   <li>{@link #downloadFromFriends()}: pull friends' rows</li>
 *   <li>{@link #deleteMatch(String)}: delete a match everywhere and leave a tombstone</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * Backend calls block the calling thread. At most one of upload and the two
 * downloads runs at a time; a second caller gets
 * {@code SyncResult.failure("Sync already in progress")} immediately.
 *
 * <h2>Background work</h2>
 * <ul>
 *   <li>{@link #onLocalMutation()} arms a debounced automatic upload.</li>
 *   <li>While either auto-sync mode is on, the service listens to the
 *       backend's match change feed. Own-account rows from other devices arm
 *       the own-devices download; rows of friends with auto-sync on arm the
 *       friends download. Rows from this device are ignored.</li>
 *   <li>Debounced runs are skipped while another operation is in progress.</li>
 * </ul>
 *
 * <h2>Status</h2>
 * A single current {@link CloudSyncStatus} is broadcast to every listener on
 * each change. Listener exceptions are caught and logged.
 */
public final class CloudSyncService implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(CloudSyncService.class);

    static final String BUSY = "Sync already in progress";
    static final String NOT_AUTHENTICATED = "Not authenticated";

    private final BackendClient backend;
    private final AccountSession session;
    private final RecordStoreGateway gateway;
    private final DeviceIdentity localDevice;
    private final CloudSyncPreferences preferences;
    private final WallClock wallClock;
    private final CloudRecordMapper mapper;

    private final DebouncedTask autoUpload;
    private final DebouncedTask autoOwnDevices;
    private final DebouncedTask autoFriends;

    private final AtomicBoolean inProgress = new AtomicBoolean();
    private final List<CloudSyncStatusListener> listeners = new CopyOnWriteArrayList<>();

    private volatile CloudSyncStatus status;
    private Cancellable changeSubscription;
    private boolean started;

    public CloudSyncService(BackendClient backend,
                            AccountSession session,
                            RecordStoreGateway gateway,
                            DeviceIdentity localDevice,
                            CloudSyncPreferences preferences,
                            MonotonicScheduler scheduler,
                            MonotonicClock clock,
                            WallClock wallClock,
                            CloudSyncTimingPolicy timing)
    {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.session = Objects.requireNonNull(session, "session");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.localDevice = Objects.requireNonNull(localDevice, "localDevice");
        this.preferences = Objects.requireNonNull(preferences, "preferences");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(timing, "timing");

        this.mapper = new CloudRecordMapper(localDevice);
        this.status = CloudSyncStatus.initial(preferences.lastSyncAt().orElse(null));

        this.autoUpload = new DebouncedTask(scheduler, clock, timing.uploadDebounce(), this::runAutoUpload);
        this.autoOwnDevices = new DebouncedTask(scheduler, clock, timing.changeDebounce(), this::runAutoOwnDevices);
        this.autoFriends = new DebouncedTask(scheduler, clock, timing.changeDebounce(), this::runAutoFriends);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Begin listening for remote changes if an auto-sync mode is enabled.
     */
    public synchronized void start() {
        started = true;
        refreshSubscription();
    }

    @Override
    public synchronized void close() {
        started = false;
        refreshSubscription();
        autoUpload.close();
        autoOwnDevices.close();
        autoFriends.close();
    }

    // ---------------------------------------------------------------------
    // Upload
    // ---------------------------------------------------------------------

    /**
     * Upload every local player, match and match player that is not
     * tombstoned. Rows are upserted one by one; a failed row is logged and
     * does not stop the others. When any row fails the upload still
     * completes, with the failure count as its error.
     */
    public SyncResult upload() {
        if (!inProgress.compareAndSet(false, true)) {
            return SyncResult.failure(BUSY);
        }
        try {
            return doUpload();
        } catch (RuntimeException e) {
            log.error("Upload failed", e);
            String error = describe(e);
            publish(status.failed("Upload failed", error));
            return SyncResult.failure(error);
        } finally {
            inProgress.set(false);
        }
    }

    private SyncResult doUpload() {
        publish(status.next(CloudSyncStatus.State.UPLOADING, 0, "Preparing local data..."));
        String userId = requireUser();

        Snapshot local = gateway.exportAll();
        publish(status.next(CloudSyncStatus.State.UPLOADING, 5, "Exporting local database..."));

        publish(status.next(CloudSyncStatus.State.UPLOADING, 10, "Checking for deleted matches..."));
        Set<String> tombstones = new HashSet<>(backend.selectTombstonedMatchIds(userId));

        List<MatchRecord> matches = new ArrayList<>();
        Set<String> matchIds = new HashSet<>();
        for (MatchRecord m : local.matches()) {
            if (!tombstones.contains(m.id())) {
                matches.add(m);
                matchIds.add(m.id());
            }
        }
        List<MatchPlayerRecord> matchPlayers = new ArrayList<>();
        for (MatchPlayerRecord mp : local.matchPlayers()) {
            if (matchIds.contains(mp.matchId())) {
                matchPlayers.add(mp);
            }
        }
        if (matches.size() < local.matches().size()) {
            log.info("Skipping {} tombstoned matches", local.matches().size() - matches.size());
        }

        Instant syncedAt = wallClock.now();
        int uploaded = 0;
        int failed = 0;

        List<PlayerRecord> players = local.players();
        publish(status.next(CloudSyncStatus.State.UPLOADING, 20, "Uploading " + players.size() + " players..."));
        for (int i = 0; i < players.size(); i++) {
            PlayerRecord p = players.get(i);
            if (tryUpsert("player", p.id(), () -> backend.upsertPlayer(mapper.toRow(userId, p, syncedAt)))) {
                uploaded++;
            } else {
                failed++;
            }
            publish(status.next(CloudSyncStatus.State.UPLOADING, 20 + band(i, players.size(), 20),
                    "Uploading players (" + (i + 1) + "/" + players.size() + ")..."));
        }

        publish(status.next(CloudSyncStatus.State.UPLOADING, 40, "Uploading " + matches.size() + " matches..."));
        for (int i = 0; i < matches.size(); i++) {
            MatchRecord m = matches.get(i);
            if (tryUpsert("match", m.id(), () -> backend.upsertMatch(mapper.toRow(userId, m, syncedAt)))) {
                uploaded++;
            } else {
                failed++;
            }
            publish(status.next(CloudSyncStatus.State.UPLOADING, 40 + band(i, matches.size(), 30),
                    "Uploading matches (" + (i + 1) + "/" + matches.size() + ")..."));
        }

        publish(status.next(CloudSyncStatus.State.UPLOADING, 70,
                "Uploading " + matchPlayers.size() + " match details..."));
        for (int i = 0; i < matchPlayers.size(); i++) {
            MatchPlayerRecord mp = matchPlayers.get(i);
            if (tryUpsert("match player", mp.id(),
                    () -> backend.upsertMatchPlayer(mapper.toRow(userId, mp, syncedAt)))) {
                uploaded++;
            } else {
                failed++;
            }
            publish(status.next(CloudSyncStatus.State.UPLOADING, 70 + band(i, matchPlayers.size(), 25),
                    "Uploading match details (" + (i + 1) + "/" + matchPlayers.size() + ")..."));
        }

        Instant completedAt = wallClock.now();
        try {
            backend.touchLastSync(userId, completedAt);
        } catch (BackendException e) {
            log.warn("Could not update profile last sync time: {}", e.getMessage());
        }
        preferences.setLastSyncAt(completedAt);

        String message = "Upload complete! " + uploaded + " records synced.";
        if (failed > 0) {
            String error = failed + (failed == 1 ? " record" : " records") + " failed to upload";
            publish(status.completedWithErrors(message, error, completedAt));
            log.warn("Upload complete: {} records synced, {}", uploaded, error);
            return SyncResult.partial(uploaded, 0, error);
        }
        publish(status.completed(message, completedAt));
        log.info("Upload complete: {} records synced", uploaded);
        return SyncResult.success(uploaded, 0);
    }

    private boolean tryUpsert(String what, String id, Runnable upsert) {
        try {
            upsert.run();
            return true;
        } catch (BackendException e) {
            log.warn("Failed to upload {} {}: {}", what, id, e.getMessage());
            return false;
        }
    }

    /**
     * Share of a progress band covered before row {@code i} of {@code n}.
     */
    private static int band(int i, int n, int width) {
        return (int) Math.floor((double) i / Math.max(n, 1) * width);
    }

    // ---------------------------------------------------------------------
    // Download
    // ---------------------------------------------------------------------

    /**
     * Download own rows written by other devices. Own tombstones are applied
     * to the local store first and tombstoned matches are never merged.
     */
    public SyncResult downloadOwnDevices() {
        if (!inProgress.compareAndSet(false, true)) {
            return SyncResult.failure(BUSY);
        }
        try {
            return doDownloadOwnDevices();
        } catch (RuntimeException e) {
            log.error("Own-devices download failed", e);
            String error = describe(e);
            publish(status.failed("Download failed", error));
            return SyncResult.failure(error);
        } finally {
            inProgress.set(false);
        }
    }

    private SyncResult doDownloadOwnDevices() {
        publish(status.next(CloudSyncStatus.State.DOWNLOADING, 0, "Downloading your data from cloud..."));
        String userId = requireUser();

        publish(status.next(CloudSyncStatus.State.DOWNLOADING, 10, "Checking for deleted matches..."));
        Set<String> tombstones = new LinkedHashSet<>(backend.selectTombstonedMatchIds(userId));

        RowFilter filter = RowFilter.ownedBy(userId).excludingDevice(localDevice.value());

        publish(status.next(CloudSyncStatus.State.DOWNLOADING, 20, "Downloading players from other devices..."));
        List<CloudPlayerRow> players = backend.selectPlayers(filter);

        publish(status.next(CloudSyncStatus.State.DOWNLOADING, 40, "Downloading matches from other devices..."));
        List<CloudMatchRow> matches = backend.selectMatches(filter);

        publish(status.next(CloudSyncStatus.State.DOWNLOADING, 60,
                "Downloading match details from other devices..."));
        List<CloudMatchPlayerRow> matchPlayers = backend.selectMatchPlayers(filter);

        publish(status.next(CloudSyncStatus.State.MERGING, 70, "Applying deletions..."));
        int deleted = applyTombstones(tombstones);

        publish(status.next(CloudSyncStatus.State.MERGING, 80, "Merging data..."));
        Snapshot snapshot = toSnapshot(players, matches, matchPlayers, tombstones);
        mergeOrThrow(snapshot);

        Instant completedAt = wallClock.now();
        preferences.setLastOwnSyncAt(completedAt);

        int downloaded = snapshot.recordCount();
        String message = downloaded > 0 || deleted > 0
                ? "Synced: " + downloaded + " records downloaded" + (deleted > 0 ? ", " + deleted + " deleted" : "") + "."
                : "No new data found from other devices.";
        publish(status.completed(message, completedAt));
        log.info("Own-devices download complete: {} records, {} deleted", downloaded, deleted);
        return SyncResult.success(downloaded, deleted);
    }

    /**
     * Download rows of every accepted friend.
     */
    public SyncResult downloadFromFriends() {
        return downloadFromFriends(List.of());
    }

    /**
     * Download rows of the given friends; an empty selection means every
     * accepted friend.
     */
    public SyncResult downloadFromFriends(Collection<String> selectedFriendIds) {
        Objects.requireNonNull(selectedFriendIds, "selectedFriendIds");
        if (!inProgress.compareAndSet(false, true)) {
            return SyncResult.failure(BUSY);
        }
        try {
            return doDownloadFromFriends(selectedFriendIds);
        } catch (RuntimeException e) {
            log.error("Friends download failed", e);
            String error = describe(e);
            publish(status.failed("Sync failed", error));
            return SyncResult.failure(error);
        } finally {
            inProgress.set(false);
        }
    }

    private SyncResult doDownloadFromFriends(Collection<String> selectedFriendIds) {
        publish(status.next(CloudSyncStatus.State.DOWNLOADING, 0, "Fetching friend data..."));
        String userId = requireUser();

        Set<String> friendIds = new LinkedHashSet<>(selectedFriendIds.isEmpty()
                ? backend.selectFriendIds(userId)
                : selectedFriendIds);

        if (friendIds.isEmpty()) {
            publish(status.completed("No friends to sync from", wallClock.now()));
            return SyncResult.success(0, 0);
        }

        publish(status.next(CloudSyncStatus.State.DOWNLOADING, 20, "Downloading from " + friendIds.size()
                + (friendIds.size() == 1 ? " friend" : " friends") + "..."));
        RowFilter filter = RowFilter.ownedByAny(friendIds);
        List<CloudPlayerRow> players = backend.selectPlayers(filter);

        publish(status.next(CloudSyncStatus.State.DOWNLOADING, 40, "Downloading matches..."));
        List<CloudMatchRow> matches = backend.selectMatches(filter);

        publish(status.next(CloudSyncStatus.State.DOWNLOADING, 60, "Downloading match details..."));
        List<CloudMatchPlayerRow> matchPlayers = backend.selectMatchPlayers(filter);

        // Matches this account deleted stay deleted even when a friend still has them.
        Set<String> tombstones = new HashSet<>(backend.selectTombstonedMatchIds(userId));

        publish(status.next(CloudSyncStatus.State.MERGING, 70, "Merging data..."));
        Snapshot snapshot = toSnapshot(players, matches, matchPlayers, tombstones);
        mergeOrThrow(snapshot);

        Instant completedAt = wallClock.now();
        preferences.setLastSyncAt(completedAt);

        publish(status.completed("Sync complete! Merged data from " + friendIds.size() + " friends.", completedAt));
        log.info("Friends download complete: {} friends", friendIds.size());
        return SyncResult.success(snapshot.players().size() + snapshot.matches().size(), 0);
    }

    private Snapshot toSnapshot(List<CloudPlayerRow> players,
                                List<CloudMatchRow> matches,
                                List<CloudMatchPlayerRow> matchPlayers,
                                Set<String> tombstones)
    {
        List<MatchRecord> keptMatches = new ArrayList<>();
        Set<String> keptIds = new HashSet<>();
        for (CloudMatchRow row : matches) {
            if (tombstones.contains(row.id())) {
                continue;
            }
            keptMatches.add(mapper.toLocal(row));
            keptIds.add(row.id());
        }

        List<MatchPlayerRecord> keptMatchPlayers = new ArrayList<>();
        for (CloudMatchPlayerRow row : matchPlayers) {
            if (keptIds.contains(row.matchId())) {
                keptMatchPlayers.add(mapper.toLocal(row));
            }
        }

        List<PlayerRecord> localPlayers = new ArrayList<>(players.size());
        for (CloudPlayerRow row : players) {
            localPlayers.add(mapper.toLocal(row));
        }
        return Snapshot.of(localPlayers, keptMatches, keptMatchPlayers, wallClock.now());
    }

    private void mergeOrThrow(Snapshot snapshot) {
        if (!gateway.mergeData(snapshot)) {
            throw new IllegalStateException("Record store rejected the downloaded data");
        }
    }

    /**
     * Delete every local match named by a tombstone. Failures are logged per
     * match and do not stop the download.
     *
     * @return number of local matches removed
     */
    private int applyTombstones(Collection<String> tombstones) {
        int deleted = 0;
        for (String matchId : tombstones) {
            try {
                if (gateway.getRecord(matchId).isPresent() && gateway.deleteRecordCascade(matchId)) {
                    deleted++;
                    log.debug("Applied tombstone for match {}", matchId);
                }
            } catch (RuntimeException e) {
                log.warn("Could not apply tombstone for match {}: {}", matchId, describe(e));
            }
        }
        if (deleted > 0) {
            gateway.recomputeDerivedStats();
        }
        return deleted;
    }

    // ---------------------------------------------------------------------
    // Deletion
    // ---------------------------------------------------------------------

    /**
     * Delete a match locally and, when signed in, on the backend, leaving a
     * tombstone so other devices remove it too.
     *
     * <p>If the backend rows cannot be deleted the local match is kept and a
     * failure is returned. A failed tombstone write is only logged.</p>
     */
    public SyncResult deleteMatch(String matchId) {
        Objects.requireNonNull(matchId, "matchId");

        if (session.isAuthenticated()) {
            String userId = session.currentUserId().orElseThrow();
            try {
                backend.deleteMatchPlayers(userId, matchId);
                backend.deleteMatch(userId, matchId);
            } catch (BackendException e) {
                log.error("Could not delete match {} from the backend", matchId, e);
                return SyncResult.failure(describe(e));
            }
            try {
                backend.upsertTombstone(new TombstoneRow(userId, matchId, wallClock.now(), localDevice.value()));
            } catch (BackendException e) {
                log.error("Could not write tombstone for match {}", matchId, e);
            }
        }

        boolean removed = gateway.deleteRecordCascade(matchId);
        if (removed) {
            gateway.recomputeDerivedStats();
        }
        log.info("Deleted match {} (local record {})", matchId, removed ? "removed" : "absent");
        return SyncResult.success(0, removed ? 1 : 0);
    }

    // ---------------------------------------------------------------------
    // Background triggers
    // ---------------------------------------------------------------------

    /**
     * Signal that the local store changed. Arms the debounced upload when
     * automatic upload is on.
     */
    public void onLocalMutation() {
        if (preferences.autoUpload()) {
            autoUpload.arm();
        }
    }

    private void runAutoUpload() {
        if (!session.isAuthenticated() || inProgress.get()) {
            log.debug("Skipping automatic upload");
            return;
        }
        SyncResult result = upload();
        log.debug("Automatic upload finished: {}", result);
    }

    private void onMatchChange(MatchChangeNotification change) {
        if (localDevice.value().equals(change.deviceId())) {
            return;
        }
        String userId = session.currentUserId().orElse(null);
        if (userId == null) {
            return;
        }
        if (userId.equals(change.ownerId())) {
            if (preferences.autoSyncOwnDevices()) {
                log.debug("Own data changed on device {}", change.deviceId());
                autoOwnDevices.arm();
            }
        } else if (preferences.autoSyncFriends() && preferences.friendAutoSync(change.ownerId())) {
            log.debug("Friend {} changed match {}", change.ownerId(), change.matchId());
            autoFriends.arm();
        }
    }

    private void runAutoOwnDevices() {
        if (!preferences.autoSyncOwnDevices() || inProgress.get()) {
            return;
        }
        SyncResult result = downloadOwnDevices();
        log.debug("Automatic own-devices download finished: {}", result);
    }

    private void runAutoFriends() {
        if (!preferences.autoSyncFriends() || inProgress.get()) {
            return;
        }
        String userId = session.currentUserId().orElse(null);
        if (userId == null) {
            return;
        }
        final Set<String> friendIds;
        try {
            friendIds = preferences.autoSyncFriendIds(backend.selectFriendIds(userId));
        } catch (BackendException e) {
            log.warn("Automatic friends download skipped: {}", e.getMessage());
            return;
        }
        if (friendIds.isEmpty()) {
            return;
        }
        SyncResult result = downloadFromFriends(friendIds);
        log.debug("Automatic friends download finished: {}", result);
    }

    private synchronized void refreshSubscription() {
        boolean wanted = started && (preferences.autoSyncOwnDevices() || preferences.autoSyncFriends());
        if (wanted && changeSubscription == null) {
            changeSubscription = backend.subscribeMatchChanges(this::onMatchChange);
            log.debug("Subscribed to match changes");
        } else if (!wanted && changeSubscription != null) {
            changeSubscription.cancel();
            changeSubscription = null;
            log.debug("Unsubscribed from match changes");
        }
    }

    // ---------------------------------------------------------------------
    // Settings
    // ---------------------------------------------------------------------

    public boolean isAutoUploadEnabled() {
        return preferences.autoUpload();
    }

    public void setAutoUpload(boolean enabled) {
        preferences.setAutoUpload(enabled);
        if (!enabled) {
            autoUpload.cancel();
        }
    }

    public boolean isAutoSyncFriendsEnabled() {
        return preferences.autoSyncFriends();
    }

    public void setAutoSyncFriends(boolean enabled) {
        preferences.setAutoSyncFriends(enabled);
        if (!enabled) {
            autoFriends.cancel();
        }
        refreshSubscription();
    }

    public boolean isAutoSyncOwnDevicesEnabled() {
        return preferences.autoSyncOwnDevices();
    }

    public void setAutoSyncOwnDevices(boolean enabled) {
        preferences.setAutoSyncOwnDevices(enabled);
        if (!enabled) {
            autoOwnDevices.cancel();
        }
        refreshSubscription();
    }

    public boolean isFriendAutoSyncEnabled(String friendId) {
        return preferences.friendAutoSync(friendId);
    }

    public void setFriendAutoSync(String friendId, boolean enabled) {
        preferences.setFriendAutoSync(friendId, enabled);
    }

    // ---------------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------------

    public CloudSyncStatus status() {
        return status;
    }

    public boolean isSyncInProgress() {
        return inProgress.get();
    }

    /**
     * Register a status listener. It receives the current status at once.
     *
     * @return handle that unregisters the listener
     */
    public Cancellable addStatusListener(CloudSyncStatusListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        notifyListener(listener, status);
        return () -> listeners.remove(listener);
    }

    private void publish(CloudSyncStatus update) {
        status = update;
        for (CloudSyncStatusListener listener : listeners) {
            notifyListener(listener, update);
        }
    }

    private void notifyListener(CloudSyncStatusListener listener, CloudSyncStatus update) {
        try {
            listener.onStatus(update);
        } catch (RuntimeException e) {
            log.error("Status listener failed", e);
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private String requireUser() {
        return session.currentUserId().orElseThrow(() -> new IllegalStateException(NOT_AUTHENTICATED));
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

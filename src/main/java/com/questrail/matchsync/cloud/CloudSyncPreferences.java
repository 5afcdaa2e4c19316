package com.questrail.matchsync.cloud;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.matchsync.api.Json;
import com.questrail.matchsync.prefs.PreferenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * CloudSyncPreferences
 * =============================================================================
 * Persisted settings of the backend sync service, stored in a
 * {@link PreferenceStore}.
 *
 * <h2>Keys</h2>
 * <ul>
 *   <li>{@code cloud.auto-upload}: default {@code true}</li>
 *   <li>{@code cloud.auto-sync-friends}: default {@code false}</li>
 *   <li>{@code cloud.auto-sync-own-devices}: default {@code true}</li>
 *   <li>{@code cloud.friend-preferences}: JSON map {@code {friendId: {"autoSync": bool}}}</li>
 *   <li>{@code cloud.last-sync-at}, {@code cloud.last-own-sync-at}: ISO-8601 instants</li>
 * </ul>
 *
 * Malformed stored values are logged and treated as absent.
 */
public final class CloudSyncPreferences
{
    private static final Logger log = LoggerFactory.getLogger(CloudSyncPreferences.class);

    static final String AUTO_UPLOAD = "cloud.auto-upload";
    static final String AUTO_SYNC_FRIENDS = "cloud.auto-sync-friends";
    static final String AUTO_SYNC_OWN_DEVICES = "cloud.auto-sync-own-devices";
    static final String FRIEND_PREFERENCES = "cloud.friend-preferences";
    static final String LAST_SYNC_AT = "cloud.last-sync-at";
    static final String LAST_OWN_SYNC_AT = "cloud.last-own-sync-at";

    private static final TypeReference<LinkedHashMap<String, FriendPreference>> FRIEND_MAP =
            new TypeReference<>() {};

    /**
     * Per-friend settings. A friend without an entry has {@code autoSync = true}.
     */
    public record FriendPreference(boolean autoSync) {}

    private final PreferenceStore store;
    private final ObjectMapper mapper = Json.mapper();

    public CloudSyncPreferences(PreferenceStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    // ---------------------------------------------------------------------
    // Toggles
    // ---------------------------------------------------------------------

    public boolean autoUpload() {
        return readBoolean(AUTO_UPLOAD, true);
    }

    public void setAutoUpload(boolean enabled) {
        store.put(AUTO_UPLOAD, Boolean.toString(enabled));
    }

    public boolean autoSyncFriends() {
        return readBoolean(AUTO_SYNC_FRIENDS, false);
    }

    public void setAutoSyncFriends(boolean enabled) {
        store.put(AUTO_SYNC_FRIENDS, Boolean.toString(enabled));
    }

    public boolean autoSyncOwnDevices() {
        return readBoolean(AUTO_SYNC_OWN_DEVICES, true);
    }

    public void setAutoSyncOwnDevices(boolean enabled) {
        store.put(AUTO_SYNC_OWN_DEVICES, Boolean.toString(enabled));
    }

    private boolean readBoolean(String key, boolean defaultValue) {
        return store.get(key).map(Boolean::parseBoolean).orElse(defaultValue);
    }

    // ---------------------------------------------------------------------
    // Friends
    // ---------------------------------------------------------------------

    public Map<String, FriendPreference> friendPreferences() {
        Optional<String> raw = store.get(FRIEND_PREFERENCES);
        if (raw.isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, FriendPreference> parsed = mapper.readValue(raw.get(), FRIEND_MAP);
            return parsed != null ? parsed : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable friend preferences: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    public boolean friendAutoSync(String friendId) {
        FriendPreference pref = friendPreferences().get(friendId);
        return pref == null || pref.autoSync();
    }

    public void setFriendAutoSync(String friendId, boolean enabled) {
        Objects.requireNonNull(friendId, "friendId");
        Map<String, FriendPreference> prefs = friendPreferences();
        prefs.put(friendId, new FriendPreference(enabled));
        try {
            store.put(FRIEND_PREFERENCES, mapper.writeValueAsString(prefs));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize friend preferences", e);
        }
    }

    /**
     * The subset of {@code friendIds} whose auto-sync setting is on, in input order.
     */
    public Set<String> autoSyncFriendIds(Collection<String> friendIds) {
        Map<String, FriendPreference> prefs = friendPreferences();
        Set<String> result = new LinkedHashSet<>();
        for (String id : friendIds) {
            FriendPreference pref = prefs.get(id);
            if (pref == null || pref.autoSync()) {
                result.add(id);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------------
    // Timestamps
    // ---------------------------------------------------------------------

    public Optional<Instant> lastSyncAt() {
        return readInstant(LAST_SYNC_AT);
    }

    public void setLastSyncAt(Instant at) {
        store.put(LAST_SYNC_AT, at.toString());
    }

    public Optional<Instant> lastOwnSyncAt() {
        return readInstant(LAST_OWN_SYNC_AT);
    }

    public void setLastOwnSyncAt(Instant at) {
        store.put(LAST_OWN_SYNC_AT, at.toString());
    }

    private Optional<Instant> readInstant(String key) {
        Optional<String> raw = store.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(raw.get()));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring malformed timestamp under {}: {}", key, raw.get());
            return Optional.empty();
        }
    }
}

package com.questrail.matchsync.prefs;

import java.util.Optional;

/**
 * Durable string key/value storage for small local settings: the device
 * identity, auto-sync toggles, per-friend preferences and last-sync times.
 */
public interface PreferenceStore
{
    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);
}

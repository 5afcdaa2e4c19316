package com.questrail.matchsync.api;

import com.questrail.matchsync.prefs.PreferenceStore;
import com.questrail.matchsync.time.WallClock;

import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * DeviceIdentity
 * =============================================================================
 * Opaque id of this installation, distinguishing it from other installations
 * signed in to the same account.
 *
 * <h2>Lifecycle</h2>
 * Created once on first start, persisted under {@link #PREFERENCE_KEY}, never
 * regenerated. Loaded at startup by the composition root and passed
 * explicitly to the services that stamp or filter by device.
 *
 * <p>Format: {@code device_<epoch millis, base 36>_<8 random base-36 chars>}.</p>
 */
public final class DeviceIdentity
{
    public static final String PREFERENCE_KEY = "device-id";

    private static final String RANDOM_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int RANDOM_LENGTH = 8;

    private final String value;

    private DeviceIdentity(String value) {
        this.value = Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("device id must not be blank");
        }
    }

    public static DeviceIdentity of(String value) {
        return new DeviceIdentity(value);
    }

    /**
     * Returns the persisted identity, creating and persisting one if none exists.
     */
    public static DeviceIdentity loadOrCreate(PreferenceStore preferences, WallClock clock, Random random) {
        Objects.requireNonNull(preferences, "preferences");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(random, "random");

        Optional<String> existing = preferences.get(PREFERENCE_KEY);
        if (existing.isPresent() && !existing.get().isBlank()) {
            return new DeviceIdentity(existing.get());
        }

        DeviceIdentity created = new DeviceIdentity(generate(clock.now().toEpochMilli(), random));
        preferences.put(PREFERENCE_KEY, created.value);
        return created;
    }

    static String generate(long epochMillis, Random random) {
        StringBuilder sb = new StringBuilder("device_")
                .append(Long.toString(epochMillis, 36))
                .append('_');
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            sb.append(RANDOM_ALPHABET.charAt(random.nextInt(RANDOM_ALPHABET.length())));
        }
        return sb.toString();
    }

    public String value() {
        return value;
    }

    /**
     * Device id stamped on records merged in from elsewhere that carry none.
     */
    public String importedMarker() {
        return "imported_" + value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DeviceIdentity other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}

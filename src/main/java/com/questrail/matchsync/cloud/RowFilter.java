package com.questrail.matchsync.cloud;

import java.util.Objects;
import java.util.Set;

/**
 * Selection criteria for backend record rows: owned by any of
 * {@code ownerIds}, optionally excluding rows written by one device.
 *
 * @param ownerIds        accounts whose rows are selected; never empty
 * @param excludeDeviceId device whose rows are skipped, or {@code null}
 */
public record RowFilter(Set<String> ownerIds, String excludeDeviceId)
{
    public RowFilter {
        ownerIds = Set.copyOf(Objects.requireNonNull(ownerIds, "ownerIds"));
        if (ownerIds.isEmpty()) {
            throw new IllegalArgumentException("ownerIds must not be empty");
        }
    }

    public static RowFilter ownedBy(String ownerId) {
        return new RowFilter(Set.of(ownerId), null);
    }

    public static RowFilter ownedByAny(Set<String> ownerIds) {
        return new RowFilter(ownerIds, null);
    }

    public RowFilter excludingDevice(String deviceId) {
        return new RowFilter(ownerIds, deviceId);
    }

    public boolean matches(String ownerId, String deviceId) {
        return ownerIds.contains(ownerId) && (excludeDeviceId == null || !excludeDeviceId.equals(deviceId));
    }
}

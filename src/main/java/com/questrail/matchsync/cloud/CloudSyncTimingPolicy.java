package com.questrail.matchsync.cloud;

import java.time.Duration;
import java.util.Objects;

/**
 * CloudSyncTimingPolicy
 * -----------------------------------------------------------------------------
 * Background timing of the backend sync service.
 *
 * <ul>
 *   <li><b>uploadDebounce</b>: quiet window after the last local mutation
 *       before an automatic upload runs.</li>
 *   <li><b>changeDebounce</b>: quiet window after the last remote change
 *       notification before an automatic download runs.</li>
 *   <li><b>pollInterval</b>: how often a polling change feed asks the backend
 *       for new match rows.</li>
 * </ul>
 */
public record CloudSyncTimingPolicy(
        Duration uploadDebounce,
        Duration changeDebounce,
        Duration pollInterval
) {
    public CloudSyncTimingPolicy {
        Objects.requireNonNull(uploadDebounce, "uploadDebounce");
        Objects.requireNonNull(changeDebounce, "changeDebounce");
        Objects.requireNonNull(pollInterval, "pollInterval");

        if (uploadDebounce.isNegative()) {
            throw new IllegalArgumentException("uploadDebounce must be non-negative");
        }
        if (changeDebounce.isNegative()) {
            throw new IllegalArgumentException("changeDebounce must be non-negative");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    /**
     * 3s upload debounce, 2s change debounce, 5s poll interval.
     */
    public static CloudSyncTimingPolicy defaults() {
        return new CloudSyncTimingPolicy(
                Duration.ofSeconds(3),
                Duration.ofSeconds(2),
                Duration.ofSeconds(5)
        );
    }
}

package com.questrail.matchsync.config;

import com.questrail.matchsync.cloud.CloudSyncTimingPolicy;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for the hosted backend.
 *
 * @param baseUrl        project URL; REST calls go to {@code <baseUrl>/rest/v1/}
 * @param apiKey         public project key sent with every request
 * @param timing         debounce and poll intervals
 * @param requestTimeout per-request HTTP timeout
 */
public record CloudConfig(URI baseUrl, String apiKey, CloudSyncTimingPolicy timing, Duration requestTimeout)
{
    public CloudConfig {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(timing, "timing");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }
}

package com.questrail.matchsync.cloud;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Row of {@code deleted_matches}: a match deleted on purpose, keyed by
 * {@code (owner_id, match_id)}. The sync core writes tombstones and never
 * deletes them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TombstoneRow(
        @JsonProperty("owner_id") String ownerId,
        @JsonProperty("match_id") String matchId,
        @JsonProperty("deleted_at") Instant deletedAt,
        @JsonProperty("device_id") String deviceId
) {
    public TombstoneRow {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(matchId, "matchId");
    }
}

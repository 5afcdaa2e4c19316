package com.questrail.matchsync.cloud;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Row of {@code cloud_players}, keyed by {@code (owner_id, local_id)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CloudPlayerRow(
        @JsonProperty("owner_id") String ownerId,
        @JsonProperty("local_id") String localId,
        @JsonProperty("name") String name,
        @JsonProperty("total_games") int totalGames,
        @JsonProperty("wins") int wins,
        @JsonProperty("losses") int losses,
        @JsonProperty("elo") double elo,
        @JsonProperty("mu") Double mu,
        @JsonProperty("sigma") Double sigma,
        @JsonProperty("ordinal") Double ordinal,
        @JsonProperty("last_played") Instant lastPlayed,
        @JsonProperty("date_created") Instant dateCreated,
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("level") Integer level,
        @JsonProperty("sync_source") String syncSource,
        @JsonProperty("synced_at") Instant syncedAt
) {}

package com.questrail.matchsync.cloud;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Row of {@code cloud_matches}, keyed by {@code (owner_id, id)}. Team and game
 * length are stored in lower case.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CloudMatchRow(
        @JsonProperty("id") String id,
        @JsonProperty("owner_id") String ownerId,
        @JsonProperty("date") Instant date,
        @JsonProperty("winning_team") String winningTeam,
        @JsonProperty("game_length") String gameLength,
        @JsonProperty("double_lanes") boolean doubleLanes,
        @JsonProperty("titan_players") int titanPlayers,
        @JsonProperty("atlantean_players") int atlanteanPlayers,
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("sync_source") String syncSource,
        @JsonProperty("synced_at") Instant syncedAt
) {}

package com.questrail.matchsync.cloud;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Row of {@code cloud_match_players}, keyed by {@code (owner_id, id)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CloudMatchPlayerRow(
        @JsonProperty("id") String id,
        @JsonProperty("owner_id") String ownerId,
        @JsonProperty("match_id") String matchId,
        @JsonProperty("player_id") String playerId,
        @JsonProperty("team") String team,
        @JsonProperty("hero_id") int heroId,
        @JsonProperty("hero_name") String heroName,
        @JsonProperty("hero_roles") List<String> heroRoles,
        @JsonProperty("kills") Integer kills,
        @JsonProperty("deaths") Integer deaths,
        @JsonProperty("assists") Integer assists,
        @JsonProperty("gold_earned") Integer goldEarned,
        @JsonProperty("minion_kills") Integer minionKills,
        @JsonProperty("level") Integer level,
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("sync_source") String syncSource,
        @JsonProperty("synced_at") Instant syncedAt
) {}

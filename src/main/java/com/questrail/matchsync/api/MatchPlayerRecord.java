package com.questrail.matchsync.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * One player's participation in one match.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchPlayerRecord(
        String id,
        String matchId,
        String playerId,
        Team team,
        int heroId,
        String heroName,
        List<String> heroRoles,
        Integer kills,
        Integer deaths,
        Integer assists,
        Integer goldEarned,
        Integer minionKills,
        Integer level,
        String deviceId
) {
    public MatchPlayerRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(matchId, "matchId");
        Objects.requireNonNull(playerId, "playerId");
        Objects.requireNonNull(team, "team");
        heroRoles = heroRoles == null ? List.of() : List.copyOf(heroRoles);
    }

    public MatchPlayerRecord withDeviceId(String deviceId) {
        return new MatchPlayerRecord(id, matchId, playerId, team, heroId, heroName, heroRoles,
                kills, deaths, assists, goldEarned, minionKills, level, deviceId);
    }
}

package com.questrail.matchsync.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * A recorded match.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchRecord(
        String id,
        Instant date,
        Team winningTeam,
        GameLength gameLength,
        boolean doubleLanes,
        int titanPlayers,
        int atlanteanPlayers,
        String deviceId
) {
    public MatchRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(winningTeam, "winningTeam");
    }

    public MatchRecord withDeviceId(String deviceId) {
        return new MatchRecord(id, date, winningTeam, gameLength, doubleLanes,
                titanPlayers, atlanteanPlayers, deviceId);
    }
}

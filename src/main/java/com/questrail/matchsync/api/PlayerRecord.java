package com.questrail.matchsync.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * A player in the local roster.
 *
 * <p>{@code totalGames}, {@code wins}, {@code losses} and {@code lastPlayed} are
 * derived from match history and recomputed by
 * {@link RecordStoreGateway#recomputeDerivedStats()}.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlayerRecord(
        String id,
        String name,
        int totalGames,
        int wins,
        int losses,
        double elo,
        Double mu,
        Double sigma,
        Double ordinal,
        Instant lastPlayed,
        Instant dateCreated,
        String deviceId,
        Integer level
) {
    public static final double INITIAL_ELO = 1200;

    public PlayerRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }

    public PlayerRecord withStats(int totalGames, int wins, int losses, Instant lastPlayed) {
        return new PlayerRecord(id, name, totalGames, wins, losses, elo, mu, sigma, ordinal,
                lastPlayed, dateCreated, deviceId, level);
    }

    public PlayerRecord withDeviceId(String deviceId) {
        return new PlayerRecord(id, name, totalGames, wins, losses, elo, mu, sigma, ordinal,
                lastPlayed, dateCreated, deviceId, level);
    }
}

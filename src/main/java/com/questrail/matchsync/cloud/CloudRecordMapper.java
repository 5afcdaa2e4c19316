package com.questrail.matchsync.cloud;

import com.questrail.matchsync.api.DeviceIdentity;
import com.questrail.matchsync.api.GameLength;
import com.questrail.matchsync.api.MatchPlayerRecord;
import com.questrail.matchsync.api.MatchRecord;
import com.questrail.matchsync.api.PlayerRecord;
import com.questrail.matchsync.api.Team;

import java.time.Instant;
import java.util.Objects;

/**
 * CloudRecordMapper
 * -----------------------------------------------------------------------------
 * Converts between local records and backend rows.
 *
 * <h2>Outbound</h2>
 * Every row is stamped with the owning account, {@code sync_source = "local"}
 * and the upload time. {@code device_id} is the record's own device id when it
 * has one, otherwise the local device identity.
 *
 * <h2>Inbound</h2>
 * Team and game length are read case-insensitively. The row's owner and sync
 * bookkeeping columns are dropped.
 */
public final class CloudRecordMapper
{
    static final String SYNC_SOURCE_LOCAL = "local";

    private final DeviceIdentity localDevice;

    public CloudRecordMapper(DeviceIdentity localDevice) {
        this.localDevice = Objects.requireNonNull(localDevice, "localDevice");
    }

    // ---------------------------------------------------------------------
    // Local -> backend
    // ---------------------------------------------------------------------

    public CloudPlayerRow toRow(String ownerId, PlayerRecord p, Instant syncedAt) {
        return new CloudPlayerRow(ownerId, p.id(), p.name(), p.totalGames(), p.wins(), p.losses(), p.elo(),
                p.mu(), p.sigma(), p.ordinal(), p.lastPlayed(), p.dateCreated(),
                deviceOf(p.deviceId()), p.level(), SYNC_SOURCE_LOCAL, syncedAt);
    }

    public CloudMatchRow toRow(String ownerId, MatchRecord m, Instant syncedAt) {
        return new CloudMatchRow(m.id(), ownerId, m.date(), m.winningTeam().wireName(),
                m.gameLength() != null ? m.gameLength().wireName() : null,
                m.doubleLanes(), m.titanPlayers(), m.atlanteanPlayers(),
                deviceOf(m.deviceId()), SYNC_SOURCE_LOCAL, syncedAt);
    }

    public CloudMatchPlayerRow toRow(String ownerId, MatchPlayerRecord mp, Instant syncedAt) {
        return new CloudMatchPlayerRow(mp.id(), ownerId, mp.matchId(), mp.playerId(), mp.team().wireName(),
                mp.heroId(), mp.heroName(), mp.heroRoles(), mp.kills(), mp.deaths(), mp.assists(),
                mp.goldEarned(), mp.minionKills(), mp.level(),
                deviceOf(mp.deviceId()), SYNC_SOURCE_LOCAL, syncedAt);
    }

    private String deviceOf(String recordDeviceId) {
        return recordDeviceId != null ? recordDeviceId : localDevice.value();
    }

    // ---------------------------------------------------------------------
    // Backend -> local
    // ---------------------------------------------------------------------

    public PlayerRecord toLocal(CloudPlayerRow row) {
        return new PlayerRecord(row.localId(), row.name(), row.totalGames(), row.wins(), row.losses(),
                row.elo(), row.mu(), row.sigma(), row.ordinal(), row.lastPlayed(), row.dateCreated(),
                row.deviceId(), row.level());
    }

    public MatchRecord toLocal(CloudMatchRow row) {
        return new MatchRecord(row.id(), row.date(), Team.fromWire(row.winningTeam()),
                row.gameLength() != null ? GameLength.fromWire(row.gameLength()) : null,
                row.doubleLanes(), row.titanPlayers(), row.atlanteanPlayers(), row.deviceId());
    }

    public MatchPlayerRecord toLocal(CloudMatchPlayerRow row) {
        return new MatchPlayerRecord(row.id(), row.matchId(), row.playerId(), Team.fromWire(row.team()),
                row.heroId(), row.heroName(), row.heroRoles(), row.kills(), row.deaths(), row.assists(),
                row.goldEarned(), row.minionKills(), row.level(), row.deviceId());
    }
}

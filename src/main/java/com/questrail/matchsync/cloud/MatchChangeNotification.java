package com.questrail.matchsync.cloud;

/**
 * A match row was written to the backend by some device.
 *
 * @param matchId  id of the written match
 * @param ownerId  account that owns the row
 * @param deviceId device that wrote it, or {@code null} if unknown
 */
public record MatchChangeNotification(String matchId, String ownerId, String deviceId) {}

package com.questrail.matchsync.cloud;

/**
 * Observer of backend sync status.
 */
@FunctionalInterface
public interface CloudSyncStatusListener
{
    void onStatus(CloudSyncStatus status);
}

package com.questrail.matchsync.api;

/**
 * Observer of peer sync progress.
 */
@FunctionalInterface
public interface SyncProgressListener
{
    void onProgress(SyncProgress progress);
}

package com.questrail.matchsync.api;

/**
 * How {@link RecordStoreGateway#importMerge(Snapshot, MergeMode)} combines an
 * incoming {@link Snapshot} with local data.
 */
public enum MergeMode
{
    /** Id-keyed add-if-absent. Existing records are never overwritten. */
    MERGE,

    /** Clear local data, then store the snapshot as-is. */
    REPLACE
}

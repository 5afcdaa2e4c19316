package com.questrail.matchsync.peer.protocol;

/**
 * Reassembly found a gap in the chunk sequence.
 */
public final class MissingChunkException extends RuntimeException
{
    private final int chunkId;

    public MissingChunkException(int chunkId) {
        super("Missing chunk " + chunkId);
        this.chunkId = chunkId;
    }

    public int chunkId() {
        return chunkId;
    }
}

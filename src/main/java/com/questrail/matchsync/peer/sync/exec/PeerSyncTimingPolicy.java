package com.questrail.matchsync.peer.sync.exec;

import com.questrail.matchsync.peer.protocol.PayloadChunks;

import java.time.Duration;
import java.util.Objects;

/**
 * PeerSyncTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational sizing and timing for the executor layer.
 *
 * <p>These values control pacing and waiting only. Whether a request may be
 * answered, or a message accepted, is decided by the reducer alone.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>chunkSize</b>: serialized snapshots at least this long (in chars)
 *       travel as {@code CHUNK} messages instead of one {@code DATA}.</li>
 *   <li><b>interChunkDelay</b>: pause between consecutive chunks.</li>
 *   <li><b>confirmationTimeout</b>: how long a requester waits for the peer to
 *       confirm or reject before cancelling.</li>
 *   <li><b>completionResetDelay</b>: how long a completed operation stays
 *       visible before the engine returns to idle.</li>
 * </ul>
 */
public record PeerSyncTimingPolicy(
        int chunkSize,
        Duration interChunkDelay,
        Duration confirmationTimeout,
        Duration completionResetDelay
) {
    public PeerSyncTimingPolicy {
        Objects.requireNonNull(interChunkDelay, "interChunkDelay");
        Objects.requireNonNull(confirmationTimeout, "confirmationTimeout");
        Objects.requireNonNull(completionResetDelay, "completionResetDelay");

        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (interChunkDelay.isNegative()) {
            throw new IllegalArgumentException("interChunkDelay must be non-negative");
        }
        if (confirmationTimeout.isNegative() || confirmationTimeout.isZero()) {
            throw new IllegalArgumentException("confirmationTimeout must be positive");
        }
        if (completionResetDelay.isNegative()) {
            throw new IllegalArgumentException("completionResetDelay must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>chunkSize: 102 400 chars</li>
     *   <li>interChunkDelay: 50ms</li>
     *   <li>confirmationTimeout: 60s</li>
     *   <li>completionResetDelay: 3s</li>
     * </ul>
     */
    public static PeerSyncTimingPolicy defaults() {
        return new PeerSyncTimingPolicy(
                PayloadChunks.DEFAULT_CHUNK_SIZE,
                Duration.ofMillis(50),
                Duration.ofSeconds(60),
                Duration.ofSeconds(3)
        );
    }

    public PeerSyncTimingPolicy withChunkSize(int newChunkSize) {
        return new PeerSyncTimingPolicy(newChunkSize, interChunkDelay, confirmationTimeout, completionResetDelay);
    }
}

package com.questrail.matchsync.peer.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * PeerTransportSettings
 * -----------------------------------------------------------------------------
 * Operational limits for a {@link PeerTransport}.
 *
 * <ul>
 *   <li><b>initTimeout</b>: how long {@code hostSession()} waits for the
 *       listening endpoint to open.</li>
 *   <li><b>connectTimeout</b>: how long {@code joinSession()} waits for the
 *       channel to the host to open.</li>
 *   <li><b>maxFrameBytes</b>: largest single message accepted on the wire.</li>
 *   <li><b>maxCodeAttempts</b>: fresh codes tried before giving up on collisions.</li>
 * </ul>
 */
public record PeerTransportSettings(
        Duration initTimeout,
        Duration connectTimeout,
        int maxFrameBytes,
        int maxCodeAttempts
) {
    public PeerTransportSettings {
        Objects.requireNonNull(initTimeout, "initTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (initTimeout.isNegative() || initTimeout.isZero()) {
            throw new IllegalArgumentException("initTimeout must be positive");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        if (maxCodeAttempts <= 0) {
            throw new IllegalArgumentException("maxCodeAttempts must be positive");
        }
    }

    /**
     * 15 s init and connect timeouts, 8 MiB frames, 5 code attempts.
     */
    public static PeerTransportSettings defaults() {
        return new PeerTransportSettings(
                Duration.ofSeconds(15),
                Duration.ofSeconds(15),
                8 * 1024 * 1024,
                5
        );
    }
}

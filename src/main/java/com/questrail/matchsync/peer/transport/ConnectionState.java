package com.questrail.matchsync.peer.transport;

import java.util.Optional;

/**
 * Current condition of a {@link PeerTransport}, independent of any sync
 * operation running on top of it.
 *
 * @param connecting {@code true} while a session is being opened or a host waits for its first peer
 * @param connected  {@code true} while at least one channel is open
 * @param error      last human-readable transport error, or {@code null}
 * @param code       connection code of the session, or {@code null}
 * @param role       role of this side, or {@code null} before any session
 * @param peerCount  number of open channels
 */
public record ConnectionState(
        boolean connecting,
        boolean connected,
        String error,
        String code,
        PeerRole role,
        int peerCount
) {
    public ConnectionState {
        if (peerCount < 0) {
            throw new IllegalArgumentException("peerCount must be >= 0");
        }
    }

    public static ConnectionState idle() {
        return new ConnectionState(false, false, null, null, null, 0);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public ConnectionState opening(PeerRole role, String code) {
        return new ConnectionState(true, false, null, code, role, 0);
    }

    public ConnectionState withPeerCount(int peerCount) {
        return new ConnectionState(connecting && peerCount == 0, peerCount > 0, peerCount > 0 ? null : error,
                code, role, peerCount);
    }

    public ConnectionState withCode(String code) {
        return new ConnectionState(connecting, connected, error, code, role, peerCount);
    }

    public ConnectionState withError(String error) {
        return new ConnectionState(false, connected, error, code, role, peerCount);
    }
}

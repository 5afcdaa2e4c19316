package com.questrail.matchsync.peer.transport;

/**
 * PeerTransport
 * =============================================================================
 * Port for an ad-hoc, directly addressed, reliable and ordered bidirectional
 * channel between devices.
 *
 * <h2>Architectural Role</h2>
 * This is a pure transport surface. It owns connection lifecycle (host, join,
 * code generation, open, close, error) and raw text send/receive. It knows
 * nothing about sync operations.
 *
 * <h2>State machine</h2>
 * <pre>
 *   idle → connecting → { connected | error }
 *   connected → disconnected (channel close, peerCount decremented)
 * </pre>
 *
 * A host may hold several peers at once; {@link #send(String)} broadcasts.
 */
public interface PeerTransport extends AutoCloseable
{
    /**
     * Open a listening session under a freshly generated connection code.
     * Returns once the endpoint is listening; peers may connect afterwards.
     *
     * @return the connection code to share with the joining device
     * @throws PeerTransportException {@code INIT_TIMEOUT} or {@code CODE_COLLISION}
     */
    String hostSession();

    /**
     * Connect to the host published under {@code code}. The code is trimmed
     * and upper-cased first. Returns once the channel is open.
     *
     * @throws PeerTransportException {@code PEER_UNAVAILABLE} or {@code TIMEOUT}
     */
    void joinSession(String code);

    /**
     * Best-effort broadcast to every open channel.
     *
     * @return {@code false} if no channel is open
     */
    boolean send(String message);

    void addListener(PeerTransportListener listener);

    void removeListener(PeerTransportListener listener);

    /**
     * Close every channel and the listening endpoint; state returns to idle.
     */
    void disconnect();

    ConnectionState getState();

    /**
     * Disconnect and release I/O resources. The transport is unusable afterwards.
     */
    @Override
    void close();
}

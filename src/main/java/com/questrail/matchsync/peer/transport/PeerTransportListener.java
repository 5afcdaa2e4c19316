package com.questrail.matchsync.peer.transport;

/**
 * Callbacks from a {@link PeerTransport}.
 *
 * <p>Implementations must not block: callbacks run on the transport's I/O
 * threads. Exceptions thrown from a callback are logged and swallowed by the
 * transport so one faulty listener cannot tear down a channel.</p>
 */
public interface PeerTransportListener
{
    /**
     * The connection state changed.
     */
    void onStateChanged(ConnectionState state);

    /**
     * A complete text message arrived from a peer.
     */
    void onMessage(String message);
}

package com.questrail.matchsync.peer.transport;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * Maps connection codes to host addresses.
 *
 * <p>Stands in for the signalling service that lets two devices find each
 * other once a code has been exchanged.</p>
 */
public interface RendezvousDirectory
{
    /**
     * Publish {@code address} under {@code code}.
     *
     * @return {@code false} if the code is already taken
     */
    boolean register(String code, InetSocketAddress address);

    Optional<InetSocketAddress> resolve(String code);

    void unregister(String code);
}

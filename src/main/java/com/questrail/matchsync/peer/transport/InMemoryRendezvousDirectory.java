package com.questrail.matchsync.peer.transport;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local {@link RendezvousDirectory}. Sufficient when both transports
 * live in the same JVM (tests, LAN tooling sharing one directory).
 */
public final class InMemoryRendezvousDirectory implements RendezvousDirectory
{
    private final ConcurrentMap<String, InetSocketAddress> entries = new ConcurrentHashMap<>();

    @Override
    public boolean register(String code, InetSocketAddress address) {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(address, "address");
        return entries.putIfAbsent(code, address) == null;
    }

    @Override
    public Optional<InetSocketAddress> resolve(String code) {
        return Optional.ofNullable(entries.get(Objects.requireNonNull(code, "code")));
    }

    @Override
    public void unregister(String code) {
        entries.remove(Objects.requireNonNull(code, "code"));
    }
}

package com.questrail.matchsync.peer.transport;

/**
 * Which side opened the session.
 */
public enum PeerRole
{
    /** Published a connection code and accepts incoming peers. */
    HOST,

    /** Connected to a host by typing its code. */
    JOINER
}

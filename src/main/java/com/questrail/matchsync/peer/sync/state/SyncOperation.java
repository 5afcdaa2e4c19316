package com.questrail.matchsync.peer.sync.state;

import java.time.Instant;
import java.util.Objects;

/**
 * The one operation an engine may hold at a time.
 *
 * @param id        operation id echoed by every message of the exchange
 * @param kind      pull (requester receives) or push (requester sends)
 * @param role      whether this side issued the request
 * @param startedAt wall-clock start, for the duration in the completion message
 */
public record SyncOperation(String id, Kind kind, Role role, Instant startedAt)
{
    public enum Kind { PULL, PUSH }

    public enum Role { REQUESTER, RESPONDER }

    public enum Direction { INCOMING, OUTGOING }

    public SyncOperation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(startedAt, "startedAt");
    }

    /**
     * Direction the snapshot travels, seen from this side.
     */
    public Direction direction() {
        boolean pullRequester = kind == Kind.PULL && role == Role.REQUESTER;
        boolean pushResponder = kind == Kind.PUSH && role == Role.RESPONDER;
        return pullRequester || pushResponder ? Direction.INCOMING : Direction.OUTGOING;
    }
}

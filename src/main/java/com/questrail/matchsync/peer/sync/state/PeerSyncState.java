package com.questrail.matchsync.peer.sync.state;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PeerSyncState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the peer sync engine's logical state.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>An operation is present exactly when the phase is busy.</li>
 *   <li>Buffered chunks only exist while {@code TRANSFERRING} an incoming snapshot.</li>
 * </ul>
 */
public final class PeerSyncState
{
    private static final PeerSyncState IDLE = new PeerSyncState(OperationPhase.IDLE, null, Map.of(), 0);

    private final OperationPhase phase;
    private final SyncOperation operation;
    private final Map<Integer, String> chunks;
    private final int expectedChunks;

    private PeerSyncState(OperationPhase phase,
                          SyncOperation operation,
                          Map<Integer, String> chunks,
                          int expectedChunks) {
        this.phase = Objects.requireNonNull(phase, "phase");
        if (phase.isBusy() != (operation != null)) {
            throw new IllegalArgumentException("phase " + phase + " with operation " + operation);
        }
        this.operation = operation;
        this.chunks = Map.copyOf(chunks);
        this.expectedChunks = expectedChunks;
    }

    public static PeerSyncState idle() {
        return IDLE;
    }

    /**
     * Failed state: the operation is released, the phase records the failure.
     */
    public static PeerSyncState failed() {
        return new PeerSyncState(OperationPhase.ERROR, null, Map.of(), 0);
    }

    public static PeerSyncState of(OperationPhase phase, SyncOperation operation) {
        return new PeerSyncState(phase, operation, Map.of(), 0);
    }

    public OperationPhase phase() {
        return phase;
    }

    public Optional<SyncOperation> operation() {
        return Optional.ofNullable(operation);
    }

    public boolean isBusy() {
        return phase.isBusy();
    }

    /**
     * Whether {@code operationId} names the operation currently held.
     */
    public boolean isCurrent(String operationId) {
        return operation != null && operation.id().equals(operationId);
    }

    public Map<Integer, String> chunks() {
        return chunks;
    }

    public int expectedChunks() {
        return expectedChunks;
    }

    public PeerSyncState withPhase(OperationPhase newPhase) {
        return new PeerSyncState(newPhase, operation, newPhase == OperationPhase.TRANSFERRING ? chunks : Map.of(),
                newPhase == OperationPhase.TRANSFERRING ? expectedChunks : 0);
    }

    public PeerSyncState withChunk(int chunkId, int totalChunks, String text) {
        Map<Integer, String> updated = new HashMap<>(chunks);
        updated.put(chunkId, text);
        return new PeerSyncState(phase, operation, updated, totalChunks);
    }

    @Override
    public String toString() {
        return "PeerSyncState[" + phase + (operation != null ? ", " + operation.id() : "")
                + (expectedChunks > 0 ? ", " + chunks.size() + "/" + expectedChunks + " chunks" : "") + "]";
    }
}

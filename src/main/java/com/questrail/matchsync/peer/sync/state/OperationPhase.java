package com.questrail.matchsync.peer.sync.state;

/**
 * Lifecycle phase of the peer sync engine.
 *
 * <pre>
 *   IDLE ──request──▶ AWAITING_CONFIRMATION ──confirm──▶ TRANSFERRING
 *   IDLE ──peer request──▶ PENDING_CONFIRMATION ──confirm──▶ TRANSFERRING
 *   TRANSFERRING ──data complete──▶ PROCESSING ──merged──▶ COMPLETE ──reset──▶ IDLE
 *   TRANSFERRING ──sent──▶ COMPLETE
 *   any busy phase ──peer error / disconnect──▶ ERROR
 * </pre>
 */
public enum OperationPhase
{
    IDLE,
    AWAITING_CONFIRMATION,
    PENDING_CONFIRMATION,
    TRANSFERRING,
    PROCESSING,
    COMPLETE,
    ERROR;

    /**
     * Whether an operation holds the engine. {@code COMPLETE} stays busy until
     * the completion reset fires so the result remains visible.
     */
    public boolean isBusy() {
        return switch (this) {
            case AWAITING_CONFIRMATION, PENDING_CONFIRMATION, TRANSFERRING, PROCESSING, COMPLETE -> true;
            case IDLE, ERROR -> false;
        };
    }
}

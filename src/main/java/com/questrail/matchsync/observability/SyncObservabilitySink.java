package com.questrail.matchsync.observability;

/**
 * Main interface for receiving sync observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface SyncObservabilitySink
{
    /**
     * Called after every peer sync reducer step.
     * @param event the transition event details
     */
    void onStateTransition(PeerSyncTransitionEvent event);

    /**
     * Called when input was ignored or a protocol anomaly was tolerated.
     * @param event the protocol event
     */
    void onProtocolEvent(SyncProtocolEvent event);

    /**
     * Called when the peer transport changes state.
     * @param event the transport event
     */
    void onTransportEvent(SyncTransportEvent event);

    /**
     * Called when an error or anomaly occurs in the sync stack.
     * @param event the error event
     */
    void onError(SyncErrorEvent event);
}

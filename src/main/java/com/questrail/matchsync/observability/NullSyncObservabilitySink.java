package com.questrail.matchsync.observability;

/**
 * No-op implementation of SyncObservabilitySink.
 */
public final class NullSyncObservabilitySink implements SyncObservabilitySink
{
    public static final NullSyncObservabilitySink INSTANCE = new NullSyncObservabilitySink();

    private NullSyncObservabilitySink() {}

    @Override
    public void onStateTransition(PeerSyncTransitionEvent event) {}

    @Override
    public void onProtocolEvent(SyncProtocolEvent event) {}

    @Override
    public void onTransportEvent(SyncTransportEvent event) {}

    @Override
    public void onError(SyncErrorEvent event) {}
}

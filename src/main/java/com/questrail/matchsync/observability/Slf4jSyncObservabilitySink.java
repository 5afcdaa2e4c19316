package com.questrail.matchsync.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SyncObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSyncObservabilitySink implements SyncObservabilitySink
{
    private static final Logger log = LoggerFactory.getLogger(Slf4jSyncObservabilitySink.class);

    @Override
    public void onStateTransition(PeerSyncTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.info("Peer sync: {} -> {} on {}",
                event.oldState(),
                event.newState(),
                event.triggeringEvent());
        } else if (log.isDebugEnabled()) {
            log.debug("Peer sync: {} handled in {}", event.triggeringEvent(), event.newState());
        }
    }

    @Override
    public void onProtocolEvent(SyncProtocolEvent event) {
        log.debug("Sync Protocol Event: {}", event);
    }

    @Override
    public void onTransportEvent(SyncTransportEvent event) {
        log.info("Peer Transport Event: {}", event.state());
    }

    @Override
    public void onError(SyncErrorEvent event) {
        log.error("Sync Error: {}", event.message(), event.cause());
    }
}

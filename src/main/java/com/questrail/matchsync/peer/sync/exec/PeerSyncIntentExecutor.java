package com.questrail.matchsync.peer.sync.exec;

import com.questrail.matchsync.peer.sync.state.PeerSyncIntents;

/**
 * PeerSyncIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure peer sync state machine and the impure
 * world of transports, record stores and timers.
 *
 * <h2>Role in the architecture</h2>
 * {@code PeerSyncIntentExecutor} is responsible for <em>realizing</em> the
 * intents produced by the
 * {@link com.questrail.matchsync.peer.sync.state.PeerSyncReducer}.
 *
 * It is the ONLY layer allowed to:
 * <ul>
 *   <li>send protocol messages</li>
 *   <li>export from and merge into the record store</li>
 *   <li>start or cancel timers</li>
 * </ul>
 *
 * Outcomes are never returned. They are reported back to the engine as
 * {@code PeerSyncEvent}s.
 */
public interface PeerSyncIntentExecutor
{
    /**
     * Execute the supplied intents in order. Must not block on the peer.
     *
     * @param intents immutable list of actions to perform
     */
    void execute(PeerSyncIntents intents);
}

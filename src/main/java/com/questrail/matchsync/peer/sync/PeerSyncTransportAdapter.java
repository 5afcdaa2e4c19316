package com.questrail.matchsync.peer.sync;

import com.questrail.matchsync.observability.SyncObservabilitySink;
import com.questrail.matchsync.observability.SyncProtocolEvent;
import com.questrail.matchsync.observability.SyncTransportEvent;
import com.questrail.matchsync.peer.protocol.SyncMessage;
import com.questrail.matchsync.peer.protocol.SyncMessageCodec;
import com.questrail.matchsync.peer.protocol.SyncMessageDecodeException;
import com.questrail.matchsync.peer.sync.events.PeerLinkEvent;
import com.questrail.matchsync.peer.sync.events.PeerMessageEvent;
import com.questrail.matchsync.peer.sync.events.PeerSyncEvent;
import com.questrail.matchsync.peer.transport.ConnectionState;
import com.questrail.matchsync.peer.transport.PeerTransportListener;
import com.questrail.matchsync.time.WallClock;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * PeerSyncTransportAdapter
 * =============================================================================
 * Translates transport callbacks into peer sync events.
 *
 * <h2>Inbound path (decode-before-event)</h2>
 * <pre>
 *   PeerTransport.onMessage(String)
 *        → SyncMessageCodec.decode
 *            → PeerMessageEvent.MessageReceived
 *                → PeerSyncEngine
 * </pre>
 *
 * Transport defects are handled as transport defects: text that does not
 * decode is dropped here and never becomes protocol semantics.
 *
 * <h2>Link loss</h2>
 * A drop in peer count, or a transition from connected to not connected,
 * becomes a {@link PeerLinkEvent.PeerDisconnected}.
 */
public final class PeerSyncTransportAdapter implements PeerTransportListener
{
    private final SyncMessageCodec codec;
    private final Consumer<PeerSyncEvent> eventSink;
    private final WallClock wallClock;
    private final SyncObservabilitySink observability;

    private int lastPeerCount;
    private boolean lastConnected;

    public PeerSyncTransportAdapter(SyncMessageCodec codec,
                                    Consumer<PeerSyncEvent> eventSink,
                                    WallClock wallClock,
                                    SyncObservabilitySink observability)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    @Override
    public void onMessage(String text) {
        final SyncMessage message;
        try {
            message = codec.decode(text);
        } catch (SyncMessageDecodeException e) {
            observability.onProtocolEvent(new SyncProtocolEvent(wallClock.now(), null,
                    "dropped undecodable message: " + e.getMessage()));
            return;
        }
        eventSink.accept(new PeerMessageEvent.MessageReceived(wallClock.now(), message));
    }

    @Override
    public void onStateChanged(ConnectionState state) {
        observability.onTransportEvent(new SyncTransportEvent(wallClock.now(), state));

        final boolean lost;
        synchronized (this) {
            lost = state.peerCount() < lastPeerCount || (lastConnected && !state.connected());
            lastPeerCount = state.peerCount();
            lastConnected = state.connected();
        }
        if (lost) {
            eventSink.accept(new PeerLinkEvent.PeerDisconnected(wallClock.now()));
        }
    }
}

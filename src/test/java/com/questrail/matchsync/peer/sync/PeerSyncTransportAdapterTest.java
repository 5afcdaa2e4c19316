package com.questrail.matchsync.peer.sync;

import com.questrail.matchsync.observability.RecordingSyncObservabilitySink;
import com.questrail.matchsync.observability.SyncProtocolEvent;
import com.questrail.matchsync.observability.SyncTransportEvent;
import com.questrail.matchsync.peer.protocol.SyncMessageCodec;
import com.questrail.matchsync.peer.protocol.SyncMessageType;
import com.questrail.matchsync.peer.sync.events.PeerLinkEvent;
import com.questrail.matchsync.peer.sync.events.PeerMessageEvent;
import com.questrail.matchsync.peer.sync.events.PeerSyncEvent;
import com.questrail.matchsync.peer.transport.ConnectionState;
import com.questrail.matchsync.peer.transport.PeerRole;
import com.questrail.matchsync.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeerSyncTransportAdapterTest {

    private List<PeerSyncEvent> events;
    private RecordingSyncObservabilitySink sink;
    private PeerSyncTransportAdapter adapter;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        sink = new RecordingSyncObservabilitySink();
        adapter = new PeerSyncTransportAdapter(new SyncMessageCodec(), events::add,
                new ManualWallClock(Instant.parse("2024-05-01T10:00:00Z")), sink);
    }

    @Test
    void decodedMessagesBecomeEvents() {
        adapter.onMessage("{\"type\":\"REQUEST_DATA\",\"operationId\":\"op-1\"}");

        assertEquals(1, events.size());
        PeerMessageEvent.MessageReceived received = (PeerMessageEvent.MessageReceived) events.get(0);
        assertEquals(SyncMessageType.REQUEST_DATA, received.message().type());
    }

    @Test
    void undecodableTextIsDroppedAndRecorded() {
        adapter.onMessage("garbage");

        assertTrue(events.isEmpty());
        assertTrue(sink.hasEventOfType(SyncProtocolEvent.class));
    }

    @Test
    void peerCountDropBecomesDisconnect() {
        ConnectionState hosting = ConnectionState.idle().opening(PeerRole.HOST, "ABC123");

        adapter.onStateChanged(hosting);
        adapter.onStateChanged(hosting.withPeerCount(2));
        adapter.onStateChanged(hosting.withPeerCount(1));

        assertEquals(1, events.size());
        assertInstanceOf(PeerLinkEvent.PeerDisconnected.class, events.get(0));
        assertEquals(3, sink.eventsOf(SyncTransportEvent.class).size());
    }

    @Test
    void connectingWithoutPeersIsNotALoss() {
        adapter.onStateChanged(ConnectionState.idle().opening(PeerRole.JOINER, "ABC123"));
        adapter.onStateChanged(ConnectionState.idle());

        assertTrue(events.isEmpty());
    }
}

package com.questrail.matchsync.peer.sync.exec;

import com.questrail.matchsync.api.RecordStoreGateway;
import com.questrail.matchsync.api.Snapshot;
import com.questrail.matchsync.api.SyncProgressListener;
import com.questrail.matchsync.observability.SyncErrorEvent;
import com.questrail.matchsync.observability.SyncObservabilitySink;
import com.questrail.matchsync.observability.SyncProtocolEvent;
import com.questrail.matchsync.peer.protocol.PayloadChunks;
import com.questrail.matchsync.peer.protocol.SnapshotCodec;
import com.questrail.matchsync.peer.protocol.SyncMessage;
import com.questrail.matchsync.peer.protocol.SyncMessageCodec;
import com.questrail.matchsync.peer.sync.events.PeerSyncEvent;
import com.questrail.matchsync.peer.sync.events.TimerEvent;
import com.questrail.matchsync.peer.sync.events.TransferEvent;
import com.questrail.matchsync.peer.sync.state.PeerSyncIntents;
import com.questrail.matchsync.peer.transport.PeerTransport;
import com.questrail.matchsync.time.Cancellable;
import com.questrail.matchsync.time.MonotonicClock;
import com.questrail.matchsync.time.MonotonicScheduler;
import com.questrail.matchsync.time.WallClock;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * TransportPeerSyncIntentExecutor
 * =============================================================================
 * Production intent executor: realizes reducer intents against a
 * {@link PeerTransport}, a {@link RecordStoreGateway} and a
 * {@link MonotonicScheduler}.
 *
 * <h2>Outbound wiring flow</h2>
 * <pre>
 *   PeerSyncIntents
 *      ↓ consumed by
 *   TransportPeerSyncIntentExecutor   (this class)
 *      ↓ encodes with
 *   SyncMessageCodec
 *      ↓
 *   PeerTransport.send(String)
 * </pre>
 *
 * <h2>Feedback</h2>
 * Every outcome re-enters the state machine as an event through the supplied
 * event sink: {@code ChunkSent}, {@code TransmissionFinished},
 * {@code TransferFailed}, {@code MergeFinished}, {@code MergeFailed} and the
 * two timer events. Events emitted from inside {@link #execute} are queued by
 * the engine and processed after the current step.
 *
 * <h2>Chunk pacing</h2>
 * The first chunk goes out immediately; each following chunk is scheduled
 * {@code interChunkDelay} after the previous one. A transmission stops as soon
 * as it is aborted or replaced; scheduled chunks of a stale transmission do
 * nothing.
 */
public final class TransportPeerSyncIntentExecutor implements PeerSyncIntentExecutor, AutoCloseable
{
    private final PeerTransport transport;
    private final SyncMessageCodec messageCodec;
    private final SnapshotCodec snapshotCodec;
    private final RecordStoreGateway gateway;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final PeerSyncTimingPolicy timing;
    private final Consumer<PeerSyncEvent> eventSink;
    private final SyncProgressListener progressSink;
    private final SyncObservabilitySink observability;

    private volatile Transmission activeTransmission;
    private Cancellable confirmationTimeout;
    private Cancellable completionReset;

    public TransportPeerSyncIntentExecutor(PeerTransport transport,
                                           SyncMessageCodec messageCodec,
                                           SnapshotCodec snapshotCodec,
                                           RecordStoreGateway gateway,
                                           MonotonicScheduler scheduler,
                                           MonotonicClock clock,
                                           WallClock wallClock,
                                           PeerSyncTimingPolicy timing,
                                           Consumer<PeerSyncEvent> eventSink,
                                           SyncProgressListener progressSink,
                                           SyncObservabilitySink observability)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.messageCodec = Objects.requireNonNull(messageCodec, "messageCodec");
        this.snapshotCodec = Objects.requireNonNull(snapshotCodec, "snapshotCodec");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.progressSink = Objects.requireNonNull(progressSink, "progressSink");
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    @Override
    public void execute(PeerSyncIntents intents)
    {
        Objects.requireNonNull(intents, "intents");

        for (PeerSyncIntents.Action action : intents.actions()) {
            switch (action.kind()) {
                case SEND_MESSAGE -> sendMessage(((PeerSyncIntents.SendMessage) action).message());
                case TRANSMIT_SNAPSHOT -> transmit(((PeerSyncIntents.TransmitSnapshot) action).operationId());
                case ABORT_TRANSMISSION -> abortTransmission();
                case MERGE_SNAPSHOT -> merge((PeerSyncIntents.MergeSnapshot) action);
                case REPORT_PROGRESS -> reportProgress((PeerSyncIntents.ReportProgress) action);
                case ARM_CONFIRMATION_TIMEOUT ->
                        armConfirmationTimeout(((PeerSyncIntents.ArmConfirmationTimeout) action).operationId());
                case CANCEL_CONFIRMATION_TIMEOUT -> cancelConfirmationTimeout();
                case SCHEDULE_RESET -> scheduleReset(((PeerSyncIntents.ScheduleReset) action).operationId());
                case DISCARD -> observability.onProtocolEvent(
                        new SyncProtocolEvent(wallClock.now(), null, ((PeerSyncIntents.Discard) action).reason()));
            }
        }
    }

    /**
     * Cancel timers and stop any transmission in flight.
     */
    @Override
    public synchronized void close() {
        abortTransmission();
        cancelConfirmationTimeout();
        if (completionReset != null) {
            completionReset.cancel();
            completionReset = null;
        }
    }

    // ---------------------------------------------------------------------
    // Messages
    // ---------------------------------------------------------------------

    private void sendMessage(SyncMessage message) {
        if (trySend(message)) {
            return;
        }
        switch (message.type()) {
            case CANCEL, ERROR, INFO, REQUEST_REJECT, SEND_DATA_REJECT -> observability.onProtocolEvent(
                    new SyncProtocolEvent(wallClock.now(), message.operationId(),
                            "best-effort " + message.type() + " not delivered"));
            default -> eventSink.accept(new TransferEvent.TransferFailed(wallClock.now(), message.operationId(),
                    "Cannot send data: not connected to any peers"));
        }
    }

    private boolean trySend(SyncMessage message) {
        try {
            return transport.send(messageCodec.encode(message));
        } catch (RuntimeException e) {
            observability.onError(new SyncErrorEvent(wallClock.now(), "Failed to send " + message.type(), e));
            return false;
        }
    }

    // ---------------------------------------------------------------------
    // Outgoing snapshot
    // ---------------------------------------------------------------------

    private void transmit(String operationId) {
        final Snapshot snapshot;
        final String text;
        try {
            snapshot = gateway.exportAll();
            text = snapshotCodec.serialize(snapshot);
        } catch (RuntimeException e) {
            observability.onError(new SyncErrorEvent(wallClock.now(), "Export failed for " + operationId, e));
            eventSink.accept(new TransferEvent.TransferFailed(wallClock.now(), operationId, describe(e)));
            return;
        }

        if (!PayloadChunks.requiresChunking(text, timing.chunkSize())) {
            if (!trySend(SyncMessage.data(operationId, snapshotCodec.toTree(snapshot)))) {
                eventSink.accept(new TransferEvent.TransferFailed(wallClock.now(), operationId,
                        "Cannot send data: not connected to any peers"));
                return;
            }
            eventSink.accept(new TransferEvent.TransmissionFinished(wallClock.now(), operationId,
                    1, text.length(), false));
            return;
        }

        Transmission transmission = new Transmission(operationId,
                PayloadChunks.split(text, timing.chunkSize()), text.length());
        abortTransmission();
        activeTransmission = transmission;
        sendChunk(transmission, 0);
    }

    private void sendChunk(Transmission t, int index) {
        if (activeTransmission != t || t.aborted) {
            return;
        }

        int total = t.chunks.size();
        if (!trySend(SyncMessage.chunk(t.operationId, index, total, t.chunks.get(index)))) {
            activeTransmission = null;
            eventSink.accept(new TransferEvent.TransferFailed(wallClock.now(), t.operationId,
                    "Cannot send data: not connected to any peers"));
            return;
        }

        eventSink.accept(new TransferEvent.ChunkSent(wallClock.now(), t.operationId, index + 1, total));

        if (index + 1 == total) {
            activeTransmission = null;
            eventSink.accept(new TransferEvent.TransmissionFinished(wallClock.now(), t.operationId,
                    total, t.payloadLength, true));
            return;
        }

        t.pending = scheduler.scheduleAfter(timing.interChunkDelay(), clock, () -> sendChunk(t, index + 1));
    }

    private void abortTransmission() {
        Transmission t = activeTransmission;
        activeTransmission = null;
        if (t != null) {
            t.abort();
        }
    }

    // ---------------------------------------------------------------------
    // Incoming snapshot
    // ---------------------------------------------------------------------

    private void merge(PeerSyncIntents.MergeSnapshot action) {
        String operationId = action.operationId();
        try {
            final Snapshot snapshot;
            final int length;
            if (action.tree() != null) {
                snapshot = snapshotCodec.fromTree(action.tree());
                length = action.tree().toString().length();
            } else {
                snapshot = snapshotCodec.parse(action.text());
                length = action.text().length();
            }

            if (!gateway.mergeData(snapshot)) {
                eventSink.accept(new TransferEvent.MergeFailed(wallClock.now(), operationId,
                        "record store rejected the data"));
                return;
            }
            eventSink.accept(new TransferEvent.MergeFinished(wallClock.now(), operationId, length));
        } catch (RuntimeException e) {
            observability.onError(new SyncErrorEvent(wallClock.now(), "Merge failed for " + operationId, e));
            eventSink.accept(new TransferEvent.MergeFailed(wallClock.now(), operationId, describe(e)));
        }
    }

    // ---------------------------------------------------------------------
    // Progress and timers
    // ---------------------------------------------------------------------

    private void reportProgress(PeerSyncIntents.ReportProgress action) {
        try {
            progressSink.onProgress(action.progress());
        } catch (RuntimeException e) {
            observability.onError(new SyncErrorEvent(wallClock.now(), "Progress listener failed", e));
        }
    }

    private synchronized void armConfirmationTimeout(String operationId) {
        cancelConfirmationTimeout();
        confirmationTimeout = scheduler.scheduleAfter(timing.confirmationTimeout(), clock,
                () -> eventSink.accept(new TimerEvent.ConfirmationTimedOut(wallClock.now(), operationId)));
    }

    private synchronized void cancelConfirmationTimeout() {
        if (confirmationTimeout != null) {
            confirmationTimeout.cancel();
            confirmationTimeout = null;
        }
    }

    private synchronized void scheduleReset(String operationId) {
        if (completionReset != null) {
            completionReset.cancel();
        }
        completionReset = scheduler.scheduleAfter(timing.completionResetDelay(), clock,
                () -> eventSink.accept(new TimerEvent.ResetElapsed(wallClock.now(), operationId)));
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * One outgoing chunked snapshot.
     */
    private static final class Transmission {
        final String operationId;
        final List<String> chunks;
        final int payloadLength;

        volatile boolean aborted;
        volatile Cancellable pending;

        Transmission(String operationId, List<String> chunks, int payloadLength) {
            this.operationId = operationId;
            this.chunks = chunks;
            this.payloadLength = payloadLength;
        }

        void abort() {
            aborted = true;
            Cancellable p = pending;
            if (p != null) {
                p.cancel();
            }
        }
    }
}

package com.questrail.matchsync.peer.sync.state;

import com.questrail.matchsync.api.SyncProgress.Status;
import com.questrail.matchsync.peer.protocol.MissingChunkException;
import com.questrail.matchsync.peer.protocol.PayloadChunks;
import com.questrail.matchsync.peer.protocol.SyncMessage;
import com.questrail.matchsync.peer.protocol.SyncMessageType;
import com.questrail.matchsync.peer.sync.events.LocalCommandEvent;
import com.questrail.matchsync.peer.sync.events.PeerLinkEvent;
import com.questrail.matchsync.peer.sync.events.PeerMessageEvent;
import com.questrail.matchsync.peer.sync.events.PeerSyncEvent;
import com.questrail.matchsync.peer.sync.events.TimerEvent;
import com.questrail.matchsync.peer.sync.events.TransferEvent;
import com.questrail.matchsync.peer.sync.state.PeerSyncIntents.AbortTransmission;
import com.questrail.matchsync.peer.sync.state.PeerSyncIntents.ArmConfirmationTimeout;
import com.questrail.matchsync.peer.sync.state.PeerSyncIntents.CancelConfirmationTimeout;
import com.questrail.matchsync.peer.sync.state.PeerSyncIntents.MergeSnapshot;
import com.questrail.matchsync.peer.sync.state.PeerSyncIntents.ScheduleReset;
import com.questrail.matchsync.peer.sync.state.PeerSyncIntents.TransmitSnapshot;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * PeerSyncReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for the peer sync handshake.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link PeerSyncState} and a single {@link PeerSyncEvent}, the
 * reducer computes:
 * <ul>
 *   <li>a new {@link PeerSyncState}</li>
 *   <li>the {@link PeerSyncIntents} the executor must carry out</li>
 * </ul>
 *
 * It never sends, exports, merges or schedules anything itself. Progress
 * reports are intents as well, so the full observable behavior of a sync
 * operation can be asserted without a transport.
 *
 * <h2>Rules enforced here</h2>
 * <ul>
 *   <li>At most one operation: local requests while busy are discarded,
 *       remote requests while busy are rejected with "Sync already in progress".</li>
 *   <li>Messages naming another operation are discarded.</li>
 *   <li>A failure frees the operation; a completion frees it only after the
 *       reset delay.</li>
 * </ul>
 */
public final class PeerSyncReducer
{
    static final String BUSY_REASON = "Sync already in progress";

    /**
     * Result of applying an event to a sync state.
     *
     * @param newState the updated state
     * @param intents  effects to be executed by the caller
     */
    public record Result(PeerSyncState newState, PeerSyncIntents intents) {}

    /**
     * Applies a single event to the current state.
     *
     * @param state the current state (must not be {@code null})
     * @param event the event to apply (must not be {@code null})
     * @return the resulting state and intents
     */
    public Result apply(PeerSyncState state, PeerSyncEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof LocalCommandEvent.PullRequested e) {
            return onLocalRequest(state, e.operationId(), SyncOperation.Kind.PULL, e);
        }
        if (event instanceof LocalCommandEvent.PushRequested e) {
            return onLocalRequest(state, e.operationId(), SyncOperation.Kind.PUSH, e);
        }
        if (event instanceof LocalCommandEvent.PendingConfirmed) {
            return onPendingConfirmed(state);
        }
        if (event instanceof LocalCommandEvent.PendingRejected e) {
            return onPendingRejected(state, e);
        }
        if (event instanceof LocalCommandEvent.CancelRequested) {
            return onCancelRequested(state);
        }
        if (event instanceof PeerMessageEvent.MessageReceived e) {
            return onMessageReceived(state, e);
        }
        if (event instanceof PeerLinkEvent.PeerDisconnected) {
            return onPeerDisconnected(state);
        }
        if (event instanceof TimerEvent.ConfirmationTimedOut e) {
            return onConfirmationTimedOut(state, e);
        }
        if (event instanceof TimerEvent.ResetElapsed e) {
            return onResetElapsed(state, e);
        }
        if (event instanceof TransferEvent.ChunkSent e) {
            return onChunkSent(state, e);
        }
        if (event instanceof TransferEvent.TransmissionFinished e) {
            return onTransmissionFinished(state, e);
        }
        if (event instanceof TransferEvent.TransferFailed e) {
            return onTransferFailed(state, e);
        }
        if (event instanceof TransferEvent.MergeFinished e) {
            return onMergeFinished(state, e);
        }
        if (event instanceof TransferEvent.MergeFailed e) {
            return onMergeFailed(state, e);
        }

        return unchanged(state, "unhandled event " + event);
    }

    // ---------------------------------------------------------------------
    // Local commands
    // ---------------------------------------------------------------------

    private Result onLocalRequest(PeerSyncState state, String operationId,
                                  SyncOperation.Kind kind, PeerSyncEvent e) {
        if (state.isBusy()) {
            return unchanged(state, BUSY_REASON);
        }

        SyncOperation op = new SyncOperation(operationId, kind, SyncOperation.Role.REQUESTER, e.timestamp());
        SyncMessageType type = kind == SyncOperation.Kind.PULL
                ? SyncMessageType.REQUEST_DATA
                : SyncMessageType.SEND_DATA_REQUEST;
        String message = kind == SyncOperation.Kind.PULL
                ? "Requesting data from peer..."
                : "Waiting for peer to accept your data...";

        return new Result(
                PeerSyncState.of(OperationPhase.AWAITING_CONFIRMATION, op),
                PeerSyncIntents.builder()
                        .send(SyncMessage.request(type, operationId))
                        .progress(0, Status.PREPARING, message)
                        .add(new ArmConfirmationTimeout(operationId))
                        .build());
    }

    private Result onPendingConfirmed(PeerSyncState state) {
        if (state.phase() != OperationPhase.PENDING_CONFIRMATION) {
            return unchanged(state, "no request awaiting confirmation");
        }
        SyncOperation op = state.operation().orElseThrow();
        PeerSyncState transferring = state.withPhase(OperationPhase.TRANSFERRING);

        if (op.kind() == SyncOperation.Kind.PULL) {
            // Peer wants our data: confirm, then export and send.
            return new Result(transferring, PeerSyncIntents.builder()
                    .send(SyncMessage.confirm(SyncMessageType.REQUEST_DATA, op.id()))
                    .progress(0, Status.PREPARING, "Preparing database for export...")
                    .add(new TransmitSnapshot(op.id()))
                    .build());
        }
        return new Result(transferring, PeerSyncIntents.builder()
                .send(SyncMessage.confirm(SyncMessageType.SEND_DATA_REQUEST, op.id()))
                .progress(0, Status.RECEIVING, "Waiting for data...")
                .build());
    }

    private Result onPendingRejected(PeerSyncState state, LocalCommandEvent.PendingRejected e) {
        if (state.phase() != OperationPhase.PENDING_CONFIRMATION) {
            return unchanged(state, "no request awaiting confirmation");
        }
        SyncOperation op = state.operation().orElseThrow();
        return new Result(PeerSyncState.idle(), PeerSyncIntents.builder()
                .send(SyncMessage.reject(requestType(op.kind()), op.id(), e.reason()))
                .progress(0, Status.IDLE, "Request declined")
                .build());
    }

    private Result onCancelRequested(PeerSyncState state) {
        if (!state.isBusy()) {
            return unchanged(state, "nothing to cancel");
        }
        if (state.phase() == OperationPhase.COMPLETE) {
            return new Result(PeerSyncState.idle(), PeerSyncIntents.builder()
                    .progress(0, Status.IDLE, "")
                    .build());
        }
        String opId = state.operation().orElseThrow().id();
        return new Result(PeerSyncState.idle(), PeerSyncIntents.builder()
                .send(SyncMessage.cancel(opId))
                .add(new AbortTransmission(opId))
                .add(new CancelConfirmationTimeout())
                .progress(0, Status.IDLE, "Sync cancelled")
                .build());
    }

    // ---------------------------------------------------------------------
    // Peer messages
    // ---------------------------------------------------------------------

    private Result onMessageReceived(PeerSyncState state, PeerMessageEvent.MessageReceived e) {
        SyncMessage message = e.message();

        if (message.type() == SyncMessageType.INFO) {
            return unchanged(state, "info: " + message.payloadText().orElse(""));
        }
        if (message.type().isRequest()) {
            return onIncomingRequest(state, message, e);
        }
        if (message.operationId() == null || !state.isCurrent(message.operationId())) {
            return unchanged(state, "unknown operation id " + message.operationId() + " for " + message.type());
        }

        return switch (message.type()) {
            case REQUEST_CONFIRM, SEND_DATA_CONFIRM -> onConfirm(state, message);
            case REQUEST_REJECT, SEND_DATA_REJECT -> onReject(state, message);
            case DATA -> onData(state, message);
            case CHUNK -> onChunk(state, message);
            case ERROR -> onPeerError(state, message);
            case CANCEL -> onPeerCancel(state);
            default -> unchanged(state, "unexpected " + message.type());
        };
    }

    private Result onIncomingRequest(PeerSyncState state, SyncMessage message, PeerSyncEvent e) {
        String opId = message.operationId();
        if (opId == null) {
            return unchanged(state, message.type() + " without operation id");
        }
        if (state.isBusy()) {
            return new Result(state, PeerSyncIntents.builder()
                    .send(SyncMessage.reject(message.type(), opId, BUSY_REASON))
                    .build());
        }

        boolean pull = message.type() == SyncMessageType.REQUEST_DATA;
        SyncOperation op = new SyncOperation(opId,
                pull ? SyncOperation.Kind.PULL : SyncOperation.Kind.PUSH,
                SyncOperation.Role.RESPONDER,
                e.timestamp());

        return new Result(
                PeerSyncState.of(OperationPhase.PENDING_CONFIRMATION, op),
                PeerSyncIntents.builder()
                        .progress(0, Status.PENDING_CONFIRMATION,
                                pull ? "Peer is requesting your data" : "Peer wants to send you data")
                        .build());
    }

    private Result onConfirm(PeerSyncState state, SyncMessage message) {
        SyncOperation op = state.operation().orElseThrow();
        if (!awaitingAnswerTo(state, op, message.type() == SyncMessageType.REQUEST_CONFIRM)) {
            return unchanged(state, "unexpected " + message.type() + " in " + state.phase());
        }

        PeerSyncState transferring = state.withPhase(OperationPhase.TRANSFERRING);
        if (op.kind() == SyncOperation.Kind.PULL) {
            return new Result(transferring, PeerSyncIntents.builder()
                    .add(new CancelConfirmationTimeout())
                    .progress(0, Status.RECEIVING, "Peer accepted, waiting for data...")
                    .build());
        }
        return new Result(transferring, PeerSyncIntents.builder()
                .add(new CancelConfirmationTimeout())
                .progress(0, Status.PREPARING, "Preparing database for export...")
                .add(new TransmitSnapshot(op.id()))
                .build());
    }

    private Result onReject(PeerSyncState state, SyncMessage message) {
        SyncOperation op = state.operation().orElseThrow();
        if (!awaitingAnswerTo(state, op, message.type() == SyncMessageType.REQUEST_REJECT)) {
            return unchanged(state, "unexpected " + message.type() + " in " + state.phase());
        }
        String reason = message.payloadText().orElse("no reason given");
        return new Result(PeerSyncState.idle(), PeerSyncIntents.builder()
                .add(new CancelConfirmationTimeout())
                .progress(0, Status.ERROR, "Peer rejected the request: " + reason)
                .build());
    }

    private Result onData(PeerSyncState state, SyncMessage message) {
        if (!receiving(state)) {
            return unchanged(state, "unexpected DATA in " + state.phase());
        }
        if (message.payload() == null || !message.payload().isObject()) {
            return failed("Error processing received data: DATA payload is not an object");
        }
        return new Result(state.withPhase(OperationPhase.PROCESSING), PeerSyncIntents.builder()
                .progress(50, Status.RECEIVING, "Received data, processing...")
                .progress(85, Status.PROCESSING, "Processing and merging data...")
                .add(MergeSnapshot.ofTree(message.operationId(), message.payload()))
                .build());
    }

    private Result onChunk(PeerSyncState state, SyncMessage message) {
        if (!receiving(state)) {
            return unchanged(state, "unexpected CHUNK in " + state.phase());
        }
        String text = message.payloadText().orElse(null);
        if (message.chunkId() == null || message.totalChunks() == null || text == null
                || message.totalChunks() <= 0) {
            return unchanged(state, "malformed CHUNK");
        }

        int total = message.totalChunks();
        PeerSyncState buffered = state.withChunk(message.chunkId(), total, text);
        int received = buffered.chunks().size();

        if (received < total) {
            int percent = (received * 100 / total) * 8 / 10;
            return new Result(buffered, PeerSyncIntents.builder()
                    .progress(percent, Status.RECEIVING, "Receiving data: " + received + "/" + total + " chunks")
                    .build());
        }

        String reassembled;
        try {
            reassembled = PayloadChunks.reassemble(buffered.chunks(), total);
        } catch (MissingChunkException ex) {
            return failed("Error processing received data: " + ex.getMessage());
        }

        return new Result(buffered.withPhase(OperationPhase.PROCESSING), PeerSyncIntents.builder()
                .progress(80, Status.RECEIVING, "Receiving data: " + total + "/" + total + " chunks")
                .progress(85, Status.PROCESSING, "Processing and merging data...")
                .add(MergeSnapshot.ofText(message.operationId(), reassembled))
                .build());
    }

    private Result onPeerError(PeerSyncState state, SyncMessage message) {
        if (state.phase() == OperationPhase.COMPLETE) {
            return unchanged(state, "peer error after completion");
        }
        String opId = state.operation().orElseThrow().id();
        return new Result(PeerSyncState.failed(), PeerSyncIntents.builder()
                .add(new AbortTransmission(opId))
                .add(new CancelConfirmationTimeout())
                .progress(0, Status.ERROR, "Peer error: " + message.payloadText().orElse("unknown error"))
                .build());
    }

    private Result onPeerCancel(PeerSyncState state) {
        if (state.phase() == OperationPhase.COMPLETE) {
            return unchanged(state, "peer cancel after completion");
        }
        String opId = state.operation().orElseThrow().id();
        return new Result(PeerSyncState.idle(), PeerSyncIntents.builder()
                .add(new AbortTransmission(opId))
                .add(new CancelConfirmationTimeout())
                .progress(0, Status.ERROR, "Peer cancelled the sync")
                .build());
    }

    // ---------------------------------------------------------------------
    // Link and timers
    // ---------------------------------------------------------------------

    private Result onPeerDisconnected(PeerSyncState state) {
        if (!state.isBusy() || state.phase() == OperationPhase.COMPLETE) {
            return unchanged(state, "disconnect with no operation in flight");
        }
        String opId = state.operation().orElseThrow().id();
        return new Result(PeerSyncState.failed(), PeerSyncIntents.builder()
                .add(new AbortTransmission(opId))
                .add(new CancelConfirmationTimeout())
                .progress(0, Status.ERROR, "Connection to peer lost")
                .build());
    }

    private Result onConfirmationTimedOut(PeerSyncState state, TimerEvent.ConfirmationTimedOut e) {
        if (!state.isCurrent(e.operationId()) || state.phase() != OperationPhase.AWAITING_CONFIRMATION) {
            return unchanged(state, "stale confirmation timeout " + e.operationId());
        }
        return new Result(PeerSyncState.idle(), PeerSyncIntents.builder()
                .send(SyncMessage.cancel(e.operationId()))
                .progress(0, Status.ERROR, "Peer did not respond to the sync request")
                .build());
    }

    private Result onResetElapsed(PeerSyncState state, TimerEvent.ResetElapsed e) {
        if (!state.isCurrent(e.operationId()) || state.phase() != OperationPhase.COMPLETE) {
            return unchanged(state, "stale reset " + e.operationId());
        }
        return new Result(PeerSyncState.idle(), PeerSyncIntents.none());
    }

    // ---------------------------------------------------------------------
    // Executor outcomes
    // ---------------------------------------------------------------------

    private Result onChunkSent(PeerSyncState state, TransferEvent.ChunkSent e) {
        if (!sending(state, e.operationId())) {
            return unchanged(state, "stale chunk report " + e.operationId());
        }
        int percent = 10 + e.sentChunks() * 80 / e.totalChunks();
        return new Result(state, PeerSyncIntents.builder()
                .progress(percent, Status.SENDING,
                        "Sending data: chunk " + e.sentChunks() + "/" + e.totalChunks())
                .build());
    }

    private Result onTransmissionFinished(PeerSyncState state, TransferEvent.TransmissionFinished e) {
        if (!sending(state, e.operationId())) {
            return unchanged(state, "stale transmission report " + e.operationId());
        }
        String size = PayloadChunks.formatSize(e.payloadLength());
        String message = e.chunked()
                ? "Data sent successfully in " + e.chunkCount() + " chunks (" + size + ")"
                : "Data sent successfully (" + size + ")";
        return new Result(state.withPhase(OperationPhase.COMPLETE), PeerSyncIntents.builder()
                .progress(100, Status.COMPLETE, message)
                .add(new ScheduleReset(e.operationId()))
                .build());
    }

    private Result onTransferFailed(PeerSyncState state, TransferEvent.TransferFailed e) {
        if (!state.isCurrent(e.operationId()) || state.phase() == OperationPhase.COMPLETE) {
            return unchanged(state, "stale transfer failure " + e.operationId());
        }
        return new Result(PeerSyncState.failed(), PeerSyncIntents.builder()
                .send(SyncMessage.error(e.operationId(), e.reason()))
                .add(new AbortTransmission(e.operationId()))
                .progress(0, Status.ERROR, "Error sending data: " + e.reason())
                .build());
    }

    private Result onMergeFinished(PeerSyncState state, TransferEvent.MergeFinished e) {
        if (!state.isCurrent(e.operationId()) || state.phase() != OperationPhase.PROCESSING) {
            return unchanged(state, "stale merge report " + e.operationId());
        }
        SyncOperation op = state.operation().orElseThrow();
        double seconds = Duration.between(op.startedAt(), e.timestamp()).toMillis() / 1000.0;
        String message = String.format(Locale.ROOT, "Data successfully merged in %.1fs (%s)",
                seconds, PayloadChunks.formatSize(e.payloadLength()));
        return new Result(state.withPhase(OperationPhase.COMPLETE), PeerSyncIntents.builder()
                .progress(100, Status.COMPLETE, message)
                .add(new ScheduleReset(e.operationId()))
                .build());
    }

    private Result onMergeFailed(PeerSyncState state, TransferEvent.MergeFailed e) {
        if (!state.isCurrent(e.operationId()) || state.phase() != OperationPhase.PROCESSING) {
            return unchanged(state, "stale merge failure " + e.operationId());
        }
        return failed("Error importing data: " + e.reason());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Result unchanged(PeerSyncState state, String reason) {
        return new Result(state, PeerSyncIntents.discard(reason));
    }

    private static Result failed(String message) {
        return new Result(PeerSyncState.failed(), PeerSyncIntents.builder()
                .progress(0, Status.ERROR, message)
                .build());
    }

    private static SyncMessageType requestType(SyncOperation.Kind kind) {
        return kind == SyncOperation.Kind.PULL ? SyncMessageType.REQUEST_DATA : SyncMessageType.SEND_DATA_REQUEST;
    }

    /**
     * Whether the state waits for an answer to a request of the matching kind.
     */
    private static boolean awaitingAnswerTo(PeerSyncState state, SyncOperation op, boolean pullAnswer) {
        return state.phase() == OperationPhase.AWAITING_CONFIRMATION
                && op.role() == SyncOperation.Role.REQUESTER
                && (op.kind() == SyncOperation.Kind.PULL) == pullAnswer;
    }

    private static boolean receiving(PeerSyncState state) {
        return state.phase() == OperationPhase.TRANSFERRING
                && state.operation().orElseThrow().direction() == SyncOperation.Direction.INCOMING;
    }

    private static boolean sending(PeerSyncState state, String operationId) {
        return state.isCurrent(operationId)
                && state.phase() == OperationPhase.TRANSFERRING
                && state.operation().orElseThrow().direction() == SyncOperation.Direction.OUTGOING;
    }
}

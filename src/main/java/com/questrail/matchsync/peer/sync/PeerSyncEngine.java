package com.questrail.matchsync.peer.sync;

import com.questrail.matchsync.api.RecordStoreGateway;
import com.questrail.matchsync.api.SyncProgress;
import com.questrail.matchsync.api.SyncProgressListener;
import com.questrail.matchsync.observability.NullSyncObservabilitySink;
import com.questrail.matchsync.observability.PeerSyncTransitionEvent;
import com.questrail.matchsync.observability.SyncErrorEvent;
import com.questrail.matchsync.observability.SyncObservabilitySink;
import com.questrail.matchsync.observability.SyncProtocolEvent;
import com.questrail.matchsync.peer.protocol.SnapshotCodec;
import com.questrail.matchsync.peer.protocol.SyncMessageCodec;
import com.questrail.matchsync.peer.sync.events.LocalCommandEvent;
import com.questrail.matchsync.peer.sync.events.PeerSyncEvent;
import com.questrail.matchsync.peer.sync.exec.PeerSyncTimingPolicy;
import com.questrail.matchsync.peer.sync.exec.TransportPeerSyncIntentExecutor;
import com.questrail.matchsync.peer.sync.state.PeerSyncReducer;
import com.questrail.matchsync.peer.sync.state.PeerSyncState;
import com.questrail.matchsync.peer.transport.PeerTransport;
import com.questrail.matchsync.time.Cancellable;
import com.questrail.matchsync.time.MonotonicClock;
import com.questrail.matchsync.time.MonotonicScheduler;
import com.questrail.matchsync.time.WallClock;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * PeerSyncEngine
 * =============================================================================
 * Owner of the peer sync event loop and public face of the peer sync path.
 *
 * <h2>What this class is</h2>
 * <ul>
 *   <li>The composition point for reducer, executor and transport adapter</li>
 *   <li>A serialized, actor-style coordinator: one event at a time</li>
 *   <li>The fan-out point for {@link SyncProgress} updates</li>
 * </ul>
 *
 * <h2>What this class is <em>not</em></h2>
 * <ul>
 *   <li>It does not decode messages (the adapter does)</li>
 *   <li>It does not send, export or merge (the executor does)</li>
 *   <li>It does not decide legality (the reducer does)</li>
 * </ul>
 *
 * <h2>Execution model</h2>
 * <pre>
 *   event → reducer → new state → intents → executor → (feedback events queued)
 * </pre>
 * Events may be submitted from any thread: transport I/O threads, scheduler
 * threads or the caller. The submitting thread drains the queue while holding
 * the engine monitor; events produced during a step are appended and handled
 * by the same drain, after the current step.
 */
public final class PeerSyncEngine implements AutoCloseable
{
    private final PeerTransport transport;
    private final WallClock wallClock;
    private final SyncObservabilitySink observability;
    private final Supplier<String> operationIds;

    private final PeerSyncReducer reducer = new PeerSyncReducer();
    private final TransportPeerSyncIntentExecutor executor;
    private final PeerSyncTransportAdapter adapter;

    private final Deque<PeerSyncEvent> queue = new ArrayDeque<>();
    private final List<SyncProgressListener> listeners = new CopyOnWriteArrayList<>();

    private boolean draining;
    private volatile PeerSyncState state = PeerSyncState.idle();
    private volatile SyncProgress progress = SyncProgress.idle();

    public PeerSyncEngine(PeerTransport transport,
                          RecordStoreGateway gateway,
                          MonotonicScheduler scheduler,
                          MonotonicClock clock,
                          WallClock wallClock,
                          PeerSyncTimingPolicy timing,
                          SyncObservabilitySink observability)
    {
        this(transport, gateway, scheduler, clock, wallClock, timing, observability,
                () -> UUID.randomUUID().toString());
    }

    /**
     * Constructor with an explicit operation id source, for deterministic tests.
     */
    public PeerSyncEngine(PeerTransport transport,
                          RecordStoreGateway gateway,
                          MonotonicScheduler scheduler,
                          MonotonicClock clock,
                          WallClock wallClock,
                          PeerSyncTimingPolicy timing,
                          SyncObservabilitySink observability,
                          Supplier<String> operationIds)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observability = Objects.requireNonNullElse(observability, NullSyncObservabilitySink.INSTANCE);
        this.operationIds = Objects.requireNonNull(operationIds, "operationIds");

        SyncMessageCodec messageCodec = new SyncMessageCodec();
        this.executor = new TransportPeerSyncIntentExecutor(
                transport,
                messageCodec,
                new SnapshotCodec(),
                Objects.requireNonNull(gateway, "gateway"),
                scheduler,
                clock,
                wallClock,
                timing,
                this::submit,
                this::publish,
                this.observability);

        this.adapter = new PeerSyncTransportAdapter(messageCodec, this::submit, wallClock, this.observability);
        transport.addListener(adapter);
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    /**
     * Ask the connected peer for its snapshot.
     *
     * @return the new operation id, or empty if not connected or already busy
     */
    public Optional<String> requestData() {
        return startOperation(true);
    }

    /**
     * Offer the local snapshot to the connected peer.
     *
     * @return the new operation id, or empty if not connected or already busy
     */
    public Optional<String> sendData() {
        return startOperation(false);
    }

    /**
     * Accept the peer's pending request.
     */
    public void confirmPending() {
        submit(new LocalCommandEvent.PendingConfirmed(wallClock.now()));
    }

    /**
     * Decline the peer's pending request.
     *
     * @param reason sent to the peer; {@code null} for the default reason
     */
    public void rejectPending(String reason) {
        submit(new LocalCommandEvent.PendingRejected(wallClock.now(), reason));
    }

    /**
     * Abandon the current operation. The peer is told on a best-effort basis.
     */
    public void cancel() {
        submit(new LocalCommandEvent.CancelRequested(wallClock.now()));
    }

    private Optional<String> startOperation(boolean pull) {
        if (!transport.getState().connected()) {
            publish(SyncProgress.error("Cannot send data: not connected to any peers"));
            return Optional.empty();
        }
        synchronized (this) {
            if (state.isBusy()) {
                observability.onProtocolEvent(new SyncProtocolEvent(wallClock.now(),
                        state.operation().map(op -> op.id()).orElse(null),
                        "refused local " + (pull ? "pull" : "push") + ": sync already in progress"));
                return Optional.empty();
            }
            String operationId = operationIds.get();
            submit(pull
                    ? new LocalCommandEvent.PullRequested(wallClock.now(), operationId)
                    : new LocalCommandEvent.PushRequested(wallClock.now(), operationId));
            return Optional.of(operationId);
        }
    }

    // ---------------------------------------------------------------------
    // Event loop
    // ---------------------------------------------------------------------

    /**
     * Enqueue an event and drain the queue unless a drain is already running
     * on this thread.
     */
    public synchronized void submit(PeerSyncEvent event) {
        Objects.requireNonNull(event, "event");
        queue.addLast(event);
        if (draining) {
            return;
        }
        draining = true;
        try {
            PeerSyncEvent next;
            while ((next = queue.pollFirst()) != null) {
                step(next);
            }
        } finally {
            draining = false;
        }
    }

    private void step(PeerSyncEvent event) {
        PeerSyncState oldState = state;
        final PeerSyncReducer.Result result;
        try {
            result = reducer.apply(oldState, event);
        } catch (RuntimeException e) {
            observability.onError(new SyncErrorEvent(wallClock.now(), "Reducer failed on " + event, e));
            return;
        }
        state = result.newState();

        observability.onStateTransition(new PeerSyncTransitionEvent(
                wallClock.now(), oldState, result.newState(), event, result.intents()));

        if (!result.intents().isEmpty()) {
            try {
                executor.execute(result.intents());
            } catch (RuntimeException e) {
                observability.onError(new SyncErrorEvent(wallClock.now(), "Executor failed on " + event, e));
            }
        }
    }

    // ---------------------------------------------------------------------
    // Observation
    // ---------------------------------------------------------------------

    public PeerSyncState state() {
        return state;
    }

    public SyncProgress progress() {
        return progress;
    }

    public boolean isBusy() {
        return state.isBusy();
    }

    /**
     * Register a progress listener. It receives the current progress at once.
     *
     * @return handle that unregisters the listener
     */
    public Cancellable addProgressListener(SyncProgressListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        notifyListener(listener, progress);
        return () -> listeners.remove(listener);
    }

    private void publish(SyncProgress update) {
        progress = update;
        for (SyncProgressListener listener : listeners) {
            notifyListener(listener, update);
        }
    }

    private void notifyListener(SyncProgressListener listener, SyncProgress update) {
        try {
            listener.onProgress(update);
        } catch (RuntimeException e) {
            observability.onError(new SyncErrorEvent(wallClock.now(), "Progress listener failed", e));
        }
    }

    /**
     * Detach from the transport and stop timers. The transport itself is not closed.
     */
    @Override
    public void close() {
        transport.removeListener(adapter);
        executor.close();
    }
}

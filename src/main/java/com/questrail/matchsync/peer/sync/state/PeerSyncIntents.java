package com.questrail.matchsync.peer.sync.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.matchsync.api.SyncProgress;
import com.questrail.matchsync.peer.protocol.SyncMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * PeerSyncIntents
 * -----------------------------------------------------------------------------
 * Immutable, ordered list of effects requested by the {@link PeerSyncReducer}.
 *
 * <h2>Role in the architecture</h2>
 * {@code PeerSyncIntents} is the bridge between:
 * <ul>
 *   <li>pure, deterministic handshake logic</li>
 *   <li>impure effects: sending messages, exporting, merging, timers</li>
 * </ul>
 *
 * The reducer decides <b>what should happen next</b>; the intent executor
 * decides <b>how</b>. Order matters: actions run in the order they were added,
 * so a confirm message always leaves before the first data chunk.
 */
public final class PeerSyncIntents
{
    /**
     * Kinds of effect the executor knows how to perform.
     */
    public enum Kind {
        /** Encode and send one protocol message. */
        SEND_MESSAGE,

        /** Export the local snapshot and send it as DATA or CHUNKs. */
        TRANSMIT_SNAPSHOT,

        /** Stop an outgoing transmission that is still sending chunks. */
        ABORT_TRANSMISSION,

        /** Validate received data and merge it into the record store. */
        MERGE_SNAPSHOT,

        /** Publish a progress update to observers. */
        REPORT_PROGRESS,

        /** Start waiting for the peer's answer to our request. */
        ARM_CONFIRMATION_TIMEOUT,

        /** Stop waiting for the peer's answer. */
        CANCEL_CONFIRMATION_TIMEOUT,

        /** Return to idle after the completion has been visible for a while. */
        SCHEDULE_RESET,

        /** Input was ignored; record why. */
        DISCARD
    }

    /**
     * One requested effect.
     */
    public sealed interface Action
            permits SendMessage, TransmitSnapshot, AbortTransmission, MergeSnapshot, ReportProgress,
                    ArmConfirmationTimeout, CancelConfirmationTimeout, ScheduleReset, Discard
    {
        Kind kind();
    }

    public record SendMessage(SyncMessage message) implements Action {
        public SendMessage {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public Kind kind() {
            return Kind.SEND_MESSAGE;
        }
    }

    public record TransmitSnapshot(String operationId) implements Action {
        @Override
        public Kind kind() {
            return Kind.TRANSMIT_SNAPSHOT;
        }
    }

    public record AbortTransmission(String operationId) implements Action {
        @Override
        public Kind kind() {
            return Kind.ABORT_TRANSMISSION;
        }
    }

    /**
     * Merge received data. Exactly one of {@code tree} (a {@code DATA} payload)
     * and {@code text} (reassembled chunks) is set.
     */
    public record MergeSnapshot(String operationId, JsonNode tree, String text) implements Action {
        public MergeSnapshot {
            Objects.requireNonNull(operationId, "operationId");
            if ((tree == null) == (text == null)) {
                throw new IllegalArgumentException("exactly one of tree and text must be set");
            }
        }

        public static MergeSnapshot ofTree(String operationId, JsonNode tree) {
            return new MergeSnapshot(operationId, tree, null);
        }

        public static MergeSnapshot ofText(String operationId, String text) {
            return new MergeSnapshot(operationId, null, text);
        }

        @Override
        public Kind kind() {
            return Kind.MERGE_SNAPSHOT;
        }
    }

    public record ReportProgress(SyncProgress progress) implements Action {
        public ReportProgress {
            Objects.requireNonNull(progress, "progress");
        }

        @Override
        public Kind kind() {
            return Kind.REPORT_PROGRESS;
        }
    }

    public record ArmConfirmationTimeout(String operationId) implements Action {
        @Override
        public Kind kind() {
            return Kind.ARM_CONFIRMATION_TIMEOUT;
        }
    }

    public record CancelConfirmationTimeout() implements Action {
        @Override
        public Kind kind() {
            return Kind.CANCEL_CONFIRMATION_TIMEOUT;
        }
    }

    public record ScheduleReset(String operationId) implements Action {
        @Override
        public Kind kind() {
            return Kind.SCHEDULE_RESET;
        }
    }

    public record Discard(String reason) implements Action {
        @Override
        public Kind kind() {
            return Kind.DISCARD;
        }
    }

    private static final PeerSyncIntents NONE = new PeerSyncIntents(List.of());

    private final List<Action> actions;

    private PeerSyncIntents(List<Action> actions) {
        this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
    }

    public List<Action> actions() {
        return actions;
    }

    /**
     * Returns the set of kinds present, ignoring order.
     */
    public Set<Kind> kinds() {
        EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        for (Action a : actions) {
            kinds.add(a.kind());
        }
        return kinds;
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public boolean contains(Kind kind) {
        return actions.stream().anyMatch(a -> a.kind() == kind);
    }

    /**
     * Actions of one type, in order.
     */
    public <T extends Action> List<T> actionsOf(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Action a : actions) {
            if (type.isInstance(a)) {
                result.add(type.cast(a));
            }
        }
        return result;
    }

    // ---------------------------------------------------------------------
    // Builder (test- and reducer-friendly)
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Action> actions = new ArrayList<>();

        private Builder() {}

        public Builder add(Action action) {
            actions.add(Objects.requireNonNull(action, "action"));
            return this;
        }

        public Builder send(SyncMessage message) {
            return add(new SendMessage(message));
        }

        public Builder progress(int percent, SyncProgress.Status status, String message) {
            return add(new ReportProgress(new SyncProgress(percent, status, message)));
        }

        public PeerSyncIntents build() {
            return actions.isEmpty() ? NONE : new PeerSyncIntents(actions);
        }
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    public static PeerSyncIntents none() {
        return NONE;
    }

    public static PeerSyncIntents discard(String reason) {
        return new PeerSyncIntents(List.of(new Discard(reason)));
    }

    @Override
    public String toString() {
        return "PeerSyncIntents" + actions;
    }
}

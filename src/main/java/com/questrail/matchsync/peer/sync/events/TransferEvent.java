package com.questrail.matchsync.peer.sync.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcomes of effects performed by the intent executor, fed back into the
 * state machine.
 */
public sealed interface TransferEvent extends PeerSyncEvent
        permits TransferEvent.ChunkSent,
                TransferEvent.TransmissionFinished,
                TransferEvent.TransferFailed,
                TransferEvent.MergeFinished,
                TransferEvent.MergeFailed
{
    /** One outgoing chunk was handed to the transport. */
    final class ChunkSent extends PeerSyncEvent.OperationBound implements TransferEvent {
        private final int sentChunks;
        private final int totalChunks;

        public ChunkSent(Instant timestamp, String operationId, int sentChunks, int totalChunks) {
            super(timestamp, operationId);
            this.sentChunks = sentChunks;
            this.totalChunks = totalChunks;
        }

        public int sentChunks() {
            return sentChunks;
        }

        public int totalChunks() {
            return totalChunks;
        }
    }

    /** The whole snapshot was handed to the transport. */
    final class TransmissionFinished extends PeerSyncEvent.OperationBound implements TransferEvent {
        private final int chunkCount;
        private final int payloadLength;
        private final boolean chunked;

        public TransmissionFinished(Instant timestamp, String operationId,
                                    int chunkCount, int payloadLength, boolean chunked) {
            super(timestamp, operationId);
            this.chunkCount = chunkCount;
            this.payloadLength = payloadLength;
            this.chunked = chunked;
        }

        public int chunkCount() {
            return chunkCount;
        }

        public int payloadLength() {
            return payloadLength;
        }

        public boolean chunked() {
            return chunked;
        }
    }

    /** Exporting or sending failed. */
    final class TransferFailed extends PeerSyncEvent.OperationBound implements TransferEvent {
        private final String reason;

        public TransferFailed(Instant timestamp, String operationId, String reason) {
            super(timestamp, operationId);
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public String reason() {
            return reason;
        }
    }

    /** Received data was validated and merged. */
    final class MergeFinished extends PeerSyncEvent.OperationBound implements TransferEvent {
        private final int payloadLength;

        public MergeFinished(Instant timestamp, String operationId, int payloadLength) {
            super(timestamp, operationId);
            this.payloadLength = payloadLength;
        }

        public int payloadLength() {
            return payloadLength;
        }
    }

    /** Received data was invalid or the store refused it. */
    final class MergeFailed extends PeerSyncEvent.OperationBound implements TransferEvent {
        private final String reason;

        public MergeFailed(Instant timestamp, String operationId, String reason) {
            super(timestamp, operationId);
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public String reason() {
            return reason;
        }
    }
}

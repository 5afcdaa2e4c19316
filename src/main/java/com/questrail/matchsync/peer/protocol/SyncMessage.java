package com.questrail.matchsync.peer.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Objects;
import java.util.Optional;

/**
 * One peer sync protocol message.
 *
 * <p>Wire shape: {@code {type, operationId?, payload?, chunkId?, totalChunks?, isLast?}}.
 * Every message except {@link SyncMessageType#INFO} echoes the operation id of
 * the request that opened the exchange.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncMessage(
        SyncMessageType type,
        String operationId,
        JsonNode payload,
        Integer chunkId,
        Integer totalChunks,
        @JsonProperty("isLast") Boolean isLast
) {
    public SyncMessage {
        Objects.requireNonNull(type, "type");
    }

    public static SyncMessage request(SyncMessageType type, String operationId) {
        if (!type.isRequest()) {
            throw new IllegalArgumentException(type + " is not a request");
        }
        return new SyncMessage(type, Objects.requireNonNull(operationId, "operationId"), null, null, null, null);
    }

    public static SyncMessage confirm(SyncMessageType requestType, String operationId) {
        return new SyncMessage(requestType.confirmation(), operationId, null, null, null, null);
    }

    public static SyncMessage reject(SyncMessageType requestType, String operationId, String reason) {
        return new SyncMessage(requestType.rejection(), operationId, TextNode.valueOf(reason), null, null, null);
    }

    public static SyncMessage data(String operationId, JsonNode snapshot) {
        return new SyncMessage(SyncMessageType.DATA, operationId, Objects.requireNonNull(snapshot, "snapshot"),
                null, null, null);
    }

    public static SyncMessage chunk(String operationId, int chunkId, int totalChunks, String text) {
        return new SyncMessage(SyncMessageType.CHUNK, operationId, TextNode.valueOf(text),
                chunkId, totalChunks, chunkId == totalChunks - 1);
    }

    public static SyncMessage error(String operationId, String reason) {
        return new SyncMessage(SyncMessageType.ERROR, operationId, TextNode.valueOf(reason), null, null, null);
    }

    public static SyncMessage info(String text) {
        return new SyncMessage(SyncMessageType.INFO, null, TextNode.valueOf(text), null, null, null);
    }

    public static SyncMessage cancel(String operationId) {
        return new SyncMessage(SyncMessageType.CANCEL, operationId, null, null, null, null);
    }

    /**
     * Payload as text, for reasons, chunk fragments and info messages.
     */
    public Optional<String> payloadText() {
        return payload != null && payload.isTextual() ? Optional.of(payload.asText()) : Optional.empty();
    }
}

package com.questrail.matchsync.peer.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.matchsync.api.Json;

import java.util.Objects;

/**
 * SyncMessageCodec
 * -----------------------------------------------------------------------------
 * JSON text codec for {@link SyncMessage}.
 *
 * <p>Decoding is strict about the envelope: the text must be a JSON object
 * whose {@code type} names a known {@link SyncMessageType}. Chunk messages must
 * carry {@code chunkId}, {@code totalChunks} and a text payload with
 * {@code 0 <= chunkId < totalChunks}. Anything else is a
 * {@link SyncMessageDecodeException}.</p>
 */
public final class SyncMessageCodec
{
    private final ObjectMapper mapper;

    public SyncMessageCodec() {
        this(Json.mapper());
    }

    public SyncMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encode(SyncMessage message) {
        Objects.requireNonNull(message, "message");
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.type(), e);
        }
    }

    public SyncMessage decode(String text) {
        Objects.requireNonNull(text, "text");

        final JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new SyncMessageDecodeException("Malformed JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SyncMessageDecodeException("Message is not a JSON object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new SyncMessageDecodeException("Message has no type");
        }
        final SyncMessageType type;
        try {
            type = SyncMessageType.valueOf(typeNode.asText());
        } catch (IllegalArgumentException e) {
            throw new SyncMessageDecodeException("Unknown message type: " + typeNode.asText(), e);
        }

        final SyncMessage message;
        try {
            message = mapper.treeToValue(root, SyncMessage.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SyncMessageDecodeException("Invalid " + type + " message", e);
        }

        if (type == SyncMessageType.CHUNK) {
            validateChunk(message);
        }
        return message;
    }

    private static void validateChunk(SyncMessage m) {
        if (m.chunkId() == null || m.totalChunks() == null || m.payloadText().isEmpty()) {
            throw new SyncMessageDecodeException("CHUNK requires chunkId, totalChunks and a text payload");
        }
        if (m.totalChunks() <= 0 || m.chunkId() < 0 || m.chunkId() >= m.totalChunks()) {
            throw new SyncMessageDecodeException(
                    "CHUNK index out of range: " + m.chunkId() + "/" + m.totalChunks());
        }
    }
}

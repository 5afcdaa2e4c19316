package com.questrail.matchsync.peer.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.matchsync.api.Json;
import com.questrail.matchsync.api.Snapshot;

import java.util.List;
import java.util.Objects;

/**
 * SnapshotCodec
 * -----------------------------------------------------------------------------
 * Serializes a {@link Snapshot} to its single-string wire form and validates
 * received snapshots before anything reaches the record store.
 *
 * <h2>Validation</h2>
 * A received snapshot must be a JSON object with {@code players},
 * {@code matches} and {@code matchPlayers} each present and array-shaped, and
 * every record must bind to its Java type.
 */
public final class SnapshotCodec
{
    static final List<String> REQUIRED_COLLECTIONS = List.of("players", "matches", "matchPlayers");

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this(Json.mapper());
    }

    public SnapshotCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String serialize(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot", e);
        }
    }

    /**
     * Snapshot as a JSON tree, for embedding in a {@code DATA} message.
     */
    public JsonNode toTree(Snapshot snapshot) {
        return mapper.valueToTree(Objects.requireNonNull(snapshot, "snapshot"));
    }

    public Snapshot parse(String text) {
        Objects.requireNonNull(text, "text");
        final JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException("Invalid data format: not valid JSON", e);
        }
        return fromTree(root);
    }

    public Snapshot fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new SnapshotFormatException("Invalid data format: expected an object");
        }
        for (String field : REQUIRED_COLLECTIONS) {
            JsonNode node = root.get(field);
            if (node == null || node.isNull()) {
                throw new SnapshotFormatException("Invalid data format: missing " + field);
            }
            if (!node.isArray()) {
                throw new SnapshotFormatException("Invalid data format: " + field + " is not an array");
            }
        }
        try {
            return mapper.treeToValue(root, Snapshot.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SnapshotFormatException("Invalid data format: " + e.getMessage(), e);
        }
    }
}

package com.questrail.matchsync.prefs;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.matchsync.api.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JsonFilePreferenceStore
 * =============================================================================
 * {@link PreferenceStore} persisted as a flat JSON object of strings.
 *
 * <p>The whole file is loaded on construction and rewritten on every change
 * through a temporary sibling file followed by an atomic move, so a crash
 * never leaves a half-written file behind.</p>
 */
public final class JsonFilePreferenceStore implements PreferenceStore
{
    private static final ObjectMapper MAPPER = Json.mapper();
    private static final TypeReference<LinkedHashMap<String, String>> TYPE_REF = new TypeReference<>() {};

    private final Path file;
    private final Map<String, String> values;

    public JsonFilePreferenceStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        this.values = load(file);
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(values.get(Objects.requireNonNull(key, "key")));
    }

    @Override
    public synchronized void put(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (value.equals(values.get(key))) {
            return;
        }
        values.put(key, value);
        flush();
    }

    @Override
    public synchronized void remove(String key) {
        if (values.remove(Objects.requireNonNull(key, "key")) != null) {
            flush();
        }
    }

    private static Map<String, String> load(Path file) {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, String> loaded = MAPPER.readValue(file.toFile(), TYPE_REF);
            return loaded != null ? loaded : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new PreferenceStoreException("Failed to read preferences from " + file, e);
        }
    }

    private void flush() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), values);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PreferenceStoreException("Failed to write preferences to " + file, e);
        }
    }
}

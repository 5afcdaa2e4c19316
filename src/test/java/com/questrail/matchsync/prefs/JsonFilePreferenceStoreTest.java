package com.questrail.matchsync.prefs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonFilePreferenceStoreTest {

    @TempDir
    Path dir;

    @Test
    void valuesSurviveReopening() {
        Path file = dir.resolve("nested").resolve("prefs.json");

        JsonFilePreferenceStore first = new JsonFilePreferenceStore(file);
        first.put("device-id", "device_abc");
        first.put("cloud.auto-upload", "false");
        first.remove("cloud.auto-upload");

        JsonFilePreferenceStore reopened = new JsonFilePreferenceStore(file);
        assertEquals(Optional.of("device_abc"), reopened.get("device-id"));
        assertEquals(Optional.empty(), reopened.get("cloud.auto-upload"));
        assertFalse(Files.exists(file.resolveSibling("prefs.json.tmp")));
    }

    @Test
    void missingFileStartsEmpty() {
        JsonFilePreferenceStore store = new JsonFilePreferenceStore(dir.resolve("absent.json"));

        assertTrue(store.get("anything").isEmpty());
        assertFalse(Files.exists(dir.resolve("absent.json")));
    }

    @Test
    void corruptFileIsReported() throws IOException {
        Path file = dir.resolve("prefs.json");
        Files.write(file, "{oops".getBytes(StandardCharsets.UTF_8));

        assertThrows(PreferenceStoreException.class, () -> new JsonFilePreferenceStore(file));
    }
}

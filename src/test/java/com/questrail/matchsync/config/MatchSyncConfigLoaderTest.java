package com.questrail.matchsync.config;

import com.questrail.matchsync.cloud.CloudSyncTimingPolicy;
import com.questrail.matchsync.peer.sync.exec.PeerSyncTimingPolicy;
import com.questrail.matchsync.peer.transport.PeerTransportSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MatchSyncConfigLoaderTest
 * -----------------------------------------------------------------------------
 * Built-in defaults, partial overrides and rejection of bad input.
 */
class MatchSyncConfigLoaderTest {

    @TempDir
    Path dir;

    private Path write(String json) throws IOException {
        Path file = dir.resolve("matchsync.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void defaultsMatchBuiltInPolicies() {
        MatchSyncConfig config = MatchSyncConfigLoader.load();

        assertEquals(PeerSyncTimingPolicy.defaults(), config.peerTiming());
        assertEquals(PeerTransportSettings.defaults(), config.transport());
        assertEquals(InetAddress.getLoopbackAddress(), config.bindHost());
        assertNull(config.preferencesFile());
        assertTrue(config.cloudConfig().isEmpty());
    }

    @Test
    void overrideOnlyChangesNamedKeys() throws IOException {
        Path file = write("{\"preferencesFile\":\"prefs.json\",\"peer\":{\"chunkSize\":4096}}");

        MatchSyncConfig config = MatchSyncConfigLoader.load(file);

        assertEquals(Path.of("prefs.json"), config.preferencesFile());
        assertEquals(4096, config.peerTiming().chunkSize());
        assertEquals(Duration.ofSeconds(60), config.peerTiming().confirmationTimeout());
        assertEquals(Duration.ofMillis(50), config.peerTiming().interChunkDelay());
    }

    @Test
    void enabledCloudSectionIsParsed() throws IOException {
        Path file = write("{\"cloud\":{\"enabled\":true,\"baseUrl\":\"https://example.test\","
                + "\"apiKey\":\"anon\",\"pollIntervalMs\":10000}}");

        CloudConfig cloud = MatchSyncConfigLoader.load(file).cloudConfig().orElseThrow();

        assertEquals(URI.create("https://example.test"), cloud.baseUrl());
        assertEquals("anon", cloud.apiKey());
        assertEquals(new CloudSyncTimingPolicy(Duration.ofSeconds(3), Duration.ofSeconds(2),
                Duration.ofSeconds(10)), cloud.timing());
        assertEquals(Duration.ofSeconds(30), cloud.requestTimeout());
    }

    @Test
    void enabledCloudWithoutKeyIsRejected() throws IOException {
        Path file = write("{\"cloud\":{\"enabled\":true,\"baseUrl\":\"https://example.test\"}}");

        MatchSyncConfigException e = assertThrows(MatchSyncConfigException.class,
                () -> MatchSyncConfigLoader.load(file));
        assertTrue(e.getMessage().contains("cloud.apiKey"));
    }

    @Test
    void invalidValuesAreReportedAsConfigErrors() throws IOException {
        Path file = write("{\"peer\":{\"chunkSize\":0}}");

        assertThrows(MatchSyncConfigException.class, () -> MatchSyncConfigLoader.load(file));
    }

    @Test
    void malformedJsonIsRejected() throws IOException {
        Path file = write("{\"peer\": ");

        assertThrows(MatchSyncConfigException.class, () -> MatchSyncConfigLoader.load(file));
    }

    @Test
    void nonObjectRootIsRejected() throws IOException {
        Path file = write("[1, 2, 3]");

        MatchSyncConfigException e = assertThrows(MatchSyncConfigException.class,
                () -> MatchSyncConfigLoader.load(file));
        assertTrue(e.getMessage().contains("JSON object"));
    }

    @Test
    void missingFileIsRejected() {
        assertThrows(MatchSyncConfigException.class,
                () -> MatchSyncConfigLoader.load(dir.resolve("absent.json")));
    }

    @Test
    void deepMergeReplacesLeavesAndKeepsSiblings() throws IOException {
        MatchSyncConfig config = MatchSyncConfigLoader.load(write("{\"peer\":{\"bindHost\":\"127.0.0.2\"}}"));

        assertEquals(InetAddress.getByName("127.0.0.2"), config.bindHost());
        assertEquals(PeerTransportSettings.defaults(), config.transport());
    }
}

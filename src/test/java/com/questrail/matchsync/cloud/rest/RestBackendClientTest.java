package com.questrail.matchsync.cloud.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.matchsync.api.Json;
import com.questrail.matchsync.cloud.BackendException;
import com.questrail.matchsync.cloud.CloudMatchRow;
import com.questrail.matchsync.cloud.CloudPlayerRow;
import com.questrail.matchsync.cloud.FixedAccountSession;
import com.questrail.matchsync.cloud.RowFilter;
import com.questrail.matchsync.cloud.TombstoneRow;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RestBackendClientTest
 * -----------------------------------------------------------------------------
 * Request shape and response handling of the REST backend client against a
 * loopback HTTP server.
 */
class RestBackendClientTest {

    private static final Instant SYNCED = Instant.parse("2024-06-01T12:00:00Z");

    /**
     * One request as seen by the server.
     */
    record Seen(String method, String path, String query, String apiKey, String authorization,
                String prefer, String body) {}

    private HttpServer server;
    private final List<Seen> seen = new CopyOnWriteArrayList<>();
    private volatile int status = 200;
    private volatile String responseBody = "[]";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        seen.add(new Seen(exchange.getRequestMethod(),
                exchange.getRequestURI().getPath(),
                exchange.getRequestURI().getQuery(),
                exchange.getRequestHeaders().getFirst("apikey"),
                exchange.getRequestHeaders().getFirst("Authorization"),
                exchange.getRequestHeaders().getFirst("Prefer"),
                body));
        byte[] out = responseBody.getBytes(StandardCharsets.UTF_8);
        if (out.length == 0) {
            exchange.sendResponseHeaders(status, -1);
        } else {
            exchange.sendResponseHeaders(status, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        }
        exchange.close();
    }

    private RestBackendClient client(FixedAccountSession session) {
        return RestBackendClient.builder()
                .baseUrl(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/"))
                .apiKey("anon-key")
                .session(session)
                .requestTimeout(Duration.ofSeconds(5))
                .build();
    }

    private RestBackendClient client() {
        return client(FixedAccountSession.signedIn("user-1", "token-1"));
    }

    private static CloudPlayerRow player(String owner, String id) {
        return new CloudPlayerRow(owner, id, "Ann", 3, 2, 1, 1210.0, null, null, null,
                null, SYNCED, "device_a", 2, "local", SYNCED);
    }

    private Seen last() {
        assertFalse(seen.isEmpty(), "no request reached the server");
        return seen.get(seen.size() - 1);
    }

    // ---------------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------------

    @Test
    void upsertPostsRowWithConflictTargetAndMergePreference() throws Exception {
        status = 201;
        responseBody = "";

        client().upsertPlayer(player("user-1", "p-1"));

        Seen req = last();
        assertEquals("POST", req.method());
        assertEquals("/rest/v1/cloud_players", req.path());
        assertEquals("on_conflict=owner_id,local_id", req.query());
        assertEquals("anon-key", req.apiKey());
        assertEquals("Bearer token-1", req.authorization());
        assertEquals("resolution=merge-duplicates,return=minimal", req.prefer());

        JsonNode body = Json.mapper().readTree(req.body());
        assertEquals("p-1", body.get("local_id").asText());
        assertEquals("user-1", body.get("owner_id").asText());
        assertFalse(body.has("mu"));
    }

    @Test
    void signedOutRequestsUseTheApiKeyAsBearer() {
        status = 201;
        responseBody = "";

        client(FixedAccountSession.signedOut()).upsertTombstone(
                new TombstoneRow("user-1", "m-1", SYNCED, "device_a"));

        Seen req = last();
        assertEquals("/rest/v1/deleted_matches", req.path());
        assertEquals("on_conflict=owner_id,match_id", req.query());
        assertEquals("Bearer anon-key", req.authorization());
    }

    @Test
    void deleteMatchTargetsOwnerAndId() {
        status = 204;
        responseBody = "";

        client().deleteMatch("user-1", "m-9");

        Seen req = last();
        assertEquals("DELETE", req.method());
        assertEquals("/rest/v1/cloud_matches", req.path());
        assertEquals("owner_id=eq.user-1&id=eq.m-9", req.query());
    }

    @Test
    void touchLastSyncPatchesProfile() {
        status = 204;
        responseBody = "";

        client().touchLastSync("user-1", SYNCED);

        Seen req = last();
        assertEquals("PATCH", req.method());
        assertEquals("/rest/v1/profiles", req.path());
        assertEquals("id=eq.user-1", req.query());
        assertEquals("{\"last_sync_at\":\"2024-06-01T12:00:00Z\"}", req.body());
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    @Test
    void selectForOneOwnerUsesEquality() {
        responseBody = "[{\"owner_id\":\"user-1\",\"local_id\":\"p-1\",\"name\":\"Ann\",\"total_games\":3,"
                + "\"wins\":2,\"losses\":1,\"elo\":1210,\"device_id\":\"device_a\",\"extra\":true}]";

        List<CloudPlayerRow> rows = client().selectPlayers(RowFilter.ownedBy("user-1"));

        assertEquals("select=*&owner_id=eq.user-1", last().query());
        assertEquals(1, rows.size());
        assertEquals("p-1", rows.get(0).localId());
        assertEquals(1210.0, rows.get(0).elo());
    }

    @Test
    void selectForSeveralOwnersUsesInListAndDeviceExclusion() {
        client().selectMatches(RowFilter.ownedByAny(Set.of("user-1", "friend-1")).excludingDevice("device_a"));

        Seen req = last();
        assertEquals("/rest/v1/cloud_matches", req.path());
        assertEquals("select=*&owner_id=in.(\"friend-1\",\"user-1\")&device_id=neq.device_a", req.query());
    }

    @Test
    void tombstoneAndFriendIdsAreUnwrapped() {
        responseBody = "[{\"match_id\":\"m-1\"},{\"match_id\":\"m-2\"}]";
        assertEquals(List.of("m-1", "m-2"), client().selectTombstonedMatchIds("user-1"));
        assertEquals("select=match_id&owner_id=eq.user-1", last().query());

        responseBody = "[{\"friend_id\":\"friend-1\"}]";
        assertEquals(List.of("friend-1"), client().selectFriendIds("user-1"));
        assertEquals("/rest/v1/friends", last().path());
        assertEquals("select=friend_id&user_id=eq.user-1", last().query());
    }

    @Test
    void changedMatchesAreSelectedAfterCursorOldestFirst() {
        responseBody = "[{\"id\":\"m-1\",\"owner_id\":\"user-1\",\"device_id\":\"device_b\","
                + "\"synced_at\":\"2024-06-01T12:00:05Z\"}]";

        List<CloudMatchRow> rows = client().selectMatchesSyncedAfter(SYNCED);

        assertEquals("select=id,owner_id,device_id,synced_at&synced_at=gt.2024-06-01T12:00:00Z"
                + "&order=synced_at.asc", last().query());
        assertEquals(Instant.parse("2024-06-01T12:00:05Z"), rows.get(0).syncedAt());
    }

    @Test
    void emptyBodyReadsAsNoRows() {
        responseBody = "";

        assertTrue(client().selectMatchPlayers(RowFilter.ownedBy("user-1")).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void errorStatusBecomesBackendExceptionWithStatus() {
        status = 409;
        responseBody = "{\"message\":\"conflict\"}";

        BackendException e = assertThrows(BackendException.class,
                () -> client().upsertPlayer(player("user-1", "p-1")));

        assertEquals(409, e.status());
        assertTrue(e.getMessage().contains("conflict"));
    }

    @Test
    void malformedResponseBecomesBackendException() {
        responseBody = "not json";

        BackendException e = assertThrows(BackendException.class,
                () -> client().selectPlayers(RowFilter.ownedBy("user-1")));

        assertEquals(BackendException.NO_STATUS, e.status());
    }

    @Test
    void changeFeedNeedsAScheduler() {
        assertThrows(IllegalStateException.class, () -> client().subscribeMatchChanges(change -> { }));
    }
}

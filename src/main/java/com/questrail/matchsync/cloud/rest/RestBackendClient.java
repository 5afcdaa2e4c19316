package com.questrail.matchsync.cloud.rest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.matchsync.api.Json;
import com.questrail.matchsync.cloud.AccountSession;
import com.questrail.matchsync.cloud.BackendClient;
import com.questrail.matchsync.cloud.BackendException;
import com.questrail.matchsync.cloud.CloudMatchPlayerRow;
import com.questrail.matchsync.cloud.CloudMatchRow;
import com.questrail.matchsync.cloud.CloudPlayerRow;
import com.questrail.matchsync.cloud.MatchChangeNotification;
import com.questrail.matchsync.cloud.RowFilter;
import com.questrail.matchsync.cloud.TombstoneRow;
import com.questrail.matchsync.time.Cancellable;
import com.questrail.matchsync.time.MonotonicClock;
import com.questrail.matchsync.time.MonotonicScheduler;
import com.questrail.matchsync.time.SystemMonotonicClock;
import com.questrail.matchsync.time.SystemWallClock;
import com.questrail.matchsync.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Consumer;

/**
 * RestBackendClient
 * =============================================================================
 * {@link BackendClient} over a PostgREST-style HTTP+JSON interface.
 *
 * <h2>Requests</h2>
 * <pre>
 *   POST   /rest/v1/&lt;table&gt;?on_conflict=&lt;cols&gt;    Prefer: resolution=merge-duplicates
 *   GET    /rest/v1/&lt;table&gt;?select=*&amp;owner_id=eq.&lt;id&gt;&amp;device_id=neq.&lt;id&gt;
 *   DELETE /rest/v1/&lt;table&gt;?owner_id=eq.&lt;id&gt;&amp;id=eq.&lt;id&gt;
 *   PATCH  /rest/v1/profiles?id=eq.&lt;id&gt;
 * </pre>
 * Every request carries the project key in {@code apikey} and, in
 * {@code Authorization}, the session's bearer token (or the project key when
 * signed out).
 *
 * <h2>Errors</h2>
 * A status of 300 or above becomes a {@link BackendException} carrying the
 * status. I/O failures and interruption become a {@link BackendException}
 * without status; interruption re-asserts the thread's interrupt flag.
 *
 * <h2>Change feed</h2>
 * {@link #subscribeMatchChanges} starts a {@link PollingMatchChangeFeed}.
 */
public final class RestBackendClient implements BackendClient
{
    private static final Logger log = LoggerFactory.getLogger(RestBackendClient.class);

    static final String PLAYERS = "cloud_players";
    static final String MATCHES = "cloud_matches";
    static final String MATCH_PLAYERS = "cloud_match_players";
    static final String TOMBSTONES = "deleted_matches";
    static final String FRIENDS = "friends";
    static final String PROFILES = "profiles";

    private static final TypeReference<List<CloudPlayerRow>> PLAYER_ROWS = new TypeReference<>() {};
    private static final TypeReference<List<CloudMatchRow>> MATCH_ROWS = new TypeReference<>() {};
    private static final TypeReference<List<CloudMatchPlayerRow>> MATCH_PLAYER_ROWS = new TypeReference<>() {};
    private static final TypeReference<List<MatchIdRow>> MATCH_ID_ROWS = new TypeReference<>() {};
    private static final TypeReference<List<FriendIdRow>> FRIEND_ID_ROWS = new TypeReference<>() {};

    private final String restBase;
    private final String apiKey;
    private final AccountSession session;
    private final HttpClient http;
    private final ObjectMapper mapper;
    private final Duration requestTimeout;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration pollInterval;

    private RestBackendClient(Builder b) {
        String base = Objects.requireNonNull(b.baseUrl, "baseUrl").toString();
        this.restBase = (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/rest/v1/";
        this.apiKey = Objects.requireNonNull(b.apiKey, "apiKey");
        this.session = Objects.requireNonNull(b.session, "session");
        this.http = b.httpClient != null ? b.httpClient : HttpClient.newHttpClient();
        this.mapper = b.mapper != null ? b.mapper : Json.mapper();
        this.requestTimeout = b.requestTimeout;
        this.scheduler = b.scheduler;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.pollInterval = b.pollInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Record rows
    // ---------------------------------------------------------------------

    @Override
    public void upsertPlayer(CloudPlayerRow row) {
        upsert(PLAYERS, "owner_id,local_id", row);
    }

    @Override
    public void upsertMatch(CloudMatchRow row) {
        upsert(MATCHES, "owner_id,id", row);
    }

    @Override
    public void upsertMatchPlayer(CloudMatchPlayerRow row) {
        upsert(MATCH_PLAYERS, "owner_id,id", row);
    }

    @Override
    public List<CloudPlayerRow> selectPlayers(RowFilter filter) {
        return read(get(PLAYERS, select("*").and(filter)), PLAYER_ROWS);
    }

    @Override
    public List<CloudMatchRow> selectMatches(RowFilter filter) {
        return read(get(MATCHES, select("*").and(filter)), MATCH_ROWS);
    }

    @Override
    public List<CloudMatchPlayerRow> selectMatchPlayers(RowFilter filter) {
        return read(get(MATCH_PLAYERS, select("*").and(filter)), MATCH_PLAYER_ROWS);
    }

    @Override
    public void deleteMatchPlayers(String ownerId, String matchId) {
        delete(MATCH_PLAYERS, new Query().eq("owner_id", ownerId).eq("match_id", matchId));
    }

    @Override
    public void deleteMatch(String ownerId, String matchId) {
        delete(MATCHES, new Query().eq("owner_id", ownerId).eq("id", matchId));
    }

    // ---------------------------------------------------------------------
    // Tombstones, friends, profile
    // ---------------------------------------------------------------------

    @Override
    public void upsertTombstone(TombstoneRow row) {
        upsert(TOMBSTONES, "owner_id,match_id", row);
    }

    @Override
    public List<String> selectTombstonedMatchIds(String ownerId) {
        List<MatchIdRow> rows = read(get(TOMBSTONES, select("match_id").eq("owner_id", ownerId)), MATCH_ID_ROWS);
        List<String> ids = new ArrayList<>(rows.size());
        for (MatchIdRow row : rows) {
            ids.add(row.matchId());
        }
        return ids;
    }

    @Override
    public List<String> selectFriendIds(String userId) {
        List<FriendIdRow> rows = read(get(FRIENDS, select("friend_id").eq("user_id", userId)), FRIEND_ID_ROWS);
        List<String> ids = new ArrayList<>(rows.size());
        for (FriendIdRow row : rows) {
            ids.add(row.friendId());
        }
        return ids;
    }

    @Override
    public void touchLastSync(String userId, Instant at) {
        HttpRequest request = request(PROFILES, new Query().eq("id", userId))
                .header("Content-Type", "application/json")
                .method("PATCH", HttpRequest.BodyPublishers.ofString(write(Map.of("last_sync_at", at.toString()))))
                .build();
        send(request, "PATCH " + PROFILES);
    }

    // ---------------------------------------------------------------------
    // Change feed
    // ---------------------------------------------------------------------

    @Override
    public Cancellable subscribeMatchChanges(Consumer<MatchChangeNotification> listener) {
        if (scheduler == null) {
            throw new IllegalStateException("No scheduler configured; match change feed unavailable");
        }
        PollingMatchChangeFeed feed = new PollingMatchChangeFeed(this::selectMatchesSyncedAfter,
                listener, scheduler, clock, pollInterval, wallClock.now());
        feed.start();
        return feed;
    }

    /**
     * Match rows visible to the session whose {@code synced_at} is after
     * {@code cursor}, oldest first.
     */
    public List<CloudMatchRow> selectMatchesSyncedAfter(Instant cursor) {
        Query query = select("id,owner_id,device_id,synced_at")
                .filter("synced_at", "gt." + cursor)
                .filter("order", "synced_at.asc");
        return read(get(MATCHES, query), MATCH_ROWS);
    }

    // ---------------------------------------------------------------------
    // HTTP plumbing
    // ---------------------------------------------------------------------

    private void upsert(String table, String conflictColumns, Object row) {
        HttpRequest request = request(table, new Query().filter("on_conflict", conflictColumns))
                .header("Content-Type", "application/json")
                .header("Prefer", "resolution=merge-duplicates,return=minimal")
                .POST(HttpRequest.BodyPublishers.ofString(write(row)))
                .build();
        send(request, "upsert " + table);
    }

    private String get(String table, Query query) {
        return send(request(table, query).GET().build(), "select " + table);
    }

    private void delete(String table, Query query) {
        send(request(table, query).DELETE().build(), "delete " + table);
    }

    private HttpRequest.Builder request(String table, Query query) {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(restBase + table + query))
                .header("apikey", apiKey)
                .header("Authorization", "Bearer " + session.accessToken().orElse(apiKey))
                .header("Accept", "application/json");
        if (requestTimeout != null) {
            b.timeout(requestTimeout);
        }
        return b;
    }

    private String send(HttpRequest request, String what) {
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 300) {
                throw new BackendException(response.statusCode(),
                        "Backend returned HTTP " + response.statusCode() + " for " + what + ": " + response.body());
            }
            log.trace("{} -> HTTP {}", what, response.statusCode());
            return response.body();
        } catch (IOException e) {
            throw new BackendException("Backend request failed: " + what, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted during backend request: " + what, e);
        }
    }

    private <T> List<T> read(String body, TypeReference<List<T>> type) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            List<T> rows = mapper.readValue(body, type);
            return rows != null ? rows : List.of();
        } catch (JsonProcessingException e) {
            throw new BackendException("Malformed backend response: " + e.getOriginalMessage(), e);
        }
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BackendException("Cannot encode request body", e);
        }
    }

    private static Query select(String columns) {
        return new Query().filter("select", columns);
    }

    /**
     * Query string under construction. Values are URL-encoded.
     */
    static final class Query {
        private final StringJoiner parts = new StringJoiner("&", "?", "").setEmptyValue("");

        Query filter(String column, String expression) {
            parts.add(column + "=" + URLEncoder.encode(expression, StandardCharsets.UTF_8));
            return this;
        }

        Query eq(String column, String value) {
            return filter(column, "eq." + value);
        }

        Query and(RowFilter rowFilter) {
            if (rowFilter.ownerIds().size() == 1) {
                eq("owner_id", rowFilter.ownerIds().iterator().next());
            } else {
                StringJoiner ids = new StringJoiner(",", "in.(", ")");
                rowFilter.ownerIds().stream().sorted().forEach(id -> ids.add("\"" + id + "\""));
                filter("owner_id", ids.toString());
            }
            if (rowFilter.excludeDeviceId() != null) {
                filter("device_id", "neq." + rowFilter.excludeDeviceId());
            }
            return this;
        }

        @Override
        public String toString() {
            return parts.toString();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MatchIdRow(@JsonProperty("match_id") String matchId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FriendIdRow(@JsonProperty("friend_id") String friendId) {}

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private URI baseUrl;
        private String apiKey;
        private AccountSession session;
        private HttpClient httpClient;
        private ObjectMapper mapper;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Duration pollInterval = Duration.ofSeconds(5);

        private Builder() {}

        public Builder baseUrl(URI baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder session(AccountSession session) {
            this.session = session;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * Scheduler driving the polling change feed. Without one,
         * {@link #subscribeMatchChanges} is unavailable.
         */
        public Builder scheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder clock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder wallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            Objects.requireNonNull(pollInterval, "pollInterval");
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            this.pollInterval = pollInterval;
            return this;
        }

        public RestBackendClient build() {
            return new RestBackendClient(this);
        }
    }
}

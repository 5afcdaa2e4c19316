package com.questrail.matchsync.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.matchsync.api.Json;
import com.questrail.matchsync.cloud.CloudSyncTimingPolicy;
import com.questrail.matchsync.peer.sync.exec.PeerSyncTimingPolicy;
import com.questrail.matchsync.peer.transport.PeerTransportSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;

/**
 * MatchSyncConfigLoader
 * =============================================================================
 * Reads {@link MatchSyncConfig} from JSON.
 *
 * <p>Defaults come from the classpath resource {@value #DEFAULTS_RESOURCE}.
 * An override file, when given, is merged over them key by key, so it only
 * needs to name the settings it changes. Unknown keys are ignored.</p>
 *
 * <pre>
 *   {
 *     "preferencesFile": "matchsync-prefs.json",
 *     "peer":  { "bindHost": "0.0.0.0", "chunkSize": 102400, ... },
 *     "cloud": { "enabled": true, "baseUrl": "https://...", "apiKey": "...", ... }
 *   }
 * </pre>
 */
public final class MatchSyncConfigLoader
{
    private static final Logger log = LoggerFactory.getLogger(MatchSyncConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "matchsync-defaults.json";

    private static final ObjectMapper MAPPER = Json.mapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private MatchSyncConfigLoader() {}

    /**
     * Built-in defaults only.
     */
    public static MatchSyncConfig load() {
        return toConfig(readDefaults());
    }

    /**
     * Built-in defaults overridden by {@code overrideFile}.
     */
    public static MatchSyncConfig load(Path overrideFile) {
        final byte[] data;
        try {
            data = Files.readAllBytes(overrideFile);
        } catch (IOException e) {
            throw new MatchSyncConfigException("Cannot read configuration file " + overrideFile, e);
        }
        log.info("Loading configuration from {}", overrideFile);
        return load(data);
    }

    static MatchSyncConfig load(byte[] override) {
        JsonNode overrideTree;
        try {
            overrideTree = MAPPER.readTree(override);
        } catch (IOException e) {
            throw new MatchSyncConfigException("Malformed configuration: " + e.getMessage(), e);
        }
        if (overrideTree == null || overrideTree.isMissingNode()) {
            return load();
        }
        if (!overrideTree.isObject()) {
            throw new MatchSyncConfigException("Configuration root must be a JSON object");
        }
        ObjectNode merged = readDefaults();
        deepMerge(merged, (ObjectNode) overrideTree);
        return toConfig(merged);
    }

    private static ObjectNode readDefaults() {
        try (InputStream in = MatchSyncConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new MatchSyncConfigException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return (ObjectNode) MAPPER.readTree(in.readAllBytes());
        } catch (IOException e) {
            throw new MatchSyncConfigException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    static void deepMerge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject && field.getValue() instanceof ObjectNode incoming) {
                deepMerge(existingObject, incoming);
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    private static MatchSyncConfig toConfig(ObjectNode tree) {
        final RawConfig raw;
        try {
            raw = MAPPER.treeToValue(tree, RawConfig.class);
        } catch (JsonProcessingException e) {
            throw new MatchSyncConfigException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
        try {
            return raw.toConfig();
        } catch (IllegalArgumentException e) {
            throw new MatchSyncConfigException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------------
    // JSON shape
    // ---------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RawConfig(
            @JsonProperty("preferencesFile") String preferencesFile,
            @JsonProperty("peer") RawPeer peer,
            @JsonProperty("cloud") RawCloud cloud
    ) {
        MatchSyncConfig toConfig() {
            if (peer == null) {
                throw new IllegalArgumentException("peer section is required");
            }
            return MatchSyncConfig.builder()
                    .withPreferencesFile(preferencesFile != null ? Path.of(preferencesFile) : null)
                    .withBindHost(address(peer.bindHost()))
                    .withAdvertiseHost(peer.advertiseHost() != null ? address(peer.advertiseHost()) : null)
                    .withTransport(peer.transport())
                    .withPeerTiming(peer.timing())
                    .withCloud(cloud != null && cloud.enabled() ? cloud.toConfig() : null)
                    .build();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RawPeer(
            @JsonProperty("bindHost") String bindHost,
            @JsonProperty("advertiseHost") String advertiseHost,
            @JsonProperty("initTimeoutMs") long initTimeoutMs,
            @JsonProperty("connectTimeoutMs") long connectTimeoutMs,
            @JsonProperty("maxFrameBytes") int maxFrameBytes,
            @JsonProperty("maxCodeAttempts") int maxCodeAttempts,
            @JsonProperty("chunkSize") int chunkSize,
            @JsonProperty("interChunkDelayMs") long interChunkDelayMs,
            @JsonProperty("confirmationTimeoutMs") long confirmationTimeoutMs,
            @JsonProperty("completionResetDelayMs") long completionResetDelayMs
    ) {
        PeerTransportSettings transport() {
            return new PeerTransportSettings(Duration.ofMillis(initTimeoutMs), Duration.ofMillis(connectTimeoutMs),
                    maxFrameBytes, maxCodeAttempts);
        }

        PeerSyncTimingPolicy timing() {
            return new PeerSyncTimingPolicy(chunkSize, Duration.ofMillis(interChunkDelayMs),
                    Duration.ofMillis(confirmationTimeoutMs), Duration.ofMillis(completionResetDelayMs));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RawCloud(
            @JsonProperty("enabled") boolean enabled,
            @JsonProperty("baseUrl") String baseUrl,
            @JsonProperty("apiKey") String apiKey,
            @JsonProperty("uploadDebounceMs") long uploadDebounceMs,
            @JsonProperty("changeDebounceMs") long changeDebounceMs,
            @JsonProperty("pollIntervalMs") long pollIntervalMs,
            @JsonProperty("requestTimeoutMs") long requestTimeoutMs
    ) {
        CloudConfig toConfig() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("cloud.baseUrl is required when cloud sync is enabled");
            }
            if (apiKey == null || apiKey.isBlank()) {
                throw new IllegalArgumentException("cloud.apiKey is required when cloud sync is enabled");
            }
            return new CloudConfig(URI.create(baseUrl), apiKey,
                    new CloudSyncTimingPolicy(Duration.ofMillis(uploadDebounceMs),
                            Duration.ofMillis(changeDebounceMs), Duration.ofMillis(pollIntervalMs)),
                    Duration.ofMillis(requestTimeoutMs));
        }
    }

    private static InetAddress address(String host) {
        if (host == null) {
            throw new IllegalArgumentException("peer.bindHost is required");
        }
        try {
            return InetAddress.getByName(host);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Unknown host: " + host, e);
        }
    }
}

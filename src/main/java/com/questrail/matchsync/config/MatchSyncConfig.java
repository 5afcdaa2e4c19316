package com.questrail.matchsync.config;

import com.questrail.matchsync.peer.sync.exec.PeerSyncTimingPolicy;
import com.questrail.matchsync.peer.transport.PeerTransportSettings;

import java.net.InetAddress;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for {@code MatchSyncRuntime}.
 *
 * @param preferencesFile JSON preference file; {@code null} keeps preferences in memory
 * @param bindHost        interface the peer transport listens on when hosting
 * @param advertiseHost   address published for joining peers; {@code null} means {@code bindHost}
 * @param transport       peer transport limits
 * @param peerTiming      chunking and handshake timing
 * @param cloud           backend settings; {@code null} disables backend sync
 */
public record MatchSyncConfig(
        Path preferencesFile,
        InetAddress bindHost,
        InetAddress advertiseHost,
        PeerTransportSettings transport,
        PeerSyncTimingPolicy peerTiming,
        CloudConfig cloud
) {
    public MatchSyncConfig {
        Objects.requireNonNull(bindHost, "bindHost");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(peerTiming, "peerTiming");
    }

    public Optional<CloudConfig> cloudConfig() {
        return Optional.ofNullable(cloud);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path preferencesFile;
        private InetAddress bindHost = InetAddress.getLoopbackAddress();
        private InetAddress advertiseHost;
        private PeerTransportSettings transport = PeerTransportSettings.defaults();
        private PeerSyncTimingPolicy peerTiming = PeerSyncTimingPolicy.defaults();
        private CloudConfig cloud;

        public Builder withPreferencesFile(Path preferencesFile) {
            this.preferencesFile = preferencesFile;
            return this;
        }

        public Builder withBindHost(InetAddress bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder withAdvertiseHost(InetAddress advertiseHost) {
            this.advertiseHost = advertiseHost;
            return this;
        }

        public Builder withTransport(PeerTransportSettings transport) {
            this.transport = transport;
            return this;
        }

        public Builder withPeerTiming(PeerSyncTimingPolicy peerTiming) {
            this.peerTiming = peerTiming;
            return this;
        }

        public Builder withCloud(CloudConfig cloud) {
            this.cloud = cloud;
            return this;
        }

        public MatchSyncConfig build() {
            return new MatchSyncConfig(preferencesFile, bindHost, advertiseHost, transport, peerTiming, cloud);
        }
    }
}

package com.questrail.matchsync.runtime;

import com.questrail.matchsync.api.DeviceIdentity;
import com.questrail.matchsync.api.RecordStoreGateway;
import com.questrail.matchsync.cloud.AccountSession;
import com.questrail.matchsync.cloud.CloudSyncPreferences;
import com.questrail.matchsync.cloud.CloudSyncService;
import com.questrail.matchsync.cloud.rest.RestBackendClient;
import com.questrail.matchsync.config.CloudConfig;
import com.questrail.matchsync.config.MatchSyncConfig;
import com.questrail.matchsync.observability.Slf4jSyncObservabilitySink;
import com.questrail.matchsync.observability.SyncObservabilitySink;
import com.questrail.matchsync.peer.sync.PeerSyncEngine;
import com.questrail.matchsync.peer.transport.InMemoryRendezvousDirectory;
import com.questrail.matchsync.peer.transport.PeerTransport;
import com.questrail.matchsync.peer.transport.RendezvousDirectory;
import com.questrail.matchsync.peer.transport.netty.NettyPeerTransport;
import com.questrail.matchsync.prefs.InMemoryPreferenceStore;
import com.questrail.matchsync.prefs.JsonFilePreferenceStore;
import com.questrail.matchsync.prefs.PreferenceStore;
import com.questrail.matchsync.store.InMemoryRecordStore;
import com.questrail.matchsync.time.MonotonicClock;
import com.questrail.matchsync.time.MonotonicScheduler;
import com.questrail.matchsync.time.ScheduledExecutorScheduler;
import com.questrail.matchsync.time.SystemMonotonicClock;
import com.questrail.matchsync.time.SystemWallClock;
import com.questrail.matchsync.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * MatchSyncRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the sync stack.
 *
 * <h2>What it wires</h2>
 * <ul>
 *   <li>preference store and the persisted {@link DeviceIdentity}</li>
 *   <li>the record store behind {@link RecordStoreGateway}</li>
 *   <li>{@link NettyPeerTransport} and the {@link PeerSyncEngine} on top of it</li>
 *   <li>when configured and given a session, {@link RestBackendClient} and
 *       {@link CloudSyncService}</li>
 *   <li>a peer scheduler thread for chunk pacing and timeouts</li>
 *   <li>a separate backend thread for debounces and polling; peer timers
 *       never queue behind an HTTP call</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} begins backend change listening. {@link #close()} tears
 * everything down in reverse order and stops both scheduler threads.
 */
public final class MatchSyncRuntime implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(MatchSyncRuntime.class);

    private final DeviceIdentity deviceIdentity;
    private final RecordStoreGateway recordStore;
    private final PeerTransport transport;
    private final PeerSyncEngine peerSync;
    private final CloudSyncService cloudSync;
    private final ScheduledExecutorService peerExecutor;
    private final ScheduledExecutorService cloudExecutor;

    private MatchSyncRuntime(DeviceIdentity deviceIdentity,
                             RecordStoreGateway recordStore,
                             PeerTransport transport,
                             PeerSyncEngine peerSync,
                             CloudSyncService cloudSync,
                             ScheduledExecutorService peerExecutor,
                             ScheduledExecutorService cloudExecutor)
    {
        this.deviceIdentity = deviceIdentity;
        this.recordStore = recordStore;
        this.transport = transport;
        this.peerSync = peerSync;
        this.cloudSync = cloudSync;
        this.peerExecutor = peerExecutor;
        this.cloudExecutor = cloudExecutor;
    }

    public void start() {
        if (cloudSync != null) {
            cloudSync.start();
        }
        log.info("Match sync runtime started for device {}", deviceIdentity.value());
    }

    @Override
    public void close() {
        if (cloudSync != null) {
            cloudSync.close();
        }
        peerSync.close();
        transport.close();
        if (cloudExecutor != null) {
            stop(cloudExecutor);
        }
        stop(peerExecutor);
        log.info("Match sync runtime stopped");
    }

    private static void stop(ScheduledExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ScheduledExecutorService schedulerThread(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public DeviceIdentity deviceIdentity() {
        return deviceIdentity;
    }

    public RecordStoreGateway recordStore() {
        return recordStore;
    }

    public PeerTransport transport() {
        return transport;
    }

    public PeerSyncEngine peerSync() {
        return peerSync;
    }

    public Optional<CloudSyncService> cloudSync() {
        return Optional.ofNullable(cloudSync);
    }

    ScheduledExecutorService peerExecutor() {
        return peerExecutor;
    }

    Optional<ScheduledExecutorService> cloudExecutor() {
        return Optional.ofNullable(cloudExecutor);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MatchSyncConfig config;
        private PreferenceStore preferences;
        private BiFunction<DeviceIdentity, WallClock, RecordStoreGateway> recordStoreFactory = InMemoryRecordStore::new;
        private RendezvousDirectory rendezvous;
        private AccountSession session;
        private SyncObservabilitySink observabilitySink = new Slf4jSyncObservabilitySink();

        public Builder withConfig(MatchSyncConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Preference store to use instead of the one named by the configuration.
         */
        public Builder withPreferences(PreferenceStore preferences) {
            this.preferences = preferences;
            return this;
        }

        public Builder withRecordStoreFactory(BiFunction<DeviceIdentity, WallClock, RecordStoreGateway> factory) {
            this.recordStoreFactory = factory;
            return this;
        }

        public Builder withRendezvousDirectory(RendezvousDirectory rendezvous) {
            this.rendezvous = rendezvous;
            return this;
        }

        /**
         * Signed-in account for backend sync. Without one no backend service is created.
         */
        public Builder withAccountSession(AccountSession session) {
            this.session = session;
            return this;
        }

        public Builder withObservabilitySink(SyncObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public MatchSyncRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(recordStoreFactory, "recordStoreFactory");

            // 1. Clocks and the peer scheduler thread
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService peerExec = schedulerThread("matchsync-scheduler");
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(peerExec, clock);

            // 2. Preferences, identity, record store
            PreferenceStore prefs = preferences != null ? preferences
                    : config.preferencesFile() != null ? new JsonFilePreferenceStore(config.preferencesFile())
                    : new InMemoryPreferenceStore();
            SecureRandom random = new SecureRandom();
            DeviceIdentity device = DeviceIdentity.loadOrCreate(prefs, wallClock, random);
            RecordStoreGateway store = recordStoreFactory.apply(device, wallClock);

            // 3. Peer path
            NettyPeerTransport peerTransport = new NettyPeerTransport(
                    rendezvous != null ? rendezvous : new InMemoryRendezvousDirectory(),
                    config.bindHost(),
                    config.advertiseHost(),
                    config.transport(),
                    random);
            PeerSyncEngine engine = new PeerSyncEngine(peerTransport, store, scheduler, clock, wallClock,
                    config.peerTiming(), observabilitySink);

            // 4. Backend path, on its own thread
            CloudSyncService cloud = null;
            ScheduledExecutorService cloudExec = null;
            Optional<CloudConfig> cloudConfig = config.cloudConfig();
            if (cloudConfig.isPresent() && session != null) {
                CloudConfig cc = cloudConfig.get();
                cloudExec = schedulerThread("matchsync-cloud");
                MonotonicScheduler cloudScheduler = new ScheduledExecutorScheduler(cloudExec, clock);
                RestBackendClient backend = RestBackendClient.builder()
                        .baseUrl(cc.baseUrl())
                        .apiKey(cc.apiKey())
                        .session(session)
                        .requestTimeout(cc.requestTimeout())
                        .scheduler(cloudScheduler)
                        .clock(clock)
                        .wallClock(wallClock)
                        .pollInterval(cc.timing().pollInterval())
                        .build();
                cloud = new CloudSyncService(backend, session, store, device, new CloudSyncPreferences(prefs),
                        cloudScheduler, clock, wallClock, cc.timing());
            } else if (cloudConfig.isPresent()) {
                log.warn("Backend sync configured but no account session given; backend sync disabled");
            }

            return new MatchSyncRuntime(device, store, peerTransport, engine, cloud, peerExec, cloudExec);
        }
    }
}

package com.questrail.matchsync.runtime;

import com.questrail.matchsync.api.MergeMode;
import com.questrail.matchsync.api.PlayerRecord;
import com.questrail.matchsync.api.Snapshot;
import com.questrail.matchsync.api.SyncProgress;
import com.questrail.matchsync.api.TestRecords;
import com.questrail.matchsync.cloud.CloudSyncTimingPolicy;
import com.questrail.matchsync.cloud.FixedAccountSession;
import com.questrail.matchsync.config.CloudConfig;
import com.questrail.matchsync.config.MatchSyncConfig;
import com.questrail.matchsync.peer.transport.InMemoryRendezvousDirectory;
import com.questrail.matchsync.prefs.InMemoryPreferenceStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MatchSyncRuntimeTest
 * -----------------------------------------------------------------------------
 * Two fully wired runtimes exchanging a snapshot over loopback TCP.
 */
class MatchSyncRuntimeTest {

    private MatchSyncRuntime alpha;
    private MatchSyncRuntime beta;

    @BeforeEach
    void setUp() {
        InMemoryRendezvousDirectory rendezvous = new InMemoryRendezvousDirectory();
        MatchSyncConfig config = MatchSyncConfig.builder().build();
        alpha = MatchSyncRuntime.builder()
                .withConfig(config)
                .withPreferences(new InMemoryPreferenceStore())
                .withRendezvousDirectory(rendezvous)
                .build();
        beta = MatchSyncRuntime.builder()
                .withConfig(config)
                .withPreferences(new InMemoryPreferenceStore())
                .withRendezvousDirectory(rendezvous)
                .build();
        alpha.start();
        beta.start();
    }

    @AfterEach
    void tearDown() {
        beta.close();
        alpha.close();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not reached within 10s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void withoutCloudConfigurationNoBackendServiceIsCreated() {
        assertTrue(alpha.cloudSync().isEmpty());
        assertTrue(alpha.cloudExecutor().isEmpty());
        assertNotEquals(alpha.deviceIdentity(), beta.deviceIdentity());
    }

    @Test
    void blockedBackendThreadDoesNotDelayPeerTimers() throws Exception {
        MatchSyncConfig config = MatchSyncConfig.builder()
                .withCloud(new CloudConfig(URI.create("http://127.0.0.1:9"), "key",
                        CloudSyncTimingPolicy.defaults(), Duration.ofSeconds(5)))
                .build();
        try (MatchSyncRuntime runtime = MatchSyncRuntime.builder()
                .withConfig(config)
                .withPreferences(new InMemoryPreferenceStore())
                .withAccountSession(FixedAccountSession.signedIn("user-1", "token"))
                .build()) {
            assertTrue(runtime.cloudSync().isPresent());
            ScheduledExecutorService cloudExecutor = runtime.cloudExecutor().orElseThrow();
            assertNotSame(runtime.peerExecutor(), cloudExecutor);
            assertEquals("matchsync-cloud",
                    cloudExecutor.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS));
            assertEquals("matchsync-scheduler",
                    runtime.peerExecutor().submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS));

            CountDownLatch release = new CountDownLatch(1);
            cloudExecutor.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            CountDownLatch fired = new CountDownLatch(1);
            runtime.peerExecutor().schedule(fired::countDown, 20, TimeUnit.MILLISECONDS);
            try {
                assertTrue(fired.await(2, TimeUnit.SECONDS));
            } finally {
                release.countDown();
            }
        }
    }

    private void betaPullsFromAlpha() throws InterruptedException {
        String code = alpha.transport().hostSession();
        beta.transport().joinSession(code);
        await(() -> alpha.transport().getState().connected() && beta.transport().getState().connected());

        assertTrue(beta.peerSync().requestData().isPresent());
        await(() -> alpha.peerSync().progress().status() == SyncProgress.Status.PENDING_CONFIRMATION);

        alpha.peerSync().confirmPending();

        await(() -> beta.peerSync().progress().status() == SyncProgress.Status.COMPLETE);
    }

    @Test
    void pulledSnapshotIsMergedIntoTheRequestingDevice() throws InterruptedException {
        alpha.recordStore().importMerge(TestRecords.oneMatch("m-1", alpha.deviceIdentity().value()), MergeMode.MERGE);

        betaPullsFromAlpha();

        assertTrue(beta.recordStore().getRecord("m-1").isPresent());
    }

    @Test
    void chunkedTransferKeepsEmojiIntact() throws InterruptedException {
        // two runs split by one char: one of the two chunk boundaries falls inside a surrogate pair
        String emoji = "\uD83D\uDE00";
        String name = emoji.repeat(60_000) + "b" + emoji.repeat(60_000);
        PlayerRecord player = TestRecords.player("p-emoji", name, alpha.deviceIdentity().value());
        alpha.recordStore().importMerge(Snapshot.of(List.of(player), List.of(), List.of(), TestRecords.T0),
                MergeMode.MERGE);

        betaPullsFromAlpha();

        PlayerRecord received = beta.recordStore().exportAll().players().stream()
                .filter(p -> p.id().equals("p-emoji"))
                .findFirst()
                .orElseThrow();
        assertEquals(name, received.name());
    }
}

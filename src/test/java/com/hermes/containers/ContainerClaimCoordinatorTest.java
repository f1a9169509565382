package com.hermes.containers;

import com.hermes.observability.HermesMetrics;
import com.hermes.shared.config.ClaimConfig;
import com.hermes.shared.model.AffinityGroup;
import com.hermes.shared.model.ClaimStatus;
import com.hermes.shared.model.ContainerClaim;
import com.hermes.store.InMemoryVersionedStore;
import com.hermes.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ContainerClaimCoordinatorTest {

    private static final AffinityGroup GROUP = new AffinityGroup("siteA", "u1");
    private static final AffinityGroup OTHER = new AffinityGroup("siteB", "u2");

    private MutableClock clock;
    private InterleavingStore<ContainerClaim> claims;
    private WarmPool pool;
    private HermesMetrics metrics;
    private ContainerClaimCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        claims = new InterleavingStore<>();
        pool = new WarmPool(new InMemoryVersionedStore<>(), null, clock);
        metrics = new HermesMetrics();
        coordinator = new ContainerClaimCoordinator(claims, pool, ClaimConfig.defaults(), metrics, clock);
        pool.register("c1");
        pool.register("c2");
        pool.register("c3");
    }

    @Test
    void concurrentClaimsYieldOneClaimAndOneContainer() throws Exception {
        int threads = 8;
        var executor = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<String>>();
        for (int i = 0; i < threads; i++) {
            Callable<String> task = () -> {
                start.await();
                return coordinator.claim(GROUP);
            };
            futures.add(executor.submit(task));
        }
        start.countDown();
        var ids = new HashSet<String>();
        for (var f : futures) {
            ids.add(f.get(5, TimeUnit.SECONDS));
        }
        executor.shutdown();

        assertEquals(1, ids.size());
        assertEquals(1, claims.scan().size());
        assertEquals(ids.iterator().next(), claims.scan().get(0).value().containerId());
        assertEquals(2, pool.warmCount());
        assertEquals(1.0, metrics.claimsWon().count());
    }

    @Test
    void differentGroupsGetDifferentContainers() {
        var a = coordinator.claim(GROUP);
        var b = coordinator.claim(new AffinityGroup("siteA", "u2"));

        assertNotEquals(a, b);
        assertEquals(1, pool.warmCount());
    }

    @Test
    void emptyPoolFailsWithRetryableError() {
        coordinator.claim(new AffinityGroup("p", "1"));
        coordinator.claim(new AffinityGroup("p", "2"));
        coordinator.claim(new AffinityGroup("p", "3"));

        assertThrows(NoWarmContainerException.class, () -> coordinator.claim(GROUP));
        assertEquals(ClaimStatus.WARM, coordinator.status(GROUP));
    }

    @Test
    void fullLifecycleWithClock() {
        coordinator.claim(GROUP);
        assertEquals(ClaimStatus.CLAIMED, coordinator.status(GROUP));

        coordinator.markActive(GROUP);
        assertEquals(ClaimStatus.PROCESSING, coordinator.status(GROUP));

        clock.advance(Duration.ofMinutes(4));
        assertFalse(coordinator.markIdle(GROUP));

        clock.advance(Duration.ofMinutes(2));
        assertTrue(coordinator.markIdle(GROUP));
        assertEquals(ClaimStatus.IDLE, coordinator.status(GROUP));

        var idle = claims.get(GROUP.key()).orElseThrow();
        clock.advance(Duration.ofMinutes(10));
        assertFalse(coordinator.reclaimIfExpired(idle));

        clock.advance(Duration.ofMinutes(5));
        assertTrue(coordinator.reclaimIfExpired(idle));
        assertEquals(ClaimStatus.WARM, coordinator.status(GROUP));
        assertEquals(3, pool.warmCount());
        assertEquals(1.0, metrics.claimsReleased().count());

        assertNotNull(coordinator.claim(GROUP));
        assertEquals(ClaimStatus.CLAIMED, coordinator.status(GROUP));
        assertEquals(2, pool.warmCount());
    }

    @Test
    void idleClaimResumesOnNewWork() {
        coordinator.claim(GROUP);
        clock.advance(Duration.ofMinutes(6));
        coordinator.markIdle(GROUP);

        var resumed = coordinator.markActive(GROUP);

        assertEquals(ClaimStatus.PROCESSING, resumed.status());
        assertEquals(clock.instant(), resumed.lastActivity());
    }

    @Test
    void releaseLosesToConcurrentMarkActive() {
        coordinator.claim(GROUP);
        clock.advance(Duration.ofMinutes(6));
        coordinator.markIdle(GROUP);
        clock.advance(Duration.ofMinutes(20));
        var observedBySweeper = claims.get(GROUP.key()).orElseThrow();

        coordinator.markActive(GROUP);

        assertThrows(StaleClaimException.class, () -> coordinator.reclaimIfExpired(observedBySweeper));
        assertEquals(ClaimStatus.PROCESSING, coordinator.status(GROUP));
        assertEquals(2, pool.warmCount());
    }

    @Test
    void markActiveWithoutClaimFails() {
        assertThrows(ClaimNotFoundException.class, () -> coordinator.markActive(GROUP));
    }

    @Test
    void recordActivityRefreshesWithoutStatusChange() {
        coordinator.claim(GROUP);
        coordinator.markActive(GROUP);
        clock.advance(Duration.ofMinutes(4));

        assertTrue(coordinator.recordActivity(GROUP));
        clock.advance(Duration.ofMinutes(2));

        assertFalse(coordinator.markIdle(GROUP));
        assertEquals(ClaimStatus.PROCESSING, coordinator.status(GROUP));
        assertFalse(coordinator.recordActivity(new AffinityGroup("other", "u")));
    }

    @Test
    void activeClaimBlocksQueueDeletionCheck() {
        assertFalse(coordinator.hasActiveClaim(GROUP));
        coordinator.claim(GROUP);
        assertTrue(coordinator.hasActiveClaim(GROUP));
        assertTrue(coordinator.release(GROUP));
        assertFalse(coordinator.hasActiveClaim(GROUP));
        assertFalse(coordinator.release(GROUP));
    }

    @Test
    void markActiveDoesNotOverwriteAClaimMadeAfterItsRead() {
        assertEquals("c1", coordinator.claim(GROUP));
        claims.beforeNextReplace(this::releaseAndHandC1ToAnotherGroup);

        var active = coordinator.markActive(GROUP);

        assertEquals("c2", active.containerId());
        assertEquals("c2", claims.get(GROUP.key()).orElseThrow().value().containerId());
        assertEquals(ClaimStatus.PROCESSING, coordinator.status(GROUP));
        assertEquals("c1", claims.get(OTHER.key()).orElseThrow().value().containerId());
        assertEquals(1, pool.warmCount());
    }

    @Test
    void recordActivityDoesNotOverwriteAClaimMadeAfterItsRead() {
        coordinator.claim(GROUP);
        claims.beforeNextReplace(this::releaseAndHandC1ToAnotherGroup);

        assertTrue(coordinator.recordActivity(GROUP));

        assertEquals("c2", claims.get(GROUP.key()).orElseThrow().value().containerId());
        assertEquals("c1", claims.get(OTHER.key()).orElseThrow().value().containerId());
    }

    @Test
    void groupsWhoseKeysShareSeparatorsStayApart() {
        var a = coordinator.claim(new AffinityGroup("a#b", "c"));
        var b = coordinator.claim(new AffinityGroup("a", "b#c"));

        assertNotEquals(a, b);
        assertEquals(2, claims.scan().size());
    }

    // the sweeper releases c1, OTHER takes it and GROUP is claimed again on c2
    private void releaseAndHandC1ToAnotherGroup() {
        assertTrue(coordinator.release(GROUP));
        assertEquals("c1", coordinator.claim(OTHER));
        assertEquals("c2", coordinator.claim(GROUP));
    }

    /** Runs a hook once, between a caller's read and its conditional write. */
    static class InterleavingStore<T> extends InMemoryVersionedStore<T> {

        private Runnable hook;

        void beforeNextReplace(Runnable hook) {
            this.hook = hook;
        }

        @Override
        public boolean replace(String key, long expectedVersion, T value) {
            var pending = hook;
            hook = null;
            if (pending != null) pending.run();
            return super.replace(key, expectedVersion, value);
        }
    }
}

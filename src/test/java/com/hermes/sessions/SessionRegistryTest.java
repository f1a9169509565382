package com.hermes.sessions;

import com.hermes.observability.HermesMetrics;
import com.hermes.shared.model.Channel;
import com.hermes.shared.model.Session;
import com.hermes.store.ConcurrentUpdateException;
import com.hermes.store.InMemoryVersionedStore;
import com.hermes.store.VersionedStore;
import com.hermes.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SessionRegistryTest {

    private InMemoryVersionedStore<Session> store;
    private HermesMetrics metrics;
    private MutableClock clock;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryVersionedStore<>();
        metrics = new HermesMetrics();
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        registry = new SessionRegistry(store, metrics, clock);
    }

    @Test
    void createsSessionWithDerivedIdAndBranch() {
        var session = registry.getOrCreateSession("acme", "siteA", "u1", "abc12345", Channel.EMAIL);

        assertEquals("acme-siteA-abc12345", session.sessionId());
        assertEquals("thread-abc12345", session.gitBranch());
        assertEquals(1, session.messageCount());
        assertEquals(Channel.EMAIL, session.source());
        assertEquals(clock.instant(), session.createdAt());
        assertEquals(1.0, metrics.sessionsCreated().count());
    }

    @Test
    void resumingKeepsIdentityAndBumpsActivity() {
        var first = registry.getOrCreateSession("acme", "siteA", "u1", "abc12345", Channel.EMAIL);
        clock.advance(Duration.ofMinutes(3));

        var second = registry.getOrCreateSession("acme", "siteA", "u1", "abc12345", Channel.SMS);

        assertEquals(first.sessionId(), second.sessionId());
        assertEquals(first.gitBranch(), second.gitBranch());
        assertEquals(first.createdAt(), second.createdAt());
        assertEquals(clock.instant(), second.lastActivity());
        assertEquals(2, second.messageCount());
        assertEquals(Channel.SMS, second.source());
        assertEquals(1.0, metrics.sessionsCreated().count());
    }

    @Test
    void concurrentFirstMessagesConvergeOnOneRecord() throws Exception {
        int threads = 5;
        var pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<Session>>();
        for (int i = 0; i < threads; i++) {
            Callable<Session> task = () -> {
                start.await();
                return registry.getOrCreateSession("acme", "siteA", "u1", "abc12345", Channel.CHAT);
            };
            futures.add(pool.submit(task));
        }
        start.countDown();
        for (var f : futures) {
            assertEquals("acme-siteA-abc12345", f.get(5, TimeUnit.SECONDS).sessionId());
        }
        pool.shutdown();

        assertEquals(1, store.scan().size());
        assertEquals(threads, store.scan().get(0).value().messageCount());
        assertEquals(1.0, metrics.sessionsCreated().count());
    }

    @Test
    void differentThreadsAreDifferentSessions() {
        registry.getOrCreateSession("acme", "siteA", "u1", "t1", Channel.EMAIL);
        registry.getOrCreateSession("acme", "siteA", "u1", "t2", Channel.EMAIL);

        assertEquals(2, store.scan().size());
    }

    @Test
    void rejectsMissingIdentityParts() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.getOrCreateSession("", "siteA", "u1", "t1", Channel.EMAIL));
        assertThrows(IllegalArgumentException.class,
                () -> registry.getOrCreateSession("acme", "siteA", "u1", null, Channel.EMAIL));
        assertThrows(IllegalArgumentException.class,
                () -> registry.getOrCreateSession("acme", "siteA", "u1", "t1", null));
    }

    @Test
    @SuppressWarnings("unchecked")
    void givesUpWhenRecordKeepsChanging() {
        VersionedStore<Session> flaky = mock(VersionedStore.class);
        when(flaky.get(anyString())).thenReturn(Optional.empty());
        when(flaky.putIfAbsent(anyString(), any())).thenReturn(false);
        var contended = new SessionRegistry(flaky, metrics, clock);

        assertThrows(ConcurrentUpdateException.class,
                () -> contended.getOrCreateSession("acme", "siteA", "u1", "t1", Channel.EMAIL));
    }

    @Test
    void listsByUserAndProjectMostRecentFirst() {
        registry.getOrCreateSession("acme", "siteA", "u1", "old", Channel.EMAIL);
        clock.advance(Duration.ofMinutes(1));
        registry.getOrCreateSession("acme", "siteB", "u1", "new", Channel.EMAIL);
        clock.advance(Duration.ofMinutes(1));
        registry.getOrCreateSession("acme", "siteA", "u2", "other", Channel.EMAIL);

        assertThat(registry.listUserSessions("u1"))
                .extracting(Session::threadId)
                .containsExactly("new", "old");
        assertThat(registry.listProjectSessions("acme", "siteA"))
                .extracting(Session::threadId)
                .containsExactly("other", "old");
        assertTrue(registry.find("acme", "siteA", "u1", "old").isPresent());
        assertTrue(registry.find("acme", "siteA", "u1", "missing").isEmpty());
    }
}

package com.hermes.sessions;

import com.hermes.observability.HermesMetrics;
import com.hermes.shared.model.Channel;
import com.hermes.shared.model.Session;
import com.hermes.store.ConcurrentUpdateException;
import com.hermes.store.Versioned;
import com.hermes.store.VersionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Keyed lookup and creation of editing sessions. Creation is a create-if-absent
 * on the identity key, so concurrent first messages converge on one record.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);
    private static final int MAX_ATTEMPTS = 5;

    private final VersionedStore<Session> store;
    private final HermesMetrics metrics;
    private final Clock clock;

    public SessionRegistry(VersionedStore<Session> store, HermesMetrics metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Session getOrCreateSession(String clientId, String projectId, String userId,
                                      String threadId, Channel source) {
        requirePresent(clientId, "clientId");
        requirePresent(projectId, "projectId");
        requirePresent(userId, "userId");
        requirePresent(threadId, "threadId");
        if (source == null) throw new IllegalArgumentException("source is required");
        var key = Session.key(clientId, projectId, userId, threadId);

        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            var now = clock.instant();
            var existing = store.get(key);
            if (existing.isEmpty()) {
                var created = Session.create(clientId, projectId, userId, threadId, source, now);
                if (store.putIfAbsent(key, created)) {
                    metrics.sessionsCreated().increment();
                    log.info("Created session {} on branch {} via {}", created.sessionId(), created.gitBranch(), source.wireName());
                    return created;
                }
                log.debug("Lost creation race for {}, updating the winner", key);
                continue;
            }
            var current = existing.get();
            var touched = current.value().touch(source, now);
            if (store.replace(key, current.version(), touched)) {
                log.debug("Resumed session {} via {}", touched.sessionId(), source.wireName());
                return touched;
            }
        }
        throw new ConcurrentUpdateException("Session " + key + " kept changing under concurrent updates");
    }

    public Optional<Session> find(String clientId, String projectId, String userId, String threadId) {
        return store.get(Session.key(clientId, projectId, userId, threadId)).map(Versioned::value);
    }

    public List<Session> listUserSessions(String userId) {
        return store.scan().stream()
                .map(Versioned::value)
                .filter(s -> s.userId().equals(userId))
                .sorted(Comparator.comparing(Session::lastActivity).reversed())
                .toList();
    }

    public List<Session> listProjectSessions(String clientId, String projectId) {
        return store.scan().stream()
                .map(Versioned::value)
                .filter(s -> s.clientId().equals(clientId) && s.projectId().equals(projectId))
                .sorted(Comparator.comparing(Session::lastActivity).reversed())
                .toList();
    }

    private static void requirePresent(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}

package com.hermes.queues;

import com.hermes.shared.model.AffinityGroup;
import com.hermes.shared.model.QueuePair;
import com.hermes.store.Versioned;
import com.hermes.store.VersionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Provisions and tears down the input/output queue pair of an affinity group.
 * A pair is either fully created and recorded, or not at all.
 * <p>
 * Teardown first marks the pair record, then checks for a claim, and only then
 * deletes the queues. Creation refuses a marked record with a retryable error.
 * Callers that claim a container and then call {@link #createAffinityQueues}
 * again before sending therefore either stop the teardown or wait until it has
 * finished and get fresh queues.
 */
public class QueueTopologyManager {

    private static final Logger log = LoggerFactory.getLogger(QueueTopologyManager.class);
    private static final Duration ABANDONED_TEARDOWN = Duration.ofMinutes(5);

    private final QueueTransport transport;
    private final VersionedStore<QueuePair> pairs;
    private final ActiveClaimCheck claims;
    private final String prefix;
    private final Clock clock;

    public QueueTopologyManager(QueueTransport transport, VersionedStore<QueuePair> pairs,
                                ActiveClaimCheck claims, String prefix, Clock clock) {
        this.transport = transport;
        this.pairs = pairs;
        this.claims = claims;
        this.prefix = prefix;
        this.clock = clock;
    }

    public QueuePair createAffinityQueues(AffinityGroup group) {
        var existing = pairs.get(group.key());
        if (existing.isPresent()) {
            if (existing.get().value().tearingDown()) {
                return takeOverTeardown(group, existing.get());
            }
            log.debug("Queues already exist for {}", group.key());
            return existing.get().value();
        }

        var input = QueueNames.input(prefix, group);
        var output = QueueNames.output(prefix, group);
        var created = new ArrayList<String>();
        try {
            for (var name : List.of(input, output)) {
                var fresh = !transport.exists(name);
                transport.createQueue(name);
                if (fresh) created.add(name);
            }
            var pair = new QueuePair(group, input, output, clock.instant());
            if (pairs.putIfAbsent(group.key(), pair)) {
                log.info("Created queues {} and {} for {}", input, output, group.key());
                return pair;
            }
            // a concurrent caller recorded the pair first; names are shared so nothing to undo
            created.clear();
            return pairs.get(group.key()).map(Versioned::value).orElse(pair);
        } catch (RuntimeException e) {
            rollback(created);
            throw new QueueProvisioningException("Failed to create queues for " + group.key(), e);
        }
    }

    /**
     * Deletes the group's queues. Refused while the group holds a non-Warm claim,
     * including one taken while the deletion runs. A teardown interrupted by a
     * transport failure is resumed by the next call.
     *
     * @return true if queues were deleted
     */
    public boolean deleteAffinityQueues(AffinityGroup group) {
        if (claims.hasActiveClaim(group)) {
            log.warn("Refusing to delete queues for {}: container claim still active", group.key());
            return false;
        }
        var existing = pairs.get(group.key());
        if (existing.isEmpty()) {
            log.debug("No queues recorded for {}", group.key());
            return false;
        }
        var record = existing.get();
        if (!record.value().tearingDown()) {
            var marked = record.value().withTeardownStartedAt(clock.instant());
            if (!pairs.replace(group.key(), record.version(), marked)) {
                log.warn("Queue record for {} changed during deletion, leaving queues in place", group.key());
                return false;
            }
            var current = pairs.get(group.key()).filter(r -> marked.equals(r.value()));
            if (current.isEmpty()) {
                log.warn("Queue record for {} changed during deletion, leaving queues in place", group.key());
                return false;
            }
            record = current.get();
        }

        // a claim taken before the mark is visible here; one taken after it cannot get queues until we finish
        if (claims.hasActiveClaim(group)) {
            if (pairs.replace(group.key(), record.version(), record.value().withTeardownStartedAt(null))) {
                log.warn("Container claimed for {} during queue deletion, queues kept", group.key());
            }
            return false;
        }

        try {
            transport.deleteQueue(record.value().inputQueue());
            transport.deleteQueue(record.value().outputQueue());
        } catch (RuntimeException e) {
            throw new QueueProvisioningException("Queue deletion for " + group.key()
                    + " failed; the pair stays marked and the next deletion resumes it", e);
        }
        if (!pairs.delete(group.key(), record.version())) {
            log.warn("Queue record for {} changed after its queues were deleted", group.key());
        }
        log.info("Deleted queues for {}", group.key());
        return true;
    }

    public Optional<QueuePair> find(AffinityGroup group) {
        return pairs.get(group.key()).map(Versioned::value);
    }

    /** Prefixed queues that no recorded pair refers to. */
    public List<String> findOrphanedQueues() {
        var known = pairs.scan().stream()
                .map(Versioned::value)
                .flatMap(p -> Stream.of(p.inputQueue(), p.outputQueue()))
                .collect(Collectors.toSet());
        return transport.listQueues(prefix + "-").stream()
                .filter(name -> !known.contains(name))
                .toList();
    }

    public int cleanupOrphanedQueues() {
        int deleted = 0;
        for (var name : findOrphanedQueues()) {
            try {
                var pending = transport.depth(name);
                if (pending > 0) {
                    log.warn("Orphaned queue {} still holds {} messages, deleting anyway", name, pending);
                }
                transport.deleteQueue(name);
                deleted++;
            } catch (RuntimeException e) {
                log.error("Failed to delete orphaned queue {}", name, e);
            }
        }
        if (deleted > 0) log.info("Orphaned queue cleanup deleted {} queues", deleted);
        return deleted;
    }

    private QueuePair takeOverTeardown(AffinityGroup group, Versioned<QueuePair> record) {
        var startedAt = record.value().teardownStartedAt();
        if (Duration.between(startedAt, clock.instant()).compareTo(ABANDONED_TEARDOWN) < 0) {
            throw new QueueProvisioningException("Queues for " + group.key() + " are being deleted");
        }
        var restored = record.value().withTeardownStartedAt(null);
        try {
            transport.createQueue(restored.inputQueue());
            transport.createQueue(restored.outputQueue());
        } catch (RuntimeException e) {
            throw new QueueProvisioningException("Failed to restore queues for " + group.key(), e);
        }
        if (!pairs.replace(group.key(), record.version(), restored)) {
            throw new QueueProvisioningException("Queue record for " + group.key() + " changed while restoring it");
        }
        log.warn("Restored queues for {} after a deletion abandoned since {}", group.key(), startedAt);
        return restored;
    }

    private void rollback(List<String> created) {
        for (var name : created) {
            try {
                transport.deleteQueue(name);
                log.info("Rolled back queue {}", name);
            } catch (RuntimeException e) {
                log.error("Failed to roll back queue {}; left for orphan cleanup", name, e);
            }
        }
    }
}

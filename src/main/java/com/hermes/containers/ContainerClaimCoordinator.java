package com.hermes.containers;

import com.hermes.observability.HermesMetrics;
import com.hermes.queues.ActiveClaimCheck;
import com.hermes.shared.config.ClaimConfig;
import com.hermes.shared.model.AffinityGroup;
import com.hermes.shared.model.ClaimStatus;
import com.hermes.shared.model.ContainerClaim;
import com.hermes.store.Versioned;
import com.hermes.store.VersionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Owns the claim record of every affinity group. The claim itself is a single
 * create-if-absent on the group key; every later transition is a compare-and-set
 * on the version that was read, so a release and a concurrent markActive can never
 * both succeed.
 */
public class ContainerClaimCoordinator implements ActiveClaimCheck {

    private static final Logger log = LoggerFactory.getLogger(ContainerClaimCoordinator.class);
    private static final int MAX_ATTEMPTS = 5;
    private static final long EMPTY_POOL_BACKOFF_MS = 20;

    private final VersionedStore<ContainerClaim> claims;
    private final WarmPool pool;
    private final ClaimConfig config;
    private final HermesMetrics metrics;
    private final Clock clock;

    public ContainerClaimCoordinator(VersionedStore<ContainerClaim> claims, WarmPool pool,
                                     ClaimConfig config, HermesMetrics metrics, Clock clock) {
        this.claims = claims;
        this.pool = pool;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Ensures a container is claimed for the group and returns its id. Losing the
     * race to another caller is not an error: the winner's container is returned.
     */
    public String claim(AffinityGroup group) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            var existing = claims.get(group.key());
            if (existing.isPresent()) {
                return existing.get().value().containerId();
            }

            var containerId = pool.acquire(group);
            if (containerId.isEmpty()) {
                // another caller may be mid-claim holding the last warm container
                pause(EMPTY_POOL_BACKOFF_MS * (attempt + 1));
                continue;
            }

            var now = clock.instant();
            var claim = new ContainerClaim(group, containerId.get(), ClaimStatus.CLAIMED, now, now);
            if (claims.putIfAbsent(group.key(), claim)) {
                metrics.claimsWon().increment();
                log.info("Claimed container {} for {}", containerId.get(), group.key());
                return containerId.get();
            }

            pool.giveBack(containerId.get(), group);
            metrics.claimsContended().increment();
            var winner = claims.get(group.key());
            if (winner.isPresent()) {
                log.debug("Lost claim race for {}, using container {}", group.key(), winner.get().value().containerId());
                return winner.get().value().containerId();
            }
            // winner already released again; start over
        }
        throw new NoWarmContainerException("No warm container available for " + group.key());
    }

    /** Claimed/Idle/Processing → Processing, refreshing activity. */
    public ContainerClaim markActive(AffinityGroup group) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            var current = claims.get(group.key()).orElseThrow(() -> new ClaimNotFoundException(group));
            var next = current.value().withStatus(ClaimStatus.PROCESSING, clock.instant());
            if (claims.replace(group.key(), current.version(), next)) {
                if (current.value().status() != ClaimStatus.PROCESSING) {
                    log.info("Container {} processing for {}", next.containerId(), group.key());
                }
                return next;
            }
        }
        throw new StaleClaimException(group, "markActive");
    }

    /** Refreshes activity without changing status; false if the group holds no claim. */
    public boolean recordActivity(AffinityGroup group) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            var current = claims.get(group.key());
            if (current.isEmpty()) return false;
            if (claims.replace(group.key(), current.get().version(), current.get().value().touch(clock.instant()))) {
                return true;
            }
        }
        throw new StaleClaimException(group, "recordActivity");
    }

    public boolean markIdle(AffinityGroup group) {
        return claims.get(group.key()).map(this::markIdle).orElse(false);
    }

    /**
     * Processing (or a Claimed container never dispatched to) → Idle, if quiet past
     * the idle threshold. Writes against the observed version only.
     */
    public boolean markIdle(Versioned<ContainerClaim> observed) {
        var claim = observed.value();
        if (claim.status() != ClaimStatus.PROCESSING && claim.status() != ClaimStatus.CLAIMED) return false;
        var now = clock.instant();
        if (quietFor(claim).compareTo(config.idleAfter()) < 0) return false;
        var idle = new ContainerClaim(claim.affinityGroup(), claim.containerId(), ClaimStatus.IDLE,
                claim.claimedAt(), claim.lastActivity());
        if (claims.replace(observed.key(), observed.version(), idle)) {
            log.info("Container {} idle for {} after {}s quiet", claim.containerId(), observed.key(),
                    Duration.between(claim.lastActivity(), now).toSeconds());
            return true;
        }
        log.debug("Claim {} changed before it could be marked idle", observed.key());
        return false;
    }

    /** Any non-Warm state → Warm: clears the claim and frees the container. */
    public boolean release(AffinityGroup group) {
        var current = claims.get(group.key());
        if (current.isEmpty()) return false;
        release(current.get());
        return true;
    }

    /**
     * Deletes the observed claim record if nothing has written to it since.
     *
     * @throws StaleClaimException if the record moved on; re-read and decide again
     */
    public void release(Versioned<ContainerClaim> observed) {
        var claim = observed.value();
        if (!claims.delete(observed.key(), observed.version())) {
            throw new StaleClaimException(claim.affinityGroup(), "release");
        }
        pool.giveBack(claim.containerId(), claim.affinityGroup());
        metrics.claimsReleased().increment();
        log.info("Released container {} from {}", claim.containerId(), observed.key());
    }

    /** Releases an Idle claim that has been quiet past the reclaim threshold. */
    public boolean reclaimIfExpired(Versioned<ContainerClaim> observed) {
        var claim = observed.value();
        if (claim.status() != ClaimStatus.IDLE) return false;
        if (quietFor(claim).compareTo(config.reclaimAfter()) < 0) return false;
        release(observed);
        return true;
    }

    public ClaimStatus status(AffinityGroup group) {
        return find(group).map(ContainerClaim::status).orElse(ClaimStatus.WARM);
    }

    public Optional<ContainerClaim> find(AffinityGroup group) {
        return claims.get(group.key()).map(Versioned::value);
    }

    public List<Versioned<ContainerClaim>> claimRecords() {
        return claims.scan();
    }

    @Override
    public boolean hasActiveClaim(AffinityGroup group) {
        return status(group) != ClaimStatus.WARM;
    }

    private Duration quietFor(ContainerClaim claim) {
        return Duration.between(claim.lastActivity(), clock.instant());
    }

    private static void pause(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a warm container", e);
        }
    }
}

package com.hermes.containers;

import com.hermes.shared.config.ClaimConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic idle and reclaim pass over all claim records. Holds no state between
 * runs and every transition is a conditional write, so several instances may
 * sweep at once.
 */
public class ClaimSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClaimSweeper.class);

    private final ContainerClaimCoordinator coordinator;
    private final WarmPool pool;
    private final ClaimConfig config;
    private final int warmPoolTarget;
    private ScheduledExecutorService scheduler;

    public ClaimSweeper(ContainerClaimCoordinator coordinator, WarmPool pool, ClaimConfig config, int warmPoolTarget) {
        this.coordinator = coordinator;
        this.pool = pool;
        this.config = config;
        this.warmPoolTarget = warmPoolTarget;
    }

    public record SweepResult(int idled, int released, int skipped) {}

    public SweepResult sweep() {
        int idled = 0, released = 0, skipped = 0;
        for (var record : coordinator.claimRecords()) {
            try {
                switch (record.value().status()) {
                    case CLAIMED, PROCESSING -> {
                        if (coordinator.markIdle(record)) idled++;
                    }
                    case IDLE -> {
                        if (coordinator.reclaimIfExpired(record)) released++;
                    }
                    default -> { }
                }
            } catch (StaleClaimException e) {
                skipped++;
                log.debug("Skipping {}: {}", record.key(), e.getMessage());
            }
        }
        if (idled + released > 0) {
            log.info("Claim sweep: {} idled, {} released, {} skipped", idled, released, skipped);
        }
        return new SweepResult(idled, released, skipped);
    }

    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "claim-sweeper");
            t.setDaemon(true);
            return t;
        });
        var period = config.sweepInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::runOnce, period, period, TimeUnit.MILLISECONDS);
        log.info("Claim sweeper started, every {}ms", period);
    }

    private void runOnce() {
        try {
            sweep();
            var launched = pool.replenish(warmPoolTarget);
            if (launched > 0) log.info("Launched {} warm containers", launched);
        } catch (RuntimeException e) {
            // keep the schedule alive; the next run re-reads everything
            log.error("Claim sweep failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}

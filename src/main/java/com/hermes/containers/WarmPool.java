package com.hermes.containers;

import com.hermes.shared.model.AffinityGroup;
import com.hermes.store.Versioned;
import com.hermes.store.VersionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of worker containers. Assigning a Warm container to a group is a
 * conditional write on the container record, so one container never serves two groups.
 */
public class WarmPool {

    private static final Logger log = LoggerFactory.getLogger(WarmPool.class);
    private static final int MAX_ATTEMPTS = 5;

    private final VersionedStore<ContainerRecord> containers;
    private final ContainerLauncher launcher;
    private final Clock clock;

    public WarmPool(VersionedStore<ContainerRecord> containers, ContainerLauncher launcher, Clock clock) {
        this.containers = containers;
        this.launcher = launcher;
        this.clock = clock;
    }

    public boolean register(String containerId) {
        var added = containers.putIfAbsent(containerId, new ContainerRecord(containerId, null, clock.instant()));
        if (added) log.info("Registered warm container {}", containerId);
        return added;
    }

    public Optional<String> acquire(AffinityGroup group) {
        for (var record : containers.scan()) {
            if (!record.value().isWarm()) continue;
            if (containers.replace(record.key(), record.version(), record.value().assignTo(group))) {
                log.debug("Assigned container {} to {}", record.key(), group.key());
                return Optional.of(record.key());
            }
        }
        return Optional.empty();
    }

    /** Returns the container to Warm if it is still assigned to {@code group}. */
    public void giveBack(String containerId, AffinityGroup group) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            var current = containers.get(containerId);
            if (current.isEmpty() || !Objects.equals(current.get().value().assignedGroup(), group)) {
                return;
            }
            if (containers.replace(containerId, current.get().version(), current.get().value().toWarm())) {
                log.debug("Container {} back to warm", containerId);
                return;
            }
        }
        log.warn("Could not return container {} to the warm pool", containerId);
    }

    public long warmCount() {
        return containers.scan().stream().map(Versioned::value).filter(ContainerRecord::isWarm).count();
    }

    /** Launches containers until {@code target} are Warm. Returns how many were started. */
    public int replenish(int target) {
        if (launcher == null) return 0;
        int launched = 0;
        while (warmCount() < target) {
            register(launcher.launch());
            launched++;
        }
        return launched;
    }

    public ContainerLauncher launcher() {
        return launcher;
    }
}

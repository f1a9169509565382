package com.hermes.shared.config;

import java.time.Duration;

public record ClaimConfig(
    Duration idleAfter,
    Duration reclaimAfter,
    Duration sweepInterval
) {
    public ClaimConfig {
        if (reclaimAfter.compareTo(idleAfter) <= 0) {
            throw new IllegalArgumentException("reclaim-after must be longer than idle-after");
        }
    }

    public static ClaimConfig defaults() {
        return new ClaimConfig(Duration.ofMinutes(5), Duration.ofMinutes(20), Duration.ofSeconds(30));
    }
}

package com.hermes.shared.model;

import java.time.Instant;

public record ContainerClaim(
    AffinityGroup affinityGroup,
    String containerId,
    ClaimStatus status,
    Instant claimedAt,
    Instant lastActivity
) {

    public ContainerClaim withStatus(ClaimStatus next, Instant now) {
        return new ContainerClaim(affinityGroup, containerId, next, claimedAt, now);
    }

    /** Same status, refreshed activity. */
    public ContainerClaim touch(Instant now) {
        return new ContainerClaim(affinityGroup, containerId, status, claimedAt, now);
    }
}

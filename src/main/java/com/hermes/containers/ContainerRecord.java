package com.hermes.containers;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.hermes.shared.model.AffinityGroup;

import java.time.Instant;

/** A worker container known to the pool; Warm while {@code assignedGroup} is null. */
public record ContainerRecord(
    String containerId,
    AffinityGroup assignedGroup,
    Instant registeredAt
) {

    @JsonIgnore
    public boolean isWarm() {
        return assignedGroup == null;
    }

    public ContainerRecord assignTo(AffinityGroup group) {
        return new ContainerRecord(containerId, group, registeredAt);
    }

    public ContainerRecord toWarm() {
        return new ContainerRecord(containerId, null, registeredAt);
    }
}

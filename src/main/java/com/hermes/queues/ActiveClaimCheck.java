package com.hermes.queues;

import com.hermes.shared.model.AffinityGroup;

@FunctionalInterface
public interface ActiveClaimCheck {
    boolean hasActiveClaim(AffinityGroup group);
}

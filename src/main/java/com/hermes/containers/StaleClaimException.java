package com.hermes.containers;

import com.hermes.shared.model.AffinityGroup;
import com.hermes.store.ConcurrentUpdateException;

public class StaleClaimException extends ConcurrentUpdateException {

    public StaleClaimException(AffinityGroup group, String operation) {
        super("Claim for " + group.key() + " changed during " + operation);
    }
}

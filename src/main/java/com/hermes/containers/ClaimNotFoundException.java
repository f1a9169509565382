package com.hermes.containers;

import com.hermes.shared.model.AffinityGroup;

/** The group holds no claim (never claimed, or released in the meantime). */
public class ClaimNotFoundException extends RuntimeException {

    public ClaimNotFoundException(AffinityGroup group) {
        super("No container claimed for " + group.key());
    }
}

package com.hermes.store;

import com.hermes.shared.retry.RetryableException;

/** A conditional write lost against a newer version; re-read and try again. */
public class ConcurrentUpdateException extends RetryableException {

    public ConcurrentUpdateException(String message) {
        super(message);
    }
}

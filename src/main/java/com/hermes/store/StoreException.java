package com.hermes.store;

import com.hermes.shared.retry.RetryableException;

public class StoreException extends RetryableException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

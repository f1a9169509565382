package com.hermes.containers;

import com.hermes.shared.retry.RetryableException;

public class NoWarmContainerException extends RetryableException {

    public NoWarmContainerException(String message) {
        super(message);
    }
}

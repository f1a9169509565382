package com.hermes.queues;

import com.hermes.shared.retry.RetryableException;

public class QueueProvisioningException extends RetryableException {

    public QueueProvisioningException(String message) {
        super(message);
    }

    public QueueProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}

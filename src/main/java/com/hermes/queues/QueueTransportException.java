package com.hermes.queues;

import com.hermes.shared.retry.RetryableException;

public class QueueTransportException extends RetryableException {

    public QueueTransportException(String message) {
        super(message);
    }

    public QueueTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

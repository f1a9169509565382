package com.hermes.shared.retry;

/**
 * A failure the caller may retry: an unavailable store or transport, a lost
 * conditional write, an empty warm pool. Anything else is treated as fatal.
 */
public class RetryableException extends RuntimeException {

    public RetryableException(String message) {
        super(message);
    }

    public RetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}

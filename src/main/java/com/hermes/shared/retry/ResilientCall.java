package com.hermes.shared.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Bounded retry with exponential backoff. Only {@link RetryableException}s are
 * retried; anything else propagates on the first attempt.
 */
public class ResilientCall {

    private static final Logger log = LoggerFactory.getLogger(ResilientCall.class);

    private static final int MAX_RETRIES = 2;
    private static final long INITIAL_DELAY_MS = 200;
    private static final long MAX_BACKOFF_MS = 5_000;

    public static <T> T execute(Callable<T> action) {
        return execute(action, MAX_RETRIES, INITIAL_DELAY_MS);
    }

    public static <T> T execute(Callable<T> action, int maxRetries, long baseDelayMs) {
        RetryableException last = null;
        long delay = baseDelayMs;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return action.call();
            } catch (RetryableException e) {
                last = e;
                if (attempt < maxRetries) {
                    log.debug("Attempt {} failed ({}), retrying in {}ms", attempt + 1, e.getMessage(), delay);
                    sleep(delay);
                    delay = Math.min(delay * 2, MAX_BACKOFF_MS);
                }
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Unexpected checked exception", e);
            }
        }
        throw new RetryableException("All retries exhausted", last);
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during retry", ie);
        }
    }
}

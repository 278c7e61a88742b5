package io.github.drompincen.chatrelay.runtime.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs an operation up to {@link RetryPolicy#maxAttempts()} times, sleeping with capped
 * exponential backoff between attempts that failed with a {@link ErrorCategory#TEMPORARY}
 * error. Permanent errors, and the error of the last attempt, are rethrown unchanged.
 * Attempts run sequentially on the calling thread.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Sleeper sleeper;
    private final RetryListener listener;

    public RetryExecutor(Sleeper sleeper, RetryListener listener) {
        this.sleeper = sleeper;
        this.listener = listener;
    }

    public RetryExecutor() {
        this(Sleeper.SYSTEM, RetryListener.NONE);
    }

    public <T> T retry(RetryPolicy policy, Supplier<T> operation) {
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!ErrorClassifier.isTemporary(e) || attempt >= policy.maxAttempts()) {
                    throw e;
                }
                Duration delay = policy.backoffAfter(attempt);
                log.warn("Temporary error on attempt {}/{}, retrying in {} ms: {}",
                        attempt, policy.maxAttempts(), delay.toMillis(), e.getMessage());
                listener.onRetry(attempt, delay, e);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }
}

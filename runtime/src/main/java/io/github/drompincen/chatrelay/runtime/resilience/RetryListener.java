package io.github.drompincen.chatrelay.runtime.resilience;

import java.time.Duration;

/**
 * Observability hook called before each backoff sleep.
 */
@FunctionalInterface
public interface RetryListener {

    RetryListener NONE = (attempt, delay, error) -> { };

    void onRetry(int attempt, Duration delay, Throwable error);
}

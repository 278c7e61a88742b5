package io.github.drompincen.chatrelay.runtime.resilience;

import java.time.Duration;

/**
 * Capped exponential backoff shared by request retries and transport reconnects.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Delay before the retry that follows attempt {@code attempt} (1-indexed):
     * {@code min(initial * 2^(attempt-1), max)}.
     */
    public static Duration delay(Duration initial, Duration max, int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was " + attempt);
        }
        int shift = Math.min(attempt - 1, 62);
        long initialMillis = initial.toMillis();
        long maxMillis = max.toMillis();
        if (initialMillis <= 0) {
            return Duration.ZERO;
        }
        // overflow guard: once the multiplier passes max/initial the cap applies
        if (shift >= 62 || initialMillis > (maxMillis >> shift)) {
            return max;
        }
        return Duration.ofMillis(Math.min(initialMillis << shift, maxMillis));
    }
}

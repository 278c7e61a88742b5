package io.github.drompincen.chatrelay.runtime.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Three-state breaker guarding one dependency.
 *
 * <pre>
 * CLOSED    --threshold failures-->          OPEN
 * OPEN      --allow() after timeout-->       HALF_OPEN
 * HALF_OPEN --3 successes-->                 CLOSED
 * HALF_OPEN --any failure-->                 OPEN (fresh timeout)
 * </pre>
 *
 * The OPEN to HALF_OPEN move happens inside {@link #allow()}; there is no background timer.
 * All reads and writes go through one lock.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final int HALF_OPEN_SUCCESS_THRESHOLD = 3;

    private final String name;
    private final int threshold;
    private final Duration timeout;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant nextAttempt = Instant.MIN;

    public CircuitBreaker(String name, int threshold, Duration timeout, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        this.name = name;
        this.threshold = threshold;
        this.timeout = timeout;
        this.clock = clock;
    }

    public CircuitBreaker(String name, int threshold, Duration timeout) {
        this(name, threshold, timeout, Clock.systemUTC());
    }

    public boolean allow() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED, HALF_OPEN -> {
                    return true;
                }
                case OPEN -> {
                    if (!clock.instant().isBefore(nextAttempt)) {
                        state = CircuitState.HALF_OPEN;
                        successCount = 0;
                        log.info("Circuit {} half-open, allowing trial calls", name);
                        return true;
                    }
                    return false;
                }
                default -> {
                    return false;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordSuccess() {
        lock.lock();
        try {
            failureCount = 0;
            if (state == CircuitState.HALF_OPEN) {
                successCount++;
                if (successCount >= HALF_OPEN_SUCCESS_THRESHOLD) {
                    state = CircuitState.CLOSED;
                    successCount = 0;
                    log.info("Circuit {} closed", name);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure() {
        lock.lock();
        try {
            failureCount++;
            if (state == CircuitState.HALF_OPEN) {
                trip();
                return;
            }
            if (state == CircuitState.CLOSED && failureCount >= threshold) {
                trip();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code call} through the breaker: fails fast with {@link CircuitOpenException} while
     * open, otherwise records the outcome.
     */
    public <T> T call(Supplier<T> call) {
        return call(call, e -> true);
    }

    /**
     * Like {@link #call(Supplier)}, but an error rejected by {@code countsAsFailure} is rethrown
     * without being recorded.
     */
    public <T> T call(Supplier<T> call, Predicate<RuntimeException> countsAsFailure) {
        if (!allow()) {
            throw new CircuitOpenException(name);
        }
        T result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            if (countsAsFailure.test(e)) {
                recordFailure();
            } else {
                log.debug("Circuit {} ignoring caller error: {}", name, e.getMessage());
            }
            throw e;
        }
        recordSuccess();
        return result;
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public Instant getNextAttempt() {
        lock.lock();
        try {
            return nextAttempt;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    private void trip() {
        state = CircuitState.OPEN;
        successCount = 0;
        nextAttempt = clock.instant().plus(timeout);
        log.warn("Circuit {} open after {} failure(s), next trial at {}", name, failureCount, nextAttempt);
    }
}

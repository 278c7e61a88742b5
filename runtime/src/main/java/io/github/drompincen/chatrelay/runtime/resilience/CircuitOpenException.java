package io.github.drompincen.chatrelay.runtime.resilience;

/**
 * Fail-fast signal from an open {@link CircuitBreaker}. Classified as permanent.
 */
public class CircuitOpenException extends RuntimeException {

    private final String dependency;

    public CircuitOpenException(String dependency) {
        super("circuit breaker is open for " + dependency);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}

package io.github.drompincen.chatrelay.runtime.resilience;

public enum ErrorCategory {
    /** Timeouts, HTTP 429 and 5xx: worth another attempt after a backoff. */
    TEMPORARY,
    /** Everything else, including an open circuit: surfaced immediately. */
    PERMANENT;

    public boolean isRetryable() {
        return this == TEMPORARY;
    }
}

package io.github.drompincen.chatrelay.runtime.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}

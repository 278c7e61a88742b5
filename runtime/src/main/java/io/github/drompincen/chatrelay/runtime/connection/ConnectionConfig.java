package io.github.drompincen.chatrelay.runtime.connection;

import java.time.Duration;

/**
 * Tuning for one {@link ManagedConnection}. {@code idleTimeout} of zero disables the inactivity
 * check; {@code reconnectEnabled} is false on the passive (server) side.
 */
public record ConnectionConfig(
        int maxReconnectAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        Duration pingInterval,
        Duration pongTimeout,
        Duration writeTimeout,
        Duration sendTimeout,
        int messageQueueSize,
        Duration idleTimeout,
        boolean reconnectEnabled
) {

    public static final ConnectionConfig DEFAULT = new ConnectionConfig(
            10,
            Duration.ofSeconds(1),
            Duration.ofSeconds(30),
            Duration.ofSeconds(30),
            Duration.ofSeconds(120),
            Duration.ofSeconds(45),
            Duration.ofSeconds(5),
            1000,
            Duration.ZERO,
            true);

    public ConnectionConfig {
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= 0");
        }
        if (messageQueueSize < 1) {
            throw new IllegalArgumentException("messageQueueSize must be >= 1");
        }
        if (pingInterval.isZero() || pingInterval.isNegative()) {
            throw new IllegalArgumentException("pingInterval must be positive");
        }
        if (idleTimeout == null) {
            idleTimeout = Duration.ZERO;
        }
    }

    public ConnectionConfig withReconnect(boolean enabled) {
        return new ConnectionConfig(maxReconnectAttempts, initialBackoff, maxBackoff, pingInterval,
                pongTimeout, writeTimeout, sendTimeout, messageQueueSize, idleTimeout, enabled);
    }

    public ConnectionConfig withIdleTimeout(Duration timeout) {
        return new ConnectionConfig(maxReconnectAttempts, initialBackoff, maxBackoff, pingInterval,
                pongTimeout, writeTimeout, sendTimeout, messageQueueSize, timeout, reconnectEnabled);
    }

    public boolean idleCheckEnabled() {
        return !idleTimeout.isZero() && !idleTimeout.isNegative();
    }
}

package io.github.drompincen.chatrelay.runtime.connection;

/**
 * Outcome of {@link ManagedConnection#send(String)}. {@code QUEUED} is not an error: the payload
 * sits in the retry queue and goes out on the next flush.
 */
public enum SendResult {
    SENT,
    QUEUED,
    REJECTED
}

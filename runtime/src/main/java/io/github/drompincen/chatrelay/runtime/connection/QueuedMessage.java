package io.github.drompincen.chatrelay.runtime.connection;

import java.time.Instant;

public record QueuedMessage(String payload, Instant enqueuedAt) {
}

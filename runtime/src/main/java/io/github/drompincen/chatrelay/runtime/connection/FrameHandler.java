package io.github.drompincen.chatrelay.runtime.connection;

/**
 * Receives inbound text frames in receipt order, on the transport's read thread.
 */
@FunctionalInterface
public interface FrameHandler {

    void onFrame(ManagedConnection connection, String payload);
}

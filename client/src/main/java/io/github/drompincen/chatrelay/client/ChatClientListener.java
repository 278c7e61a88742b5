package io.github.drompincen.chatrelay.client;

import io.github.drompincen.chatrelay.protocol.ws.ChatResponse;
import io.github.drompincen.chatrelay.protocol.ws.Progress;
import io.github.drompincen.chatrelay.runtime.connection.ConnectionState;

/**
 * Callbacks from a {@link ChatClient}. Invoked on connection threads; implementations must not
 * block.
 */
public interface ChatClientListener {

    default void onResponse(ChatResponse response) {
    }

    default void onProgress(Progress progress) {
    }

    default void onStateChange(ConnectionState from, ConnectionState to) {
    }

    /** Reconnect budget exhausted; only a manual {@link ChatClient#connect()} recovers. */
    default void onReloadRequired() {
    }
}

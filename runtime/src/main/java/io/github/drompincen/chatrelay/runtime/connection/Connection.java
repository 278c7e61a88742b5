package io.github.drompincen.chatrelay.runtime.connection;

import java.io.IOException;

/**
 * One established duplex transport. Implementations must allow concurrent calls from the
 * writer task and the health-check task.
 */
public interface Connection {

    void sendText(String payload) throws IOException;

    void sendPing() throws IOException;

    void close(int code, String reason);

    boolean isOpen();
}

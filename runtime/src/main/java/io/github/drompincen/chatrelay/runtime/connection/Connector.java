package io.github.drompincen.chatrelay.runtime.connection;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Establishes a transport and wires its inbound events to {@code listener}.
 */
@FunctionalInterface
public interface Connector {

    Connection open(TransportListener listener) throws IOException;

    /**
     * Connector for a transport the peer already opened. It can be used once; a passive side
     * never dials back.
     */
    static Connector accepted(AcceptedConnection connection) {
        AtomicBoolean used = new AtomicBoolean();
        return listener -> {
            if (!used.compareAndSet(false, true)) {
                throw new IOException("accepted connection " + connection.id() + " cannot be reopened");
            }
            connection.attach(listener);
            return connection;
        };
    }
}

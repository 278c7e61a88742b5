package io.github.drompincen.chatrelay.runtime.connection;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Succeeds for the first {@code successes} opens, then refuses.
 */
class FakeConnector implements Connector {

    final AtomicInteger opens = new AtomicInteger();
    final FakeConnection connection;
    private final int successes;
    volatile TransportListener listener;

    FakeConnector(FakeConnection connection, int successes) {
        this.connection = connection;
        this.successes = successes;
    }

    @Override
    public Connection open(TransportListener listener) throws IOException {
        if (opens.incrementAndGet() > successes) {
            throw new IOException("connection refused");
        }
        this.listener = listener;
        return connection;
    }
}

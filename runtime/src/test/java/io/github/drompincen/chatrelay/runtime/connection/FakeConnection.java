package io.github.drompincen.chatrelay.runtime.connection;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

class FakeConnection implements Connection {

    final List<String> sent = new CopyOnWriteArrayList<>();
    final List<String> attempted = new CopyOnWriteArrayList<>();
    final AtomicInteger pings = new AtomicInteger();
    volatile boolean failSends;
    volatile boolean failPings;
    volatile boolean open = true;
    volatile int closeCode = -1;

    @Override
    public void sendText(String payload) throws IOException {
        attempted.add(payload);
        if (failSends) {
            throw new IOException("broken pipe");
        }
        sent.add(payload);
    }

    @Override
    public void sendPing() throws IOException {
        if (failPings) {
            throw new IOException("connection reset");
        }
        pings.incrementAndGet();
    }

    @Override
    public void close(int code, String reason) {
        if (closeCode == -1) {
            closeCode = code;
        }
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }
}

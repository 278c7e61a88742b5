package io.github.drompincen.chatrelay.runtime.connection;

import io.github.drompincen.chatrelay.runtime.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManagedConnectionTest {

    private static final ConnectionConfig CLIENT = new ConnectionConfig(
            3, Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofHours(1), Duration.ofSeconds(120),
            Duration.ofSeconds(45), Duration.ofMillis(200), 10, Duration.ZERO, true);

    private static final ConnectionConfig SERVER = CLIENT.withReconnect(false);

    private final MutableClock clock = new MutableClock();
    private final List<ConnectionState> transitions = new CopyOnWriteArrayList<>();
    private ManagedConnection managed;

    @AfterEach
    void tearDown() {
        if (managed != null) {
            managed.close();
        }
    }

    private ManagedConnection build(ConnectionConfig config, Connector connector, ConnectionStateListener extra) {
        managed = ManagedConnection.builder()
                .id("test")
                .config(config)
                .connector(connector)
                .clock(clock)
                .routable(payload -> payload.contains("provider"))
                .stateListener((conn, from, to) -> {
                    transitions.add(to);
                    extra.onStateChange(conn, from, to);
                })
                .build();
        return managed;
    }

    private ManagedConnection build(ConnectionConfig config, Connector connector) {
        return build(config, connector, ConnectionStateListener.NONE);
    }

    @Test
    void failedResendKeepsQueueOrder() {
        FakeConnection transport = new FakeConnection();
        transport.failSends = true;
        ManagedConnection conn = build(CLIENT, new FakeConnector(transport, 1));

        assertThat(conn.send("A provider")).isEqualTo(SendResult.QUEUED);
        assertThat(conn.send("B provider")).isEqualTo(SendResult.QUEUED);
        assertThat(conn.send("C provider")).isEqualTo(SendResult.QUEUED);

        conn.connect();

        assertThat(conn.getState()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(transport.attempted).containsExactly("A provider");
        assertThat(conn.getRetryQueue()).containsExactly("A provider", "B provider", "C provider");

        transport.failSends = false;
        conn.flush();

        assertThat(transport.sent).containsExactly("A provider", "B provider", "C provider");
        assertThat(conn.getRetryQueue()).isEmpty();
    }

    @Test
    void closeIsIdempotent() {
        ManagedConnection conn = build(CLIENT, new FakeConnector(new FakeConnection(), 1));
        conn.connect();

        conn.close();
        conn.close();

        assertThat(transitions).containsOnlyOnce(ConnectionState.CLOSED);
        assertThat(conn.getState()).isEqualTo(ConnectionState.CLOSED);
    }

    @Test
    void reconnectExhaustionEndsInFailed() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);
        FakeConnector connector = new FakeConnector(new FakeConnection(), 1);
        ManagedConnection conn = build(CLIENT, connector, (c, from, to) -> {
            if (to == ConnectionState.FAILED) {
                failed.countDown();
            }
        });
        conn.connect();
        assertThat(conn.getState()).isEqualTo(ConnectionState.CONNECTED);

        connector.listener.onClose(1006, "abnormal closure");

        assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(conn.getState()).isEqualTo(ConnectionState.FAILED);
        // one successful open plus three failed reconnects
        assertThat(connector.opens.get()).isEqualTo(4);

        Thread.sleep(50);
        assertThat(connector.opens.get()).isEqualTo(4);
    }

    @Test
    void initialConnectFailureUsesReconnectBudget() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);
        FakeConnector connector = new FakeConnector(new FakeConnection(), 0);
        ManagedConnection conn = build(CLIENT, connector, (c, from, to) -> {
            if (to == ConnectionState.FAILED) {
                failed.countDown();
            }
        });

        conn.connect();

        assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(conn.getReconnectAttempts()).isEqualTo(3);
        assertThat(connector.opens.get()).isEqualTo(4);
    }

    @Test
    void manualConnectFromFailedStartsOver() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);
        FakeConnection transport = new FakeConnection();
        AtomicInteger opens = new AtomicInteger();
        Connector flaky = listener -> {
            if (opens.incrementAndGet() <= 4) {
                throw new IOException("connection refused");
            }
            return transport;
        };
        ManagedConnection conn = build(CLIENT, flaky, (c, from, to) -> {
            if (to == ConnectionState.FAILED) {
                failed.countDown();
            }
        });
        conn.connect();
        assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();

        conn.connect();

        assertThat(conn.getState()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(conn.getReconnectAttempts()).isZero();
    }

    @Test
    void pongTimeoutForcesCloseWithDistinctCode() {
        FakeConnection transport = new FakeConnection();
        ManagedConnection conn = build(SERVER, new FakeConnector(transport, 1));
        conn.connect();

        clock.advance(Duration.ofSeconds(121));
        conn.runHealthCheck();

        assertThat(transport.closeCode).isEqualTo(CloseCodes.PONG_TIMEOUT);
        assertThat(conn.getState()).isEqualTo(ConnectionState.CLOSED);
        assertThat(transport.pings.get()).isZero();
    }

    @Test
    void healthyConnectionPings() {
        FakeConnection transport = new FakeConnection();
        ManagedConnection conn = build(SERVER, new FakeConnector(transport, 1));
        conn.connect();

        clock.advance(Duration.ofSeconds(100));
        conn.recordPong();
        clock.advance(Duration.ofSeconds(100));
        conn.runHealthCheck();

        assertThat(transport.pings.get()).isEqualTo(1);
        assertThat(conn.getState()).isEqualTo(ConnectionState.CONNECTED);
    }

    @Test
    void idleServerConnectionIsClosed() {
        FakeConnection transport = new FakeConnection();
        ManagedConnection conn = build(SERVER.withIdleTimeout(Duration.ofMinutes(5)), new FakeConnector(transport, 1));
        conn.connect();
        conn.recordPong();

        clock.advance(Duration.ofMinutes(6));
        conn.recordPong();
        conn.runHealthCheck();

        assertThat(conn.getState()).isEqualTo(ConnectionState.CLOSED);
        assertThat(transport.closeCode).isEqualTo(CloseCodes.IDLE_TIMEOUT);
    }

    @Test
    void unroutablePayloadIsRejectedAndNeverQueued() {
        ManagedConnection conn = build(CLIENT, new FakeConnector(new FakeConnection(), 1));

        assertThat(conn.send("{\"type\":\"message\"}")).isEqualTo(SendResult.REJECTED);
        assertThat(conn.getQueueDepth()).isZero();
    }

    @Test
    void sendWhileConnectedReachesTransport() throws Exception {
        FakeConnection transport = new FakeConnection();
        ManagedConnection conn = build(CLIENT, new FakeConnector(transport, 1));
        conn.connect();

        assertThat(conn.send("hello provider")).isEqualTo(SendResult.SENT);

        long deadline = System.currentTimeMillis() + 5000;
        while (transport.sent.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(transport.sent).containsExactly("hello provider");
    }

    @Test
    void sendAfterCloseIsRejected() {
        ManagedConnection conn = build(CLIENT, new FakeConnector(new FakeConnection(), 1));
        conn.connect();
        conn.close();

        assertThat(conn.send("late provider")).isEqualTo(SendResult.REJECTED);
    }

    @Test
    void writeFailureMovesMessageToRetryQueue() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);
        FakeConnection transport = new FakeConnection();
        transport.failSends = true;
        ConnectionConfig noRetries = new ConnectionConfig(
                0, Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofHours(1), Duration.ofSeconds(120),
                Duration.ofSeconds(45), Duration.ofMillis(200), 10, Duration.ZERO, true);
        ManagedConnection conn = build(noRetries, new FakeConnector(transport, 1), (c, from, to) -> {
            if (to == ConnectionState.FAILED) {
                failed.countDown();
            }
        });
        conn.connect();

        conn.send("X provider");

        assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(transport.closeCode).isEqualTo(CloseCodes.WRITE_FAILED);
        assertThat(conn.getRetryQueue()).containsExactly("X provider");
    }

    @Test
    void framesFromClosedConnectionAreIgnored() {
        List<String> frames = new CopyOnWriteArrayList<>();
        FakeConnector connector = new FakeConnector(new FakeConnection(), 1);
        managed = ManagedConnection.builder()
                .id("frames")
                .config(SERVER)
                .connector(connector)
                .clock(clock)
                .frameHandler((conn, payload) -> frames.add(payload))
                .build();
        managed.connect();

        connector.listener.onText("first");
        managed.close();
        connector.listener.onText("second");

        assertThat(frames).containsExactly("first");
    }

    @Test
    void acceptedConnectorOpensOnlyOnce() throws Exception {
        FakeAccepted accepted = new FakeAccepted();
        Connector connector = Connector.accepted(accepted);

        connector.open(new NoopListener());

        assertThatThrownBy(() -> connector.open(new NoopListener()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("cannot be reopened");
    }

    @Test
    void transportErrorClosesOldTransportBeforeReconnecting() throws Exception {
        List<FakeConnection> transports = new CopyOnWriteArrayList<>();
        List<TransportListener> listeners = new CopyOnWriteArrayList<>();
        List<Boolean> previousClosedAtOpen = new CopyOnWriteArrayList<>();
        Connector connector = listener -> {
            if (!transports.isEmpty()) {
                previousClosedAtOpen.add(!transports.get(transports.size() - 1).isOpen());
            }
            FakeConnection transport = new FakeConnection();
            transports.add(transport);
            listeners.add(listener);
            return transport;
        };
        CountDownLatch reconnected = new CountDownLatch(2);
        ManagedConnection conn = build(CLIENT, connector, (c, from, to) -> {
            if (to == ConnectionState.CONNECTED) {
                reconnected.countDown();
            }
        });
        conn.connect();

        listeners.get(0).onError(new IOException("connection reset by peer"));

        assertThat(reconnected.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(conn.getState()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(transports).hasSize(2);
        assertThat(transports.get(0).isOpen()).isFalse();
        assertThat(transports.get(0).closeCode).isEqualTo(CloseCodes.GOING_AWAY);
        assertThat(transports.get(1).isOpen()).isTrue();
        assertThat(previousClosedAtOpen).containsExactly(true);
    }

    @Test
    void transportErrorOnServerClosesTheSession() {
        FakeConnection transport = new FakeConnection();
        FakeConnector connector = new FakeConnector(transport, 1);
        ManagedConnection conn = build(SERVER, connector);
        conn.connect();

        connector.listener.onError(new IOException("connection reset by peer"));

        assertThat(conn.getState()).isEqualTo(ConnectionState.CLOSED);
        assertThat(transport.isOpen()).isFalse();
        assertThat(transport.closeCode).isEqualTo(CloseCodes.GOING_AWAY);
    }

    @Test
    void closeDuringConnectIsNotReportedAsConnected() throws Exception {
        List<FakeConnection> transports = new CopyOnWriteArrayList<>();
        Connector connector = listener -> {
            FakeConnection transport = new FakeConnection();
            transports.add(transport);
            if (transports.size() == 1) {
                transport.open = false;
                listener.onClose(1006, "abnormal closure");
            }
            return transport;
        };
        CountDownLatch connected = new CountDownLatch(1);
        ManagedConnection conn = build(CLIENT, connector, (c, from, to) -> {
            if (to == ConnectionState.CONNECTED) {
                connected.countDown();
            }
        });

        conn.connect();

        assertThat(connected.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(transitions).startsWith(ConnectionState.CONNECTING, ConnectionState.RECONNECTING);
        assertThat(transports).hasSize(2);
        assertThat(transports.get(1).isOpen()).isTrue();
        assertThat(conn.getReconnectAttempts()).isZero();
    }

    @Test
    void failedPingTearsDownTheTransport() {
        FakeConnection transport = new FakeConnection();
        ManagedConnection conn = build(SERVER, new FakeConnector(transport, 1));
        conn.connect();
        transport.failPings = true;

        conn.runHealthCheck();

        assertThat(conn.getState()).isEqualTo(ConnectionState.CLOSED);
        assertThat(transport.closeCode).isEqualTo(CloseCodes.GOING_AWAY);
    }

    @Test
    void fullOutboundQueueSpillsToRetryQueueInOrder() throws Exception {
        GatedConnection transport = new GatedConnection();
        ConnectionConfig oneSlot = new ConnectionConfig(
                3, Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofHours(1), Duration.ofSeconds(120),
                Duration.ofSeconds(45), Duration.ofMillis(200), 1, Duration.ZERO, true);
        ManagedConnection conn = build(oneSlot, new FakeConnector(transport, 1));
        conn.connect();

        assertThat(conn.send("A provider")).isEqualTo(SendResult.SENT);
        assertThat(transport.entered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(conn.send("B provider")).isEqualTo(SendResult.SENT);

        long start = System.nanoTime();
        assertThat(conn.send("C provider")).isEqualTo(SendResult.QUEUED);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(150));
        assertThat(conn.getRetryQueue()).containsExactly("C provider");

        transport.gate.countDown();
        long deadline = System.currentTimeMillis() + 5000;
        while (transport.sent.size() < 3 && System.currentTimeMillis() < deadline) {
            conn.flush();
            Thread.sleep(10);
        }
        assertThat(transport.sent).containsExactly("A provider", "B provider", "C provider");
        assertThat(conn.getRetryQueue()).isEmpty();
    }

    /** Blocks every write until {@code gate} opens. */
    private static final class GatedConnection extends FakeConnection {

        final CountDownLatch gate = new CountDownLatch(1);
        final CountDownLatch entered = new CountDownLatch(1);

        @Override
        public void sendText(String payload) throws IOException {
            entered.countDown();
            try {
                if (!gate.await(5, TimeUnit.SECONDS)) {
                    throw new IOException("write timed out");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
            super.sendText(payload);
        }
    }

    private static final class FakeAccepted extends FakeConnection implements AcceptedConnection {

        @Override
        public String id() {
            return "accepted-1";
        }

        @Override
        public void attach(TransportListener listener) {
        }
    }

    private static final class NoopListener implements TransportListener {

        @Override
        public void onText(String payload) {
        }

        @Override
        public void onPong() {
        }

        @Override
        public void onClose(int code, String reason) {
        }

        @Override
        public void onError(Throwable error) {
        }
    }
}

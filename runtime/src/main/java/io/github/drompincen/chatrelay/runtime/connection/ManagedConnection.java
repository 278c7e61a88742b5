package io.github.drompincen.chatrelay.runtime.connection;

import io.github.drompincen.chatrelay.runtime.resilience.Backoff;
import io.github.drompincen.chatrelay.runtime.resilience.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Connection state machine shared by both ends of the relay. The client side runs with
 * reconnect enabled; the server side wraps an accepted session and tears down on close.
 *
 * <p>State, the current transport, the reconnect counter and the retry queue are guarded by one
 * lock. Listener callbacks fire after the lock is released. Each transport attempt gets a
 * generation number so callbacks from a superseded transport are ignored.
 *
 * <p>Background work (writer loop, health check, reconnect timer, flushes) runs on this
 * connection's own scheduled executor and is cancelled as a unit by {@link #close()}.
 */
public class ManagedConnection {

    private static final Logger log = LoggerFactory.getLogger(ManagedConnection.class);

    private static final int TASK_THREADS = 3;

    private final String id;
    private final ConnectionConfig config;
    private final Connector connector;
    private final FrameHandler frameHandler;
    private final CircuitBreaker circuitBreaker;
    private final ConnectionStateListener stateListener;
    private final Predicate<String> routable;
    private final Clock clock;
    private final ScheduledExecutorService executor;

    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock flushLock = new ReentrantLock();
    private final Deque<QueuedMessage> retryQueue = new ArrayDeque<>();
    private final List<StateChange> pendingEvents = new ArrayList<>();

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private Connection connection;
    private long generation;
    private int reconnectAttempts;
    private BlockingQueue<String> outbound = new LinkedBlockingQueue<>(1);
    private String inFlight;
    private boolean flushing;
    private Future<?> writerTask;
    private Future<?> healthCheckTask;
    private Future<?> reconnectTask;

    private volatile Instant lastPongReceived;
    private volatile Instant lastActivity;

    private ManagedConnection(Builder builder) {
        this.id = builder.id;
        this.config = builder.config;
        this.connector = builder.connector;
        this.frameHandler = builder.frameHandler;
        this.circuitBreaker = builder.circuitBreaker != null
                ? builder.circuitBreaker
                : new CircuitBreaker("connection-" + builder.id, 5, Duration.ofMinutes(1), builder.clock);
        this.stateListener = builder.stateListener;
        this.routable = builder.routable;
        this.clock = builder.clock;
        this.executor = builder.executor != null ? builder.executor : newTaskGroup(builder.id);
        this.lastPongReceived = clock.instant();
        this.lastActivity = clock.instant();
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- lifecycle -------------------------------------------------------------------------

    /**
     * Opens the transport on the calling thread. A no-op while connecting or connected and
     * after {@link #close()}; from {@code FAILED} it starts over with a fresh attempt budget.
     */
    public void connect() {
        Long attempt = locked(() -> {
            if (state == ConnectionState.CONNECTING || state == ConnectionState.CONNECTED) {
                log.debug("Connection {} already {}", id, state);
                return null;
            }
            if (state == ConnectionState.CLOSED) {
                log.debug("Connection {} is closed, ignoring connect", id);
                return null;
            }
            if (state == ConnectionState.FAILED) {
                reconnectAttempts = 0;
            }
            cancel(reconnectTask);
            reconnectTask = null;
            generation++;
            transition(ConnectionState.CONNECTING);
            return generation;
        });
        if (attempt == null) {
            return;
        }
        long gen = attempt;

        Binding binding = new Binding(gen);
        Connection opened;
        try {
            opened = connector.open(binding);
        } catch (IOException | RuntimeException e) {
            log.warn("Connection {} failed to connect: {}", id, e.getMessage());
            locked(() -> {
                if (gen == generation && state == ConnectionState.CONNECTING) {
                    scheduleReconnect();
                }
                return null;
            });
            return;
        }

        Handshake outcome = locked(() -> {
            if (gen != generation || state != ConnectionState.CONNECTING) {
                return Handshake.SUPERSEDED;
            }
            if (binding.lost || !opened.isOpen()) {
                return Handshake.LOST;
            }
            connection = opened;
            reconnectAttempts = 0;
            Instant now = clock.instant();
            lastPongReceived = now;
            lastActivity = now;
            outbound = new LinkedBlockingQueue<>(config.messageQueueSize());
            BlockingQueue<String> queue = outbound;
            writerTask = executor.submit(() -> writeLoop(gen, opened, queue));
            long interval = config.pingInterval().toMillis();
            healthCheckTask = executor.scheduleAtFixedRate(
                    this::runHealthCheck, interval, interval, TimeUnit.MILLISECONDS);
            transition(ConnectionState.CONNECTED);
            return Handshake.ESTABLISHED;
        });
        if (outcome == Handshake.SUPERSEDED) {
            opened.close(CloseCodes.NORMAL, "superseded");
            return;
        }
        if (outcome == Handshake.LOST) {
            log.warn("Connection {} transport closed before it was established", id);
            opened.close(CloseCodes.GOING_AWAY, "closed during connect");
            locked(() -> {
                if (gen == generation && state == ConnectionState.CONNECTING) {
                    scheduleReconnect();
                }
                return null;
            });
            return;
        }
        flush();
    }

    /**
     * Intentional shutdown. Idempotent; never triggers a reconnect.
     */
    public void close() {
        close(CloseCodes.NORMAL, "closed");
    }

    public void close(int code, String reason) {
        Connection toClose = locked(() -> {
            if (state == ConnectionState.CLOSED) {
                return null;
            }
            generation++;
            Connection current = connection;
            connection = null;
            stopTasks();
            int discarded = retryQueue.size() + outbound.size() + (inFlight != null ? 1 : 0);
            if (discarded > 0) {
                log.warn("Connection {} closed with {} undelivered message(s)", id, discarded);
            }
            transition(ConnectionState.CLOSED);
            return current != null ? current : NO_CONNECTION;
        });
        if (toClose == null) {
            return;
        }
        if (toClose != NO_CONNECTION) {
            toClose.close(code, reason);
        }
        executor.shutdownNow();
    }

    // --- sending ---------------------------------------------------------------------------

    /**
     * Hands {@code payload} to the writer. Unroutable payloads are rejected outright; anything
     * that cannot go out now, or within {@code sendTimeout}, lands in the retry queue.
     */
    public SendResult send(String payload) {
        Objects.requireNonNull(payload, "payload");
        if (!routable.test(payload)) {
            log.warn("Connection {} rejected a message without a routing target", id);
            return SendResult.REJECTED;
        }
        boolean breakerAllows = circuitBreaker.allow();

        Admission admission = locked(() -> {
            if (state == ConnectionState.CLOSED) {
                return new Admission(SendResult.REJECTED, null, generation);
            }
            if (state != ConnectionState.CONNECTED || !retryQueue.isEmpty() || flushing || !breakerAllows) {
                retryQueue.addLast(new QueuedMessage(payload, clock.instant()));
                return new Admission(SendResult.QUEUED, null, generation);
            }
            return new Admission(null, outbound, generation);
        });
        if (admission.result() == SendResult.REJECTED) {
            log.warn("Connection {} is closed, dropping message", id);
            return SendResult.REJECTED;
        }
        if (admission.result() == SendResult.QUEUED) {
            log.debug("Connection {} queued message for later delivery", id);
            requestFlush();
            return SendResult.QUEUED;
        }

        boolean accepted;
        try {
            accepted = admission.queue().offer(payload, config.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            accepted = false;
        }
        if (!accepted) {
            log.warn("Connection {} outbound queue full after {} ms, spilling to retry queue",
                    id, config.sendTimeout().toMillis());
            spill(payload);
            return SendResult.QUEUED;
        }
        boolean superseded = locked(() -> {
            if (admission.generation() != generation && admission.queue().remove(payload)) {
                retryQueue.addLast(new QueuedMessage(payload, clock.instant()));
                return true;
            }
            return false;
        });
        return superseded ? SendResult.QUEUED : SendResult.SENT;
    }

    /**
     * Drains the retry queue FIFO over the live transport. The first failed message goes back to
     * the front and the cycle stops.
     */
    public void flush() {
        if (!flushLock.tryLock()) {
            return;
        }
        try {
            locked(() -> flushing = true);
            while (true) {
                FlushItem item = locked(this::nextForFlush);
                if (item == null) {
                    return;
                }
                if (!circuitBreaker.allow()) {
                    requeueFront(item.message());
                    log.debug("Connection {} flush paused, circuit open", id);
                    return;
                }
                try {
                    item.connection().sendText(item.message().payload());
                    circuitBreaker.recordSuccess();
                    lastActivity = clock.instant();
                } catch (IOException | RuntimeException e) {
                    requeueFront(item.message());
                    circuitBreaker.recordFailure();
                    log.warn("Connection {} flush stopped, resend failed: {}", id, e.getMessage());
                    return;
                }
            }
        } finally {
            locked(() -> flushing = false);
            flushLock.unlock();
        }
    }

    // --- health ----------------------------------------------------------------------------

    /**
     * One health-check tick: idle and pong deadlines, then a ping, then a flush.
     */
    public void runHealthCheck() {
        FlushItem current = locked(() -> state == ConnectionState.CONNECTED && connection != null
                ? new FlushItem(connection, null, generation) : null);
        if (current == null) {
            return;
        }
        Instant now = clock.instant();
        if (config.idleCheckEnabled()
                && Duration.between(lastActivity, now).compareTo(config.idleTimeout()) > 0) {
            log.info("Connection {} idle for more than {}s, closing", id, config.idleTimeout().toSeconds());
            close(CloseCodes.IDLE_TIMEOUT, "idle timeout");
            return;
        }
        if (Duration.between(lastPongReceived, now).compareTo(config.pongTimeout()) > 0) {
            log.warn("Connection {} missed pong for more than {}s, presuming peer dead",
                    id, config.pongTimeout().toSeconds());
            circuitBreaker.recordFailure();
            onUnexpectedClose(current.generation(), CloseCodes.PONG_TIMEOUT, "pong timeout");
            return;
        }
        try {
            current.connection().sendPing();
        } catch (IOException | RuntimeException e) {
            circuitBreaker.recordFailure();
            log.warn("Connection {} ping failed: {}", id, e.getMessage());
            onUnexpectedClose(current.generation(), CloseCodes.GOING_AWAY, "ping failed");
            return;
        }
        flush();
    }

    public void recordPong() {
        lastPongReceived = clock.instant();
    }

    // --- accessors -------------------------------------------------------------------------

    public String getId() {
        return id;
    }

    public ConnectionState getState() {
        return locked(() -> state);
    }

    public int getQueueDepth() {
        return locked(() -> retryQueue.size() + outbound.size() + (inFlight != null ? 1 : 0));
    }

    public List<String> getRetryQueue() {
        return locked(() -> retryQueue.stream().map(QueuedMessage::payload).toList());
    }

    public int getReconnectAttempts() {
        return locked(() -> reconnectAttempts);
    }

    public Instant getLastPongReceived() {
        return lastPongReceived;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    // --- internals -------------------------------------------------------------------------

    private void writeLoop(long gen, Connection conn, BlockingQueue<String> queue) {
        while (!Thread.currentThread().isInterrupted()) {
            String payload;
            try {
                payload = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            boolean current = locked(() -> {
                if (gen != generation) {
                    retryQueue.addFirst(new QueuedMessage(payload, clock.instant()));
                    return false;
                }
                inFlight = payload;
                return true;
            });
            if (!current) {
                return;
            }
            try {
                conn.sendText(payload);
                circuitBreaker.recordSuccess();
                lastActivity = clock.instant();
                locked(() -> {
                    if (gen == generation) {
                        inFlight = null;
                    }
                    return null;
                });
            } catch (IOException | RuntimeException e) {
                circuitBreaker.recordFailure();
                log.warn("Connection {} write failed: {}", id, e.getMessage());
                onUnexpectedClose(gen, CloseCodes.WRITE_FAILED, "write failed");
                return;
            }
        }
    }

    /**
     * Tears down a lost transport. The transport is closed with {@code closeCode} before the
     * state changes, so a reconnect can never run while the old transport is still open.
     */
    private void onUnexpectedClose(long gen, int closeCode, String reason) {
        Connection lost = locked(() -> gen == generation && state == ConnectionState.CONNECTED ? connection : null);
        if (lost == null) {
            return;
        }
        lost.close(closeCode, reason);

        Boolean tornDown = locked(() -> {
            if (gen != generation || state != ConnectionState.CONNECTED) {
                return null;
            }
            log.info("Connection {} lost ({})", id, reason);
            generation++;
            connection = null;
            stopTasks();
            salvageOutbound();
            if (!config.reconnectEnabled()) {
                transition(ConnectionState.CLOSED);
                return true;
            }
            transition(ConnectionState.DISCONNECTED);
            scheduleReconnect();
            return false;
        });
        if (Boolean.TRUE.equals(tornDown)) {
            executor.shutdownNow();
        }
    }

    /** Caller holds the lock. */
    private void scheduleReconnect() {
        if (!config.reconnectEnabled() || reconnectAttempts >= config.maxReconnectAttempts()) {
            log.error("Connection {} giving up after {} reconnect attempt(s)", id, reconnectAttempts);
            transition(ConnectionState.FAILED);
            return;
        }
        reconnectAttempts++;
        Duration delay = Backoff.delay(config.initialBackoff(), config.maxBackoff(), reconnectAttempts);
        transition(ConnectionState.RECONNECTING);
        log.info("Connection {} reconnect attempt {}/{} in {} ms",
                id, reconnectAttempts, config.maxReconnectAttempts(), delay.toMillis());
        try {
            reconnectTask = executor.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Connection {} could not schedule reconnect: {}", id, e.getMessage());
        }
    }

    /** Caller holds the lock. Puts in-flight and outbound payloads ahead of the retry backlog. */
    private void salvageOutbound() {
        List<String> pending = new ArrayList<>();
        if (inFlight != null) {
            pending.add(inFlight);
            inFlight = null;
        }
        outbound.drainTo(pending);
        Instant now = clock.instant();
        for (int i = pending.size() - 1; i >= 0; i--) {
            retryQueue.addFirst(new QueuedMessage(pending.get(i), now));
        }
        if (!pending.isEmpty()) {
            log.info("Connection {} moved {} pending message(s) to the retry queue", id, pending.size());
        }
    }

    /** Caller holds the lock. */
    private void stopTasks() {
        cancel(writerTask);
        cancel(healthCheckTask);
        cancel(reconnectTask);
        writerTask = null;
        healthCheckTask = null;
        reconnectTask = null;
    }

    /** Caller holds the lock. */
    private FlushItem nextForFlush() {
        if (state != ConnectionState.CONNECTED || connection == null || retryQueue.isEmpty()) {
            return null;
        }
        if (!outbound.isEmpty() || inFlight != null) {
            return null;
        }
        return new FlushItem(connection, retryQueue.pollFirst(), generation);
    }

    private void requeueFront(QueuedMessage message) {
        locked(() -> {
            retryQueue.addFirst(message);
            return null;
        });
    }

    private void spill(String payload) {
        locked(() -> {
            retryQueue.addLast(new QueuedMessage(payload, clock.instant()));
            return null;
        });
    }

    private void requestFlush() {
        boolean connected = locked(() -> state == ConnectionState.CONNECTED && !flushing);
        if (!connected) {
            return;
        }
        try {
            executor.execute(this::flush);
        } catch (RejectedExecutionException e) {
            log.debug("Connection {} flush not scheduled: {}", id, e.getMessage());
        }
    }

    /** Caller holds the lock. */
    private void transition(ConnectionState to) {
        ConnectionState from = state;
        if (from == to) {
            return;
        }
        state = to;
        log.info("Connection {} state {} -> {}", id, from, to);
        pendingEvents.add(new StateChange(from, to));
    }

    private <T> T locked(Supplier<T> action) {
        List<StateChange> fired;
        T result;
        lock.lock();
        try {
            result = action.get();
        } finally {
            fired = pendingEvents.isEmpty() ? List.of() : new ArrayList<>(pendingEvents);
            pendingEvents.clear();
            lock.unlock();
        }
        for (StateChange change : fired) {
            try {
                stateListener.onStateChange(this, change.from(), change.to());
            } catch (RuntimeException e) {
                log.warn("State listener failed for connection {}: {}", id, e.getMessage(), e);
            }
        }
        return result;
    }

    private static void cancel(Future<?> task) {
        if (task != null) {
            task.cancel(true);
        }
    }

    private static ScheduledExecutorService newTaskGroup(String id) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "conn-" + id + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(TASK_THREADS, factory);
        pool.setRemoveOnCancelPolicy(true);
        return pool;
    }

    private static final Connection NO_CONNECTION = new Connection() {
        @Override
        public void sendText(String payload) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void sendPing() {
            throw new UnsupportedOperationException();
        }

        @Override
        public void close(int code, String reason) {
        }

        @Override
        public boolean isOpen() {
            return false;
        }
    };

    private record StateChange(ConnectionState from, ConnectionState to) {
    }

    private enum Handshake {
        ESTABLISHED, SUPERSEDED, LOST
    }

    private record Admission(SendResult result, BlockingQueue<String> queue, long generation) {
    }

    private record FlushItem(Connection connection, QueuedMessage message, long generation) {
    }

    /**
     * Routes transport events for one generation back into the state machine.
     */
    private final class Binding implements TransportListener {

        private final long gen;
        // set when the transport reports a close or error, even before the connection is established
        private volatile boolean lost;

        private Binding(long gen) {
            this.gen = gen;
        }

        private boolean stale() {
            return locked(() -> gen != generation || state == ConnectionState.CLOSED);
        }

        @Override
        public void onText(String payload) {
            if (stale()) {
                return;
            }
            lastActivity = clock.instant();
            frameHandler.onFrame(ManagedConnection.this, payload);
        }

        @Override
        public void onPong() {
            if (!stale()) {
                recordPong();
            }
        }

        @Override
        public void onClose(int code, String reason) {
            lost = true;
            onUnexpectedClose(gen, CloseCodes.GOING_AWAY, "peer closed with " + code + " " + reason);
        }

        @Override
        public void onError(Throwable error) {
            lost = true;
            log.warn("Connection {} transport error: {}", id, error.getMessage());
            onUnexpectedClose(gen, CloseCodes.GOING_AWAY, "transport error");
        }
    }

    public static final class Builder {

        private String id = UUID.randomUUID().toString();
        private ConnectionConfig config = ConnectionConfig.DEFAULT;
        private Connector connector;
        private FrameHandler frameHandler = (connection, payload) -> { };
        private CircuitBreaker circuitBreaker;
        private ConnectionStateListener stateListener = ConnectionStateListener.NONE;
        private Predicate<String> routable = payload -> true;
        private Clock clock = Clock.systemUTC();
        private ScheduledExecutorService executor;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder config(ConnectionConfig config) {
            this.config = config;
            return this;
        }

        public Builder connector(Connector connector) {
            this.connector = connector;
            return this;
        }

        public Builder frameHandler(FrameHandler frameHandler) {
            this.frameHandler = frameHandler;
            return this;
        }

        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder stateListener(ConnectionStateListener stateListener) {
            this.stateListener = stateListener;
            return this;
        }

        /** Payloads failing this check are never queued. */
        public Builder routable(Predicate<String> routable) {
            this.routable = routable;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Task group for this connection; shut down by {@link ManagedConnection#close()}. */
        public Builder executor(ScheduledExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public ManagedConnection build() {
            Objects.requireNonNull(connector, "connector");
            Objects.requireNonNull(config, "config");
            return new ManagedConnection(this);
        }
    }
}

package io.github.drompincen.chatrelay.runtime.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Duration;

/**
 * {@link Connection} over a Spring {@link WebSocketSession}. Sends go through a
 * {@link ConcurrentWebSocketSessionDecorator} so the writer and the health check may send
 * concurrently, and a send stuck longer than the write timeout fails the session.
 *
 * <p>The owning {@code WebSocketHandler} forwards its callbacks through the {@code dispatch*}
 * methods.
 */
public class WebSocketSessionConnection implements AcceptedConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionConnection.class);

    private final WebSocketSession session;
    private volatile TransportListener listener;

    public WebSocketSessionConnection(WebSocketSession session, Duration writeTimeout, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(
                session, (int) Math.min(Integer.MAX_VALUE, writeTimeout.toMillis()), bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void attach(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void sendText(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void sendPing() throws IOException {
        session.sendMessage(new PingMessage());
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.debug("Closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    public void dispatchText(String payload) {
        TransportListener l = listener;
        if (l != null) {
            l.onText(payload);
        } else {
            log.warn("Dropping frame on session {} received before a listener was attached", session.getId());
        }
    }

    public void dispatchPong() {
        TransportListener l = listener;
        if (l != null) {
            l.onPong();
        }
    }

    public void dispatchClose(CloseStatus status) {
        TransportListener l = listener;
        if (l != null) {
            l.onClose(status.getCode(), status.getReason());
        }
    }

    public void dispatchError(Throwable error) {
        TransportListener l = listener;
        if (l != null) {
            l.onError(error);
        }
    }
}

package io.github.drompincen.chatrelay.client;

import io.github.drompincen.chatrelay.runtime.connection.Connection;
import io.github.drompincen.chatrelay.runtime.connection.Connector;
import io.github.drompincen.chatrelay.runtime.connection.TransportListener;
import io.github.drompincen.chatrelay.runtime.connection.WebSocketSessionConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dials the gateway with Spring's {@link StandardWebSocketClient}. Each {@link #open} performs a
 * fresh handshake; the returned transport reports its events to the given listener.
 */
public class WebSocketConnector implements Connector {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnector.class);

    private final WebSocketClient client;
    private final URI uri;
    private final Duration handshakeTimeout;
    private final Duration writeTimeout;
    private final int sendBufferLimit;

    public WebSocketConnector(WebSocketClient client, URI uri, Duration handshakeTimeout,
                              Duration writeTimeout, int sendBufferLimit) {
        this.client = client;
        this.uri = uri;
        this.handshakeTimeout = handshakeTimeout;
        this.writeTimeout = writeTimeout;
        this.sendBufferLimit = sendBufferLimit;
    }

    public WebSocketConnector(URI uri) {
        this(new StandardWebSocketClient(), uri, Duration.ofSeconds(10), Duration.ofSeconds(45), 1024 * 1024);
    }

    @Override
    public Connection open(TransportListener listener) throws IOException {
        var handler = new ForwardingHandler(listener);
        CompletableFuture<WebSocketSession> handshake = client.execute(handler, new WebSocketHttpHeaders(), uri);
        try {
            handshake.get(handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            handshake.cancel(true);
            throw new IOException("handshake with " + uri + " timed out after " + handshakeTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw new IOException("handshake with " + uri + " failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while connecting to " + uri, e);
        }
        WebSocketSessionConnection transport = handler.transport;
        if (transport == null) {
            throw new IOException("handshake with " + uri + " completed without a session");
        }
        log.debug("Connected to {} session={}", uri, transport.id());
        return transport;
    }

    private final class ForwardingHandler extends TextWebSocketHandler {

        private final TransportListener listener;
        private volatile WebSocketSessionConnection transport;

        private ForwardingHandler(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            var connection = new WebSocketSessionConnection(session, writeTimeout, sendBufferLimit);
            connection.attach(listener);
            transport = connection;
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            transport.dispatchText(message.getPayload());
        }

        @Override
        protected void handlePongMessage(WebSocketSession session, PongMessage message) {
            transport.dispatchPong();
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            WebSocketSessionConnection current = transport;
            if (current != null) {
                current.dispatchError(exception);
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            WebSocketSessionConnection current = transport;
            if (current != null) {
                current.dispatchClose(status);
            }
        }
    }
}

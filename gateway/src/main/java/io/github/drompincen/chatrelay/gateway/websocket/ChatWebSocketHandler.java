package io.github.drompincen.chatrelay.gateway.websocket;

import io.github.drompincen.chatrelay.runtime.chat.MessageProtocolHandler;
import io.github.drompincen.chatrelay.runtime.connection.ConnectionConfig;
import io.github.drompincen.chatrelay.runtime.connection.ConnectionRegistry;
import io.github.drompincen.chatrelay.runtime.connection.Connector;
import io.github.drompincen.chatrelay.runtime.connection.ManagedConnection;
import io.github.drompincen.chatrelay.runtime.connection.WebSocketSessionConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accepts sockets on {@code /ws}. Every session becomes a server-side {@link ManagedConnection}
 * (no reconnect, inactivity check on) registered in the {@link ConnectionRegistry} until it
 * reaches a terminal state. Container callbacks are forwarded to the session's transport.
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    private final ConnectionConfig connectionConfig;
    private final ConnectionRegistry registry;
    private final MessageProtocolHandler protocolHandler;
    private final int sendBufferLimit;
    private final Map<String, WebSocketSessionConnection> transports = new ConcurrentHashMap<>();

    public ChatWebSocketHandler(ConnectionConfig connectionConfig, ConnectionRegistry registry,
                                MessageProtocolHandler protocolHandler,
                                @Value("${chatrelay.connection.send-buffer-limit:16777216}") int sendBufferLimit) {
        this.connectionConfig = connectionConfig.withReconnect(false);
        this.registry = registry;
        this.protocolHandler = protocolHandler;
        this.sendBufferLimit = sendBufferLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var transport = new WebSocketSessionConnection(session, connectionConfig.writeTimeout(), sendBufferLimit);
        transports.put(session.getId(), transport);

        ManagedConnection connection = ManagedConnection.builder()
                .id(session.getId())
                .config(connectionConfig)
                .connector(Connector.accepted(transport))
                .frameHandler(protocolHandler)
                .stateListener((conn, from, to) -> {
                    if (to.isTerminal()) {
                        registry.unregister(conn.getId());
                        transports.remove(conn.getId());
                    }
                })
                .build();
        registry.register(connection);
        log.info("WebSocket connection established id={} remote={}", session.getId(), session.getRemoteAddress());
        connection.connect();
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        var transport = transports.get(session.getId());
        if (transport == null) {
            log.warn("Frame on unknown session {}, dropping", session.getId());
            return;
        }
        transport.dispatchText(message.getPayload());
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        var transport = transports.get(session.getId());
        if (transport != null) {
            transport.dispatchPong();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on {}: {}", session.getId(), exception.getMessage());
        var transport = transports.get(session.getId());
        if (transport != null) {
            transport.dispatchError(exception);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket connection closed id={} code={} reason={}",
                session.getId(), status.getCode(), status.getReason());
        var transport = transports.remove(session.getId());
        if (transport != null) {
            transport.dispatchClose(status);
        }
        registry.unregister(session.getId());
    }

    int activeTransports() {
        return transports.size();
    }
}

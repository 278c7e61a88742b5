package io.github.drompincen.chatrelay.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.chatrelay.protocol.ws.ChatRequest;
import io.github.drompincen.chatrelay.protocol.ws.ChatResponse;
import io.github.drompincen.chatrelay.protocol.ws.EnvelopeCodec;
import io.github.drompincen.chatrelay.protocol.ws.EnvelopeException;
import io.github.drompincen.chatrelay.protocol.ws.EnvelopeType;
import io.github.drompincen.chatrelay.protocol.ws.Ping;
import io.github.drompincen.chatrelay.protocol.ws.Pong;
import io.github.drompincen.chatrelay.protocol.ws.Progress;
import io.github.drompincen.chatrelay.protocol.ws.ServerEnvelope;
import io.github.drompincen.chatrelay.runtime.connection.ConnectionConfig;
import io.github.drompincen.chatrelay.runtime.connection.ConnectionState;
import io.github.drompincen.chatrelay.runtime.connection.Connector;
import io.github.drompincen.chatrelay.runtime.connection.ManagedConnection;
import io.github.drompincen.chatrelay.runtime.connection.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of the relay. Wraps a reconnecting {@link ManagedConnection}: requests sent while
 * the link is down wait in its retry queue and go out after the next successful connect.
 */
public class ChatClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChatClient.class);

    private final EnvelopeCodec codec;
    private final ChatClientListener listener;
    private final ManagedConnection connection;

    public ChatClient(String id, Connector connector, ConnectionConfig config, EnvelopeCodec codec,
                      ChatClientListener listener) {
        this.codec = codec;
        this.listener = listener;
        this.connection = ManagedConnection.builder()
                .id(id)
                .config(config.withReconnect(true))
                .connector(connector)
                .frameHandler((conn, payload) -> onFrame(payload))
                .stateListener((conn, from, to) -> onStateChange(from, to))
                .routable(this::isRoutable)
                .build();
    }

    public void connect() {
        connection.connect();
    }

    public SendResult send(ChatRequest request) {
        SendResult result = connection.send(codec.encode(request));
        if (result == SendResult.REJECTED) {
            log.warn("Request for provider '{}' was not accepted in state {}", request.provider(), connection.getState());
        }
        return result;
    }

    /** Application-level keep-alive; the answer refreshes the liveness timestamp. */
    public void ping() {
        connection.send(codec.encode(Ping.INSTANCE));
    }

    public ConnectionState getState() {
        return connection.getState();
    }

    public ManagedConnection connection() {
        return connection;
    }

    @Override
    public void close() {
        connection.close();
    }

    boolean isRoutable(String payload) {
        JsonNode node = codec.peek(payload);
        if (node == null) {
            return false;
        }
        String type = node.path("type").asText("");
        if (EnvelopeType.PING.wire().equals(type)) {
            return true;
        }
        return (type.isEmpty() || EnvelopeType.MESSAGE.wire().equals(type))
                && !node.path("provider").asText("").isBlank();
    }

    private void onFrame(String payload) {
        ServerEnvelope envelope;
        try {
            envelope = codec.decodeServer(payload);
        } catch (EnvelopeException e) {
            log.warn("Ignoring unreadable frame on {}: {}", connection.getId(), e.getMessage());
            return;
        }
        if (envelope instanceof Pong) {
            connection.recordPong();
        } else if (envelope instanceof Progress progress) {
            listener.onProgress(progress);
        } else if (envelope instanceof ChatResponse response) {
            listener.onResponse(response);
        }
    }

    private void onStateChange(ConnectionState from, ConnectionState to) {
        listener.onStateChange(from, to);
        if (to == ConnectionState.FAILED) {
            log.error("Connection {} failed permanently, a reload is required", connection.getId());
            listener.onReloadRequired();
        }
    }
}

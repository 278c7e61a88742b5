package io.github.drompincen.chatrelay.runtime.chat;

import io.github.drompincen.chatrelay.protocol.ws.ChatRequest;
import io.github.drompincen.chatrelay.protocol.ws.ChatResponse;
import io.github.drompincen.chatrelay.protocol.ws.ClientEnvelope;
import io.github.drompincen.chatrelay.protocol.ws.EnvelopeCodec;
import io.github.drompincen.chatrelay.protocol.ws.EnvelopeException;
import io.github.drompincen.chatrelay.protocol.ws.Ping;
import io.github.drompincen.chatrelay.protocol.ws.Pong;
import io.github.drompincen.chatrelay.protocol.ws.Progress;
import io.github.drompincen.chatrelay.protocol.ws.ServerEnvelope;
import io.github.drompincen.chatrelay.runtime.connection.ConnectionState;
import io.github.drompincen.chatrelay.runtime.connection.FrameHandler;
import io.github.drompincen.chatrelay.runtime.connection.ManagedConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Server-side frame handler. Malformed frames get one error response and are dropped;
 * {@code ping} is answered inline; valid {@code message} requests are processed on
 * {@code requestExecutor} so the read loop never waits on an upstream call.
 *
 * <p>Requests carry no correlation id. Two in-flight requests on one connection are answered in
 * completion order.
 */
public class MessageProtocolHandler implements FrameHandler {

    private static final Logger log = LoggerFactory.getLogger(MessageProtocolHandler.class);

    static final String PROVIDER_REQUIRED = "LLM provider not specified. Select a provider and try again.";
    static final String EMPTY_MESSAGE = "Empty message. Type something or attach files.";
    static final String TOO_MANY_FILES = "Maximum number of files exceeded. Limit: ";
    static final String SERVER_BUSY = "Server is busy, try again later.";

    private final EnvelopeCodec codec;
    private final ChatRequestProcessor processor;
    private final Executor requestExecutor;
    private final int maxFiles;

    public MessageProtocolHandler(EnvelopeCodec codec, ChatRequestProcessor processor,
                                  Executor requestExecutor, int maxFiles) {
        this.codec = codec;
        this.processor = processor;
        this.requestExecutor = requestExecutor;
        this.maxFiles = maxFiles;
    }

    @Override
    public void onFrame(ManagedConnection connection, String payload) {
        ClientEnvelope envelope;
        try {
            envelope = codec.decodeClient(payload);
        } catch (EnvelopeException e) {
            log.warn("Invalid payload on connection {}: {}", connection.getId(), e.getMessage());
            reply(connection, ChatResponse.error("Invalid payload: " + e.getMessage()));
            return;
        }

        if (envelope instanceof Ping) {
            reply(connection, Pong.OK);
            return;
        }

        ChatRequest request = (ChatRequest) envelope;
        log.debug("Payload received connection={} provider={} model={} promptLength={} history={} files={}",
                connection.getId(), request.provider(), request.model(), request.prompt().length(),
                request.history().size(), request.files().size());

        String problem = validate(request);
        if (problem != null) {
            reply(connection, ChatResponse.error(problem));
            return;
        }
        log.info("Valid message received connection={} provider={} model={}",
                connection.getId(), request.provider(), request.model());

        try {
            requestExecutor.execute(() -> process(connection, request));
        } catch (RejectedExecutionException e) {
            log.warn("Request executor saturated, rejecting request on {}", connection.getId());
            reply(connection, ChatResponse.error(SERVER_BUSY));
        }
    }

    String validate(ChatRequest request) {
        if (!request.hasProvider()) {
            return PROVIDER_REQUIRED;
        }
        if (request.prompt().isEmpty() && !request.hasFiles()) {
            return EMPTY_MESSAGE;
        }
        if (request.files().size() > maxFiles) {
            return TOO_MANY_FILES + maxFiles;
        }
        return null;
    }

    private void process(ManagedConnection connection, ChatRequest request) {
        ChatResponse response;
        try {
            response = processor.process(request, (message, current, total) ->
                    reply(connection, Progress.of(message, current, total)));
        } catch (ChatProcessingException e) {
            response = ChatResponse.error(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Request processing failed on {}", connection.getId(), e);
            response = ChatResponse.error(ChatRequestProcessor.LLM_ERROR_PREFIX + e.getMessage());
        }
        reply(connection, response);
    }

    private void reply(ManagedConnection connection, ServerEnvelope envelope) {
        if (connection.getState() == ConnectionState.CLOSED) {
            log.warn("Connection {} closed, dropping {} response", connection.getId(), envelope.type().wire());
            return;
        }
        if (envelope instanceof ChatResponse response && response.isError()) {
            log.warn("Sending error to connection {}: {}", connection.getId(), response.response());
        }
        connection.send(codec.encode(envelope));
    }
}

package io.github.drompincen.chatrelay.protocol.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.util.TokenBuffer;

import java.io.IOException;

/**
 * Maps JSON text frames to the typed envelopes and back. The {@code type} discriminator is
 * resolved here, so handlers only ever see a validated {@link ClientEnvelope} or
 * {@link ServerEnvelope}. A frame without a {@code type} is treated as a {@code message}
 * (browser clients historically omitted it).
 */
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;
    // bodiless envelopes such as ping serialize to {}
    private final ObjectWriter bodyWriter;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.bodyWriter = objectMapper.writer().without(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public ClientEnvelope decodeClient(String frame) throws EnvelopeException {
        JsonNode node = readObject(frame);
        String type = node.path("type").asText("");
        if (type.isEmpty() || EnvelopeType.MESSAGE.wire().equals(type)) {
            return convert(node, ChatRequest.class);
        }
        if (EnvelopeType.PING.wire().equals(type)) {
            return Ping.INSTANCE;
        }
        throw new EnvelopeException("unknown envelope type: " + type);
    }

    public ServerEnvelope decodeServer(String frame) throws EnvelopeException {
        JsonNode node = readObject(frame);
        String type = node.path("type").asText("");
        var known = EnvelopeType.fromWire(type);
        if (type.isEmpty() || known.filter(t -> t == EnvelopeType.MESSAGE || t == EnvelopeType.ERROR).isPresent()) {
            if (!node.hasNonNull("status")) {
                throw new EnvelopeException("response envelope without status");
            }
            return convert(node, ChatResponse.class);
        }
        if (known.filter(t -> t == EnvelopeType.PONG).isPresent()) {
            return new Pong(node.path("status").asText("ok"));
        }
        if (known.filter(t -> t == EnvelopeType.PROGRESS).isPresent()) {
            return convert(node, Progress.class);
        }
        throw new EnvelopeException("unknown envelope type: " + type);
    }

    public String encode(ClientEnvelope envelope) {
        return write(envelope.type(), envelope);
    }

    public String encode(ServerEnvelope envelope) {
        return write(envelope.type(), envelope);
    }

    /**
     * Reads only the discriminator of an already-encoded frame, or {@code null} if the
     * frame is not a JSON object.
     */
    public JsonNode peek(String frame) {
        try {
            JsonNode node = objectMapper.readTree(frame);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private String write(EnvelopeType type, Object body) {
        ObjectNode out = objectMapper.createObjectNode();
        out.put("type", type.wire());
        try (TokenBuffer buffer = new TokenBuffer(objectMapper, false)) {
            bodyWriter.writeValue(buffer, body);
            JsonNode fields = objectMapper.readTree(buffer.asParser());
            if (fields != null && fields.isObject()) {
                out.setAll((ObjectNode) fields);
            }
            return objectMapper.writeValueAsString(out);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode " + type.wire() + " envelope", e);
        }
    }

    private JsonNode readObject(String frame) throws EnvelopeException {
        if (frame == null || frame.isBlank()) {
            throw new EnvelopeException("empty frame");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new EnvelopeException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new EnvelopeException("frame is not a JSON object");
        }
        return node;
    }

    private <T> T convert(JsonNode node, Class<T> type) throws EnvelopeException {
        try {
            return objectMapper.readerFor(type)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(node);
        } catch (JsonProcessingException e) {
            throw new EnvelopeException("invalid " + type.getSimpleName() + " envelope: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new EnvelopeException("invalid " + type.getSimpleName() + " envelope", e);
        }
    }
}

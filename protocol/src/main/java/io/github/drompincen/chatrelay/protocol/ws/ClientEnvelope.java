package io.github.drompincen.chatrelay.protocol.ws;

/**
 * Frames a browser or Java client sends to the gateway.
 */
public sealed interface ClientEnvelope permits Ping, ChatRequest {

    EnvelopeType type();
}

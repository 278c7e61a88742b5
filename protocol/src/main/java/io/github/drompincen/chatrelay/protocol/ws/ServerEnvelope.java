package io.github.drompincen.chatrelay.protocol.ws;

/**
 * Frames the gateway sends back to a client.
 */
public sealed interface ServerEnvelope permits Pong, ChatResponse, Progress {

    EnvelopeType type();
}

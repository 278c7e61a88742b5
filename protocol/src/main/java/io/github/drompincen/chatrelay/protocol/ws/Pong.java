package io.github.drompincen.chatrelay.protocol.ws;

public record Pong(String status) implements ServerEnvelope {

    public static final Pong OK = new Pong("ok");

    @Override
    public EnvelopeType type() {
        return EnvelopeType.PONG;
    }
}

package io.github.drompincen.chatrelay.protocol.ws;

public record Ping() implements ClientEnvelope {

    public static final Ping INSTANCE = new Ping();

    @Override
    public EnvelopeType type() {
        return EnvelopeType.PING;
    }
}

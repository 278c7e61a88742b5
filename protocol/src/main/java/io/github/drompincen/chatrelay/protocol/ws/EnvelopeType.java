package io.github.drompincen.chatrelay.protocol.ws;

import java.util.Optional;

public enum EnvelopeType {
    // Client -> Server
    PING("ping"),
    MESSAGE("message"),

    // Server -> Client
    PONG("pong"),
    PROGRESS("progress"),
    ERROR("error");

    private final String wire;

    EnvelopeType(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static Optional<EnvelopeType> fromWire(String value) {
        for (EnvelopeType type : values()) {
            if (type.wire.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

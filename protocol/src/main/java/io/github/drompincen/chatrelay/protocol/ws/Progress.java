package io.github.drompincen.chatrelay.protocol.ws;

public record Progress(
        String status,
        String message,
        int current,
        int total,
        int percentage
) implements ServerEnvelope {

    public static final String PROCESSING = "processing";

    public static Progress of(String message, int current, int total) {
        int percentage = total <= 0 ? 0 : (current * 100) / total;
        return new Progress(PROCESSING, message, current, total, percentage);
    }

    @Override
    public EnvelopeType type() {
        return EnvelopeType.PROGRESS;
    }
}

package io.github.drompincen.chatrelay.protocol.ws;

/**
 * Raised when a frame is not valid JSON or carries an unknown {@code type}.
 */
public class EnvelopeException extends Exception {

    public EnvelopeException(String message) {
        super(message);
    }

    public EnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}

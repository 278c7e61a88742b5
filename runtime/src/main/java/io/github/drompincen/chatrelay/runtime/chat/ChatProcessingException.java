package io.github.drompincen.chatrelay.runtime.chat;

/**
 * Request-level failure whose message is shown to the user as-is.
 */
public class ChatProcessingException extends RuntimeException {

    public ChatProcessingException(String message) {
        super(message);
    }

    public ChatProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}

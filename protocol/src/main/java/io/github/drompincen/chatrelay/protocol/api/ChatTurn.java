package io.github.drompincen.chatrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One prior exchange in the conversation, sent back by the client with every request.
 */
public record ChatTurn(String role, String content) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public ChatTurn {
        role = role == null || role.isBlank() ? USER : role;
        content = content == null ? "" : content;
    }

    @JsonIgnore
    public boolean isAssistant() {
        return ASSISTANT.equals(role);
    }
}

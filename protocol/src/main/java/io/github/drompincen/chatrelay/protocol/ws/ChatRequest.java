package io.github.drompincen.chatrelay.protocol.ws;

import io.github.drompincen.chatrelay.protocol.api.ChatTurn;
import io.github.drompincen.chatrelay.protocol.api.FileAttachment;

import java.util.List;

public record ChatRequest(
        String provider,
        String model,
        String prompt,
        List<ChatTurn> history,
        List<FileAttachment> files
) implements ClientEnvelope {

    public ChatRequest {
        provider = provider == null ? "" : provider;
        model = model == null ? "" : model;
        prompt = prompt == null ? "" : prompt;
        history = history == null ? List.of() : List.copyOf(history);
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static ChatRequest of(String provider, String model, String prompt) {
        return new ChatRequest(provider, model, prompt, List.of(), List.of());
    }

    @Override
    public EnvelopeType type() {
        return EnvelopeType.MESSAGE;
    }

    public boolean hasProvider() {
        return !provider.isBlank();
    }

    public boolean hasFiles() {
        return !files.isEmpty();
    }
}

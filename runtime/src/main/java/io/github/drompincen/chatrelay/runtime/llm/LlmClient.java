package io.github.drompincen.chatrelay.runtime.llm;

import io.github.drompincen.chatrelay.protocol.api.ChatTurn;

import java.util.List;

public interface LlmClient {

    /**
     * Sends {@code prompt} after {@code history} and returns the completion text.
     *
     * @param maxTokens completion budget; {@code <= 0} uses the {@link ModelCatalog} value
     */
    String sendPrompt(String prompt, List<ChatTurn> history, int maxTokens);

    String modelName();
}

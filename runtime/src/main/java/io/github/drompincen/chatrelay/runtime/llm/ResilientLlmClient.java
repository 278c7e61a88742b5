package io.github.drompincen.chatrelay.runtime.llm;

import io.github.drompincen.chatrelay.protocol.api.ChatTurn;
import io.github.drompincen.chatrelay.runtime.resilience.CircuitBreaker;
import io.github.drompincen.chatrelay.runtime.resilience.UpstreamApiException;

import java.util.List;

/**
 * Puts a provider's {@link CircuitBreaker} in front of its client. One breaker is shared by all
 * clients of a provider, so a failing upstream fails fast for every connection. Rejections of the
 * request itself (4xx other than 429) do not count against the provider.
 */
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;
    private final CircuitBreaker circuitBreaker;

    public ResilientLlmClient(LlmClient delegate, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public String sendPrompt(String prompt, List<ChatTurn> history, int maxTokens) {
        return circuitBreaker.call(() -> delegate.sendPrompt(prompt, history, maxTokens),
                ResilientLlmClient::countsAgainstProvider);
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }

    static boolean countsAgainstProvider(RuntimeException error) {
        if (error instanceof UpstreamApiException api) {
            int status = api.getStatusCode();
            return api.isRetryableStatus() || status < 400 || status >= 500;
        }
        return true;
    }
}

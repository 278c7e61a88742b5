package io.github.drompincen.chatrelay.runtime.llm;

import io.github.drompincen.chatrelay.protocol.api.ChatTurn;
import io.github.drompincen.chatrelay.runtime.chat.ChatProcessingException;
import io.github.drompincen.chatrelay.runtime.resilience.CircuitBreaker;
import io.github.drompincen.chatrelay.runtime.resilience.CircuitOpenException;
import io.github.drompincen.chatrelay.runtime.resilience.CircuitState;
import io.github.drompincen.chatrelay.runtime.resilience.UpstreamApiException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LlmClientRegistryTest {

    @Mock
    private LlmClient openAi;

    @Test
    void providerLookupIsCaseInsensitive() {
        LlmClientRegistry registry = new LlmClientRegistry();
        registry.register("OPENAI", model -> openAi);

        assertThat(registry.clientFor("openai", "gpt-4o")).isSameAs(openAi);
        assertThat(registry.providers()).containsExactly("OPENAI");
    }

    @Test
    void unknownProviderListsAvailableOnes() {
        LlmClientRegistry registry = new LlmClientRegistry();
        registry.register("CLAUDE", model -> openAi);
        registry.register("OPENAI", model -> openAi);

        assertThatThrownBy(() -> registry.clientFor("GPT-5", ""))
                .isInstanceOf(ChatProcessingException.class)
                .hasMessageContaining("'GPT-5' is not supported")
                .hasMessageContaining("[CLAUDE, OPENAI]");
    }

    @Test
    void catalogKnowsBudgetsAndFallsBack() {
        assertThat(ModelCatalog.maxTokens("claude", ModelCatalog.CLAUDE_SONNET_4)).isEqualTo(4096);
        assertThat(ModelCatalog.maxTokens("OTHER", "x")).isEqualTo(ModelCatalog.DEFAULT_MAX_TOKENS);
        assertThat(ModelCatalog.isSupported("CLAUDE", "claude-2")).isFalse();
        assertThat(ModelCatalog.isSupported("OPENAI", "gpt-4o")).isTrue();
    }

    @Test
    void resilientClientFailsFastOnceCircuitOpens() {
        when(openAi.sendPrompt(anyString(), anyList(), anyInt())).thenThrow(new IllegalStateException("down"));
        CircuitBreaker breaker = new CircuitBreaker("OPENAI", 2, Duration.ofMinutes(1));
        ResilientLlmClient client = new ResilientLlmClient(openAi, breaker);

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> client.sendPrompt("hi", List.<ChatTurn>of(), 0))
                    .isInstanceOf(IllegalStateException.class);
        }

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThatThrownBy(() -> client.sendPrompt("hi", List.of(), 0))
                .isInstanceOf(CircuitOpenException.class);
        verify(openAi, times(2)).sendPrompt(anyString(), anyList(), anyInt());
    }

    @Test
    void rejectedRequestsDoNotOpenTheSharedCircuit() {
        when(openAi.sendPrompt(anyString(), anyList(), anyInt()))
                .thenThrow(new UpstreamApiException(400, "{\"error\":\"model not found\"}"));
        CircuitBreaker breaker = new CircuitBreaker("OPENAI", 2, Duration.ofMinutes(1));
        ResilientLlmClient client = new ResilientLlmClient(openAi, breaker);

        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> client.sendPrompt("hi", List.<ChatTurn>of(), 0))
                    .isInstanceOf(UpstreamApiException.class);
        }

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        verify(openAi, times(5)).sendPrompt(anyString(), anyList(), anyInt());
    }

    @Test
    void throttlingAndServerErrorsCountAgainstProvider() {
        assertThat(ResilientLlmClient.countsAgainstProvider(new UpstreamApiException(429, "slow down"))).isTrue();
        assertThat(ResilientLlmClient.countsAgainstProvider(new UpstreamApiException(503, "unavailable"))).isTrue();
        assertThat(ResilientLlmClient.countsAgainstProvider(new IllegalStateException("empty response"))).isTrue();
        assertThat(ResilientLlmClient.countsAgainstProvider(new UpstreamApiException(401, "bad key"))).isFalse();
    }
}

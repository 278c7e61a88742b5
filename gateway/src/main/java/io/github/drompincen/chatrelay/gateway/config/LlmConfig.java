package io.github.drompincen.chatrelay.gateway.config;

import io.github.drompincen.chatrelay.protocol.ws.EnvelopeCodec;
import io.github.drompincen.chatrelay.runtime.chat.ChatRequestProcessor;
import io.github.drompincen.chatrelay.runtime.chat.MessageProtocolHandler;
import io.github.drompincen.chatrelay.runtime.file.DefaultFileProcessor;
import io.github.drompincen.chatrelay.runtime.file.FileContextBuilder;
import io.github.drompincen.chatrelay.runtime.file.FileLimits;
import io.github.drompincen.chatrelay.runtime.llm.ClaudeLlmClient;
import io.github.drompincen.chatrelay.runtime.llm.LlmClientRegistry;
import io.github.drompincen.chatrelay.runtime.llm.ModelCatalog;
import io.github.drompincen.chatrelay.runtime.llm.OpenAiLlmClient;
import io.github.drompincen.chatrelay.runtime.llm.ResilientLlmClient;
import io.github.drompincen.chatrelay.runtime.resilience.CircuitBreaker;
import io.github.drompincen.chatrelay.runtime.resilience.RetryExecutor;
import io.github.drompincen.chatrelay.runtime.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Wires the provider clients and the request pipeline. A provider is registered only when its
 * API key is set; each gets one circuit breaker shared by all of its models.
 */
@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Value("${chatrelay.llm.openai.api-key:}")
    private String openAiKey;

    @Value("${chatrelay.llm.openai.url:" + OpenAiLlmClient.API_URL + "}")
    private String openAiUrl;

    @Value("${chatrelay.llm.claude.api-key:}")
    private String claudeKey;

    @Value("${chatrelay.llm.claude.url:" + ClaudeLlmClient.API_URL + "}")
    private String claudeUrl;

    @Value("${chatrelay.circuit.threshold:5}")
    private int circuitThreshold;

    @Value("${chatrelay.circuit.timeout:1m}")
    private Duration circuitTimeout;

    @Value("${chatrelay.llm.request-timeout:5m}")
    private Duration requestTimeout;

    @Bean
    RestClient llmRestClient(RestClient.Builder builder,
                             @Value("${chatrelay.llm.connect-timeout:30s}") Duration connectTimeout) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) requestTimeout.toMillis());
        return builder.requestFactory(factory).build();
    }

    @Bean
    RetryExecutor retryExecutor() {
        return new RetryExecutor();
    }

    @Bean
    LlmClientRegistry llmClientRegistry(RestClient llmRestClient, RetryExecutor retryExecutor,
                                        RetryPolicy retryPolicy) {
        LlmClientRegistry registry = new LlmClientRegistry();
        if (hasKey(openAiKey)) {
            CircuitBreaker breaker = new CircuitBreaker(ModelCatalog.OPENAI, circuitThreshold, circuitTimeout);
            registry.register(ModelCatalog.OPENAI, model -> new ResilientLlmClient(
                    new OpenAiLlmClient(llmRestClient, openAiUrl, openAiKey, openAiModel(model),
                            retryExecutor, retryPolicy),
                    breaker));
        }
        if (hasKey(claudeKey)) {
            CircuitBreaker breaker = new CircuitBreaker(ModelCatalog.CLAUDE, circuitThreshold, circuitTimeout);
            registry.register(ModelCatalog.CLAUDE, model -> new ResilientLlmClient(
                    new ClaudeLlmClient(llmRestClient, claudeUrl, claudeKey, claudeModel(model),
                            retryExecutor, retryPolicy),
                    breaker));
        }
        if (registry.isEmpty()) {
            log.warn("No LLM provider configured. Set OPENAI_API_KEY or CLAUDEAI_API_KEY");
        } else {
            log.info("LLM providers configured: {}", registry.providers());
        }
        return registry;
    }

    @Bean
    FileContextBuilder fileContextBuilder(FileLimits fileLimits) {
        return new FileContextBuilder(new DefaultFileProcessor(), fileLimits);
    }

    @Bean
    ChatRequestProcessor chatRequestProcessor(LlmClientRegistry registry, FileContextBuilder fileContextBuilder,
                                              @Qualifier("llmExecutor") ExecutorService llmExecutor) {
        return new ChatRequestProcessor(registry, fileContextBuilder, llmExecutor, requestTimeout);
    }

    @Bean
    MessageProtocolHandler messageProtocolHandler(EnvelopeCodec envelopeCodec, ChatRequestProcessor processor,
                                                  ThreadPoolTaskExecutor chatWorkerExecutor,
                                                  FileLimits fileLimits) {
        return new MessageProtocolHandler(envelopeCodec, processor, chatWorkerExecutor, fileLimits.maxFiles());
    }

    static String openAiModel(String requested) {
        return requested == null || requested.isBlank() ? ModelCatalog.GPT_4O : requested;
    }

    static String claudeModel(String requested) {
        if (ModelCatalog.isSupported(ModelCatalog.CLAUDE, requested)) {
            return requested;
        }
        log.warn("Unsupported Claude model '{}', falling back to {}", requested, ModelCatalog.CLAUDE_SONNET_45);
        return ModelCatalog.CLAUDE_SONNET_45;
    }

    private static boolean hasKey(String key) {
        return key != null && !key.isBlank();
    }
}

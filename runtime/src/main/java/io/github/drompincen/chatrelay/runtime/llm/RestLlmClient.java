package io.github.drompincen.chatrelay.runtime.llm;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.chatrelay.protocol.api.ChatTurn;
import io.github.drompincen.chatrelay.runtime.resilience.RetryExecutor;
import io.github.drompincen.chatrelay.runtime.resilience.RetryPolicy;
import io.github.drompincen.chatrelay.runtime.resilience.UpstreamApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for JSON-over-HTTP chat completion APIs. Each HTTP round trip runs inside
 * {@link RetryExecutor}; non-2xx answers surface as {@link UpstreamApiException} so 429 and 5xx
 * are retried and other statuses are not.
 */
public abstract class RestLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(RestLlmClient.class);

    protected final RestClient restClient;
    protected final String apiKey;
    protected final String model;
    private final String endpoint;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    protected RestLlmClient(RestClient restClient, String endpoint, String apiKey, String model,
                            RetryExecutor retryExecutor, RetryPolicy retryPolicy) {
        this.restClient = restClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
    }

    protected abstract String provider();

    protected abstract void applyHeaders(HttpHeaders headers);

    protected abstract Map<String, Object> requestBody(List<Map<String, String>> messages, int maxTokens);

    /** Completion text of a successful response; throws when there is none. */
    protected abstract String extractText(JsonNode response);

    @Override
    public String sendPrompt(String prompt, List<ChatTurn> history, int maxTokens) {
        int budget = maxTokens > 0 ? maxTokens : ModelCatalog.maxTokens(provider(), model);
        Map<String, Object> body = requestBody(messages(prompt, history), budget);
        long start = System.currentTimeMillis();
        String text = retryExecutor.retry(retryPolicy, () -> extractText(post(body)));
        log.info("{} completion model={} length={} took={}ms",
                provider(), model, text.length(), System.currentTimeMillis() - start);
        return text;
    }

    @Override
    public String modelName() {
        return model;
    }

    private JsonNode post(Map<String, Object> body) {
        JsonNode response = restClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .headers(this::applyHeaders)
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, res) -> {
                    String text = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    throw new UpstreamApiException(res.getStatusCode().value(), text);
                })
                .body(JsonNode.class);
        if (response == null) {
            throw new IllegalStateException("empty response body from " + provider());
        }
        return response;
    }

    /** History followed by the prompt; roles other than assistant are sent as user. */
    static List<Map<String, String>> messages(String prompt, List<ChatTurn> history) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (history != null) {
            for (ChatTurn turn : history) {
                messages.add(message(turn.isAssistant() ? ChatTurn.ASSISTANT : ChatTurn.USER, turn.content()));
            }
        }
        messages.add(message(ChatTurn.USER, prompt));
        return messages;
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("role", role);
        m.put("content", content);
        return m;
    }
}

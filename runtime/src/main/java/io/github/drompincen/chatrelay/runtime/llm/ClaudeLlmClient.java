package io.github.drompincen.chatrelay.runtime.llm;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.chatrelay.runtime.resilience.RetryExecutor;
import io.github.drompincen.chatrelay.runtime.resilience.RetryPolicy;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ClaudeLlmClient extends RestLlmClient {

    public static final String API_URL = "https://api.anthropic.com/v1/messages";
    public static final String API_VERSION = "2023-06-01";

    public ClaudeLlmClient(RestClient restClient, String endpoint, String apiKey, String model,
                           RetryExecutor retryExecutor, RetryPolicy retryPolicy) {
        super(restClient, endpoint, apiKey, model, retryExecutor, retryPolicy);
    }

    @Override
    protected String provider() {
        return ModelCatalog.CLAUDE;
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        headers.set("x-api-key", apiKey);
        headers.set("anthropic-version", API_VERSION);
    }

    @Override
    protected Map<String, Object> requestBody(List<Map<String, String>> messages, int maxTokens) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("max_tokens", maxTokens);
        return body;
    }

    /** Concatenates the text blocks; a response without text is an error. */
    @Override
    protected String extractText(JsonNode response) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        if (text.isEmpty()) {
            throw new IllegalStateException("empty response from Claude API");
        }
        return text.toString();
    }
}

package io.github.drompincen.chatrelay.runtime.llm;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.chatrelay.runtime.resilience.RetryExecutor;
import io.github.drompincen.chatrelay.runtime.resilience.RetryPolicy;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class OpenAiLlmClient extends RestLlmClient {

    public static final String API_URL = "https://api.openai.com/v1/chat/completions";

    public OpenAiLlmClient(RestClient restClient, String endpoint, String apiKey, String model,
                           RetryExecutor retryExecutor, RetryPolicy retryPolicy) {
        super(restClient, endpoint, apiKey, model, retryExecutor, retryPolicy);
    }

    @Override
    protected String provider() {
        return ModelCatalog.OPENAI;
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        headers.setBearerAuth(apiKey);
    }

    @Override
    protected Map<String, Object> requestBody(List<Map<String, String>> messages, int maxTokens) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("max_tokens", maxTokens);
        return body;
    }

    @Override
    protected String extractText(JsonNode response) {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new IllegalStateException("no response received from OpenAI");
        }
        return choices.get(0).path("message").path("content").asText("");
    }
}

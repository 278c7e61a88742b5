package io.github.drompincen.chatrelay.runtime.llm;

import io.github.drompincen.chatrelay.protocol.api.ChatTurn;
import io.github.drompincen.chatrelay.runtime.resilience.RetryExecutor;
import io.github.drompincen.chatrelay.runtime.resilience.RetryListener;
import io.github.drompincen.chatrelay.runtime.resilience.RetryPolicy;
import io.github.drompincen.chatrelay.runtime.resilience.UpstreamApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiLlmClientTest {

    private static final String URL = OpenAiLlmClient.API_URL;

    private final List<Duration> sleeps = new ArrayList<>();
    private MockRestServiceServer server;
    private OpenAiLlmClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        RetryExecutor retry = new RetryExecutor(sleeps::add, RetryListener.NONE);
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(30));
        client = new OpenAiLlmClient(builder.build(), URL, "sk-test", ModelCatalog.GPT_4O, retry, policy);
    }

    @Test
    void returnsFirstChoiceContent() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-4o"))
                .andExpect(jsonPath("$.max_tokens").value(4096))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[1].role").value("assistant"))
                .andExpect(jsonPath("$.messages[2].content").value("hi"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"hello\"}}]}",
                        MediaType.APPLICATION_JSON));

        String answer = client.sendPrompt("hi",
                List.of(new ChatTurn("system", "earlier"), new ChatTurn("assistant", "sure")), 0);

        assertThat(answer).isEqualTo("hello");
        server.verify();
    }

    @Test
    void retriesServiceUnavailableUntilAttemptsRunOut() {
        server.expect(ExpectedCount.times(3), requestTo(URL))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("overloaded"));

        assertThatThrownBy(() -> client.sendPrompt("hi", List.of(), 0))
                .isInstanceOf(UpstreamApiException.class)
                .hasMessageContaining("status 503")
                .hasMessageContaining("overloaded");

        server.verify();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void clientErrorIsNotRetried() {
        server.expect(ExpectedCount.once(), requestTo(URL))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("bad key"));

        assertThatThrownBy(() -> client.sendPrompt("hi", List.of(), 0))
                .isInstanceOf(UpstreamApiException.class)
                .satisfies(e -> assertThat(((UpstreamApiException) e).getStatusCode()).isEqualTo(401));

        server.verify();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void responseWithoutChoicesIsAnError() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.sendPrompt("hi", List.of(), 0))
                .hasMessageContaining("no response received from OpenAI");
    }
}

package io.github.drompincen.chatrelay.protocol.ws;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final answer to a {@code message} envelope. Exactly one is sent per accepted request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatResponse(
        String status,
        String response,
        @JsonProperty("isMarkdown") Boolean markdown,
        String provider
) implements ServerEnvelope {

    public static final String COMPLETED = "completed";
    public static final String ERROR = "error";

    public static ChatResponse completed(String response, boolean markdown, String provider) {
        return new ChatResponse(COMPLETED, response, markdown, provider);
    }

    public static ChatResponse error(String reason) {
        return new ChatResponse(ERROR, reason, null, null);
    }

    @JsonIgnore
    public boolean isError() {
        return ERROR.equals(status);
    }

    @Override
    public EnvelopeType type() {
        return isError() ? EnvelopeType.ERROR : EnvelopeType.MESSAGE;
    }
}

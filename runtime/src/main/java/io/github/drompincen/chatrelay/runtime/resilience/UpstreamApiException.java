package io.github.drompincen.chatrelay.runtime.resilience;

/**
 * Non-2xx answer from an upstream HTTP API.
 */
public class UpstreamApiException extends RuntimeException {

    private final int statusCode;
    private final String body;

    public UpstreamApiException(int statusCode, String body) {
        super("API error: status " + statusCode + " - " + body);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public boolean isRetryableStatus() {
        return statusCode == 429 || (statusCode >= 500 && statusCode < 600);
    }
}

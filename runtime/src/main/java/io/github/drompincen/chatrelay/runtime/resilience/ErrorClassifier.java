package io.github.drompincen.chatrelay.runtime.resilience;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

public final class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private ErrorClassifier() {
    }

    public static ErrorCategory classify(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof CircuitOpenException) {
                return ErrorCategory.PERMANENT;
            }
            if (current instanceof UpstreamApiException api) {
                return api.isRetryableStatus() ? ErrorCategory.TEMPORARY : ErrorCategory.PERMANENT;
            }
            if (current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof TimeoutException) {
                return ErrorCategory.TEMPORARY;
            }
            current = current.getCause();
        }
        return ErrorCategory.PERMANENT;
    }

    public static boolean isTemporary(Throwable error) {
        return classify(error).isRetryable();
    }
}

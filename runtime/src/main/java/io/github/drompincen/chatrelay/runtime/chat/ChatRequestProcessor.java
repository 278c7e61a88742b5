package io.github.drompincen.chatrelay.runtime.chat;

import io.github.drompincen.chatrelay.protocol.ws.ChatRequest;
import io.github.drompincen.chatrelay.protocol.ws.ChatResponse;
import io.github.drompincen.chatrelay.runtime.file.FileContextBuilder;
import io.github.drompincen.chatrelay.runtime.file.FileProcessingException;
import io.github.drompincen.chatrelay.runtime.file.ProgressSink;
import io.github.drompincen.chatrelay.runtime.llm.LlmClient;
import io.github.drompincen.chatrelay.runtime.llm.LlmClientRegistry;
import io.github.drompincen.chatrelay.runtime.resilience.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns a validated {@link ChatRequest} into a {@link ChatResponse}: builds the file context,
 * composes the prompt, resolves the provider client and calls it under a deadline.
 */
public class ChatRequestProcessor {

    private static final Logger log = LoggerFactory.getLogger(ChatRequestProcessor.class);

    static final String QUESTION_SEPARATOR = "\n\n---\n\n**User question:**\n";
    static final String LLM_ERROR_PREFIX = "Error processing LLM response: ";

    private final LlmClientRegistry registry;
    private final FileContextBuilder fileContextBuilder;
    private final ExecutorService llmExecutor;
    private final Duration requestTimeout;

    public ChatRequestProcessor(LlmClientRegistry registry, FileContextBuilder fileContextBuilder,
                                ExecutorService llmExecutor, Duration requestTimeout) {
        this.registry = registry;
        this.fileContextBuilder = fileContextBuilder;
        this.llmExecutor = llmExecutor;
        this.requestTimeout = requestTimeout;
    }

    public ChatResponse process(ChatRequest request, ProgressSink progress) {
        String context = "";
        if (request.hasFiles()) {
            try {
                context = fileContextBuilder.build(request.files(), progress);
            } catch (FileProcessingException e) {
                throw new ChatProcessingException(e.getMessage(), e);
            }
        }
        String prompt = context.isEmpty() ? request.prompt() : context + QUESTION_SEPARATOR + request.prompt();

        LlmClient client = registry.clientFor(request.provider(), request.model());
        String answer = callWithDeadline(request.provider(), client, prompt, request);
        boolean markdown = MarkdownDetector.isMarkdown(answer);

        log.info("LLM response processed provider={} model={} markdown={} length={} files={}",
                request.provider(), client.modelName(), markdown, answer.length(), request.files().size());
        return ChatResponse.completed(answer, markdown, request.provider());
    }

    public FileContextBuilder fileContextBuilder() {
        return fileContextBuilder;
    }

    private String callWithDeadline(String provider, LlmClient client, String prompt, ChatRequest request) {
        Future<String> call = llmExecutor.submit(() -> client.sendPrompt(prompt, request.history(), 0));
        try {
            return call.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ChatProcessingException(LLM_ERROR_PREFIX + "request timed out after "
                    + requestTimeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ChatProcessingException(LLM_ERROR_PREFIX + "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CircuitOpenException) {
                throw new ChatProcessingException("Provider " + provider
                        + " is temporarily unavailable (circuit open); try again later", cause);
            }
            throw new ChatProcessingException(LLM_ERROR_PREFIX + cause.getMessage(), cause);
        }
    }
}

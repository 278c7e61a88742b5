package io.github.drompincen.chatrelay.runtime.llm;

import io.github.drompincen.chatrelay.runtime.chat.ChatProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Provider name to client factory. Names are matched case-insensitively; each call to
 * {@link #clientFor} builds a client for the requested model.
 */
public class LlmClientRegistry {

    private static final Logger log = LoggerFactory.getLogger(LlmClientRegistry.class);

    private final Map<String, Function<String, LlmClient>> factories = new ConcurrentHashMap<>();

    public void register(String provider, Function<String, LlmClient> factory) {
        String key = ModelCatalog.normalize(provider);
        factories.put(key, factory);
        log.info("LLM provider {} configured", key);
    }

    public LlmClient clientFor(String provider, String model) {
        String key = ModelCatalog.normalize(provider);
        Function<String, LlmClient> factory = factories.get(key);
        if (factory == null) {
            Set<String> available = providers();
            log.error("Provider not found requested={} normalized={} available={}", provider, key, available);
            throw new ChatProcessingException("LLM provider '" + provider
                    + "' is not supported or not configured. Available providers: " + available);
        }
        log.debug("Resolving client provider={} model={}", key, model);
        return factory.apply(model);
    }

    public Set<String> providers() {
        return new TreeSet<>(factories.keySet());
    }

    public boolean isEmpty() {
        return factories.isEmpty();
    }
}

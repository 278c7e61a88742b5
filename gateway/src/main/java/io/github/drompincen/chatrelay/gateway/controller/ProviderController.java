package io.github.drompincen.chatrelay.gateway.controller;

import io.github.drompincen.chatrelay.runtime.llm.LlmClientRegistry;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/providers")
public class ProviderController {

    private final LlmClientRegistry registry;

    public ProviderController(LlmClientRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public Map<String, List<String>> list() {
        return Map.of("providers", List.copyOf(registry.providers()));
    }
}

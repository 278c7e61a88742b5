package io.github.drompincen.chatrelay.runtime.llm;

import java.util.Locale;
import java.util.Map;

/**
 * Known provider/model pairs and their completion budgets.
 */
public final class ModelCatalog {

    public static final String OPENAI = "OPENAI";
    public static final String CLAUDE = "CLAUDE";

    public static final String GPT_4O = "gpt-4o";
    public static final String CLAUDE_SONNET_4 = "claude-sonnet-4-20250514";
    public static final String CLAUDE_SONNET_45 = "claude-sonnet-4-5-20250929";

    public static final int DEFAULT_MAX_TOKENS = 4096;

    private static final Map<String, Map<String, Integer>> MAX_TOKENS = Map.of(
            OPENAI, Map.of(GPT_4O, 4096),
            CLAUDE, Map.of(CLAUDE_SONNET_4, 4096, CLAUDE_SONNET_45, 4096));

    private ModelCatalog() {
    }

    public static int maxTokens(String provider, String model) {
        Map<String, Integer> models = MAX_TOKENS.get(normalize(provider));
        if (models == null || model == null) {
            return DEFAULT_MAX_TOKENS;
        }
        return models.getOrDefault(model, DEFAULT_MAX_TOKENS);
    }

    public static boolean isSupported(String provider, String model) {
        Map<String, Integer> models = MAX_TOKENS.get(normalize(provider));
        return models != null && model != null && models.containsKey(model);
    }

    public static String normalize(String provider) {
        return provider == null ? "" : provider.trim().toUpperCase(Locale.ROOT);
    }
}

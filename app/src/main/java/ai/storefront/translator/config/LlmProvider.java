package ai.storefront.translator.config;

import java.util.Locale;

/**
 * Supported translation backends.
 */
public enum LlmProvider {
    OPENAI("gpt-4o", true),
    ANTHROPIC("claude-sonnet-4-20250514", true),
    GEMINI("gemini-1.5-pro", true),
    OLLAMA("llama3.1", false),
    MOCK("mock", false);

    private final String defaultModel;
    private final boolean requiresApiKey;

    LlmProvider(String defaultModel, boolean requiresApiKey) {
        this.defaultModel = defaultModel;
        this.requiresApiKey = requiresApiKey;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String defaultModel() {
        return defaultModel;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }

    /**
     * Prefix of the per-provider environment variables, e.g. {@code OPENAI} in {@code OPENAI_MODEL}.
     */
    public String envPrefix() {
        return name();
    }

    public static LlmProvider from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("LLM provider must be provided");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "openai" -> OPENAI;
            case "anthropic", "claude" -> ANTHROPIC;
            case "gemini", "google" -> GEMINI;
            case "ollama" -> OLLAMA;
            case "mock" -> MOCK;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}

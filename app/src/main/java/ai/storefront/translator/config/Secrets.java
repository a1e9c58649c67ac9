package ai.storefront.translator.config;

import java.util.Optional;

/**
 * Provider API keys. Never logged.
 */
public record Secrets(Optional<String> openAiApiKey, Optional<String> anthropicApiKey, Optional<String> geminiApiKey) {

    public Secrets {
        openAiApiKey = normalize(openAiApiKey);
        anthropicApiKey = normalize(anthropicApiKey);
        geminiApiKey = normalize(geminiApiKey);
    }

    public static Secrets none() {
        return new Secrets(Optional.empty(), Optional.empty(), Optional.empty());
    }

    public Optional<String> apiKeyFor(LlmProvider provider) {
        return switch (provider) {
            case OPENAI -> openAiApiKey;
            case ANTHROPIC -> anthropicApiKey;
            case GEMINI -> geminiApiKey;
            case OLLAMA, MOCK -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return "Secrets[openAiApiKey=%s, anthropicApiKey=%s, geminiApiKey=%s]".formatted(
                mask(openAiApiKey), mask(anthropicApiKey), mask(geminiApiKey));
    }

    private static Optional<String> normalize(Optional<String> value) {
        return value == null ? Optional.empty() : value.filter(s -> !s.isBlank());
    }

    private static String mask(Optional<String> value) {
        return value.isPresent() ? "***" : "<unset>";
    }
}

package ai.storefront.translator.translate;

import java.util.Objects;

/**
 * Outcome of a successful provider call, including usage and cost accounting.
 */
public record TranslationResult(String originalText,
                                String translatedText,
                                String sourceLocale,
                                String targetLocale,
                                String provider,
                                String model,
                                TokenUsage tokensUsed,
                                double cost) {

    public TranslationResult {
        Objects.requireNonNull(originalText, "originalText");
        Objects.requireNonNull(translatedText, "translatedText");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(model, "model");
        tokensUsed = tokensUsed == null ? TokenUsage.ZERO : tokensUsed;
    }
}

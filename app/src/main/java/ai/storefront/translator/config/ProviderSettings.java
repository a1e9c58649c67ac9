package ai.storefront.translator.config;

import ai.storefront.translator.ratelimit.RateLimitConfig;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime settings for one translation provider.
 */
public record ProviderSettings(LlmProvider provider, String modelName, Optional<String> baseUrl, RateLimitConfig rateLimit) {

    public ProviderSettings {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        rateLimit = Objects.requireNonNull(rateLimit, "rateLimit");
    }

    public static ProviderSettings defaults(LlmProvider provider, RateLimitConfig rateLimit) {
        return new ProviderSettings(provider, provider.defaultModel(), Optional.empty(), rateLimit);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}

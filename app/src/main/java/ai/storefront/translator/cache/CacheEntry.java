package ai.storefront.translator.cache;

import java.time.Instant;
import java.util.Objects;

public record CacheEntry(CacheKey key,
                         String translatedText,
                         String provider,
                         String model,
                         String resourceId,
                         String sourceLocale,
                         Instant createdAt) {

    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(translatedText, "translatedText");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}

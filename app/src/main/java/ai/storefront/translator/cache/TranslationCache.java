package ai.storefront.translator.cache;

import java.util.Optional;

/**
 * Translations keyed by (source hash, target locale). Concurrent stores for the same key are allowed;
 * the last write wins.
 */
public interface TranslationCache {

    Optional<CacheEntry> lookup(CacheKey key);

    void store(CacheEntry entry);

    default boolean contains(CacheKey key) {
        return lookup(key).isPresent();
    }
}

package ai.storefront.translator.cache;

/**
 * Identity of a cached translation: the hash of the source text and the target locale.
 */
public record CacheKey(String sourceHash, String targetLocale) {

    public CacheKey {
        if (sourceHash == null || sourceHash.isBlank()) {
            throw new IllegalArgumentException("sourceHash must not be blank");
        }
        if (targetLocale == null || targetLocale.isBlank()) {
            throw new IllegalArgumentException("targetLocale must not be blank");
        }
    }
}

package ai.storefront.translator.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryTranslationCacheTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final InMemoryTranslationCache cache = new InMemoryTranslationCache();

    @Test
    void lookupIsScopedToLocale() {
        CacheKey french = new CacheKey("abc123", "fr");
        cache.store(new CacheEntry(french, "Chemise bleue", "openai", "gpt-4o", "prod_1", "en", NOW));

        assertThat(cache.lookup(french)).map(CacheEntry::translatedText).contains("Chemise bleue");
        assertThat(cache.contains(new CacheKey("abc123", "de"))).isFalse();
    }

    @Test
    void lastWriteWins() {
        CacheKey key = new CacheKey("abc123", "fr");
        cache.store(new CacheEntry(key, "first", "openai", "gpt-4o", "prod_1", "en", NOW));
        cache.store(new CacheEntry(key, "second", "anthropic", "claude", "prod_1", "en", NOW.plusSeconds(1)));

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.lookup(key)).map(CacheEntry::provider).contains("anthropic");
    }

    @Test
    void keyRequiresHashAndLocale() {
        assertThatThrownBy(() -> new CacheKey(" ", "fr")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CacheKey("abc", null)).isInstanceOf(IllegalArgumentException.class);
    }
}

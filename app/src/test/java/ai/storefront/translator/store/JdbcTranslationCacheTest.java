package ai.storefront.translator.store;

import static org.assertj.core.api.Assertions.assertThat;

import ai.storefront.translator.cache.CacheEntry;
import ai.storefront.translator.cache.CacheKey;
import ai.storefront.translator.content.Resource;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JdbcTranslationCacheTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteDatabase database;
    private JdbcTranslationCache cache;

    @BeforeEach
    void setUp() {
        database = SqliteDatabase.open(tempDir.resolve("nested/dir/cache.db"));
        cache = new JdbcTranslationCache(database);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void storesAndLooksUpByHashAndLocale() {
        CacheKey key = new CacheKey("abc123", "fr");
        cache.store(new CacheEntry(key, "Bonjour", "openai", "gpt-4o", "res1", "en", NOW));

        assertThat(cache.lookup(key)).hasValueSatisfying(entry -> {
            assertThat(entry.translatedText()).isEqualTo("Bonjour");
            assertThat(entry.provider()).isEqualTo("openai");
            assertThat(entry.createdAt()).isEqualTo(NOW);
        });
        assertThat(cache.lookup(new CacheKey("abc123", "de"))).isEmpty();
        assertThat(cache.contains(key)).isTrue();
    }

    @Test
    void lastWriteWins() {
        CacheKey key = new CacheKey("abc123", "fr");
        cache.store(new CacheEntry(key, "Bonjour", "openai", "gpt-4o", "res1", "en", NOW));
        cache.store(new CacheEntry(key, "Salut", "anthropic", "claude-sonnet-4-20250514", "res2", "en", NOW.plusSeconds(1)));

        CacheEntry entry = cache.lookup(key).orElseThrow();
        assertThat(entry.translatedText()).isEqualTo("Salut");
        assertThat(entry.resourceId()).isEqualTo("res2");
    }

    @Test
    void resourcesUpsertAndListByLocale() {
        JdbcResourceRepository resources = new JdbcResourceRepository(database);
        resources.upsert(Resource.of("res2", "en", "Mug", "<p>Ceramic mug</p>"), NOW);
        resources.upsert(Resource.of("res1", "en", null, "Cotton shirt"), NOW);
        resources.upsert(Resource.of("res3", "fr", "Tasse", "Tasse"), NOW);
        resources.upsert(Resource.of("res2", "en", "Mug", "<p>Large ceramic mug</p>"), NOW.plusSeconds(5));

        assertThat(resources.findByLocale("en")).extracting(Resource::id).containsExactly("res1", "res2");
        Resource updated = resources.findById("res2").orElseThrow();
        assertThat(updated.content()).isEqualTo("<p>Large ceramic mug</p>");
        assertThat(updated.title()).contains("Mug");
        assertThat(resources.findById("res1").orElseThrow().title()).isEmpty();
        assertThat(resources.findById("missing")).isEmpty();
    }
}

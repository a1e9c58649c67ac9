package ai.storefront.translator.store;

import ai.storefront.translator.cache.CacheEntry;
import ai.storefront.translator.cache.CacheKey;
import ai.storefront.translator.cache.TranslationCache;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * TranslationCache on the {@code translations} table. Stores upsert on (source_hash, target_locale).
 */
public class JdbcTranslationCache implements TranslationCache {

    private final SqliteDatabase database;

    public JdbcTranslationCache(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database");
    }

    @Override
    public Optional<CacheEntry> lookup(CacheKey key) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT translated_text, provider, model, resource_id, source_locale, created_at "
                            + "FROM translations WHERE source_hash = ? AND target_locale = ?")) {
                ps.setString(1, key.sourceHash());
                ps.setString(2, key.targetLocale());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<CacheEntry>empty();
                    }
                    return Optional.of(new CacheEntry(key,
                            rs.getString("translated_text"),
                            rs.getString("provider"),
                            rs.getString("model"),
                            rs.getString("resource_id"),
                            rs.getString("source_locale"),
                            Instant.ofEpochMilli(rs.getLong("created_at"))));
                }
            }
        });
    }

    @Override
    public void store(CacheEntry entry) {
        database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO translations (source_hash, target_locale, translated_text, provider, model, "
                            + "resource_id, source_locale, created_at) VALUES (?,?,?,?,?,?,?,?) "
                            + "ON CONFLICT(source_hash, target_locale) DO UPDATE SET "
                            + "translated_text = excluded.translated_text, provider = excluded.provider, "
                            + "model = excluded.model, resource_id = excluded.resource_id, "
                            + "source_locale = excluded.source_locale, created_at = excluded.created_at")) {
                ps.setString(1, entry.key().sourceHash());
                ps.setString(2, entry.key().targetLocale());
                ps.setString(3, entry.translatedText());
                ps.setString(4, entry.provider());
                ps.setString(5, entry.model());
                ps.setString(6, entry.resourceId());
                ps.setString(7, entry.sourceLocale());
                ps.setLong(8, entry.createdAt().toEpochMilli());
                return ps.executeUpdate();
            }
        });
    }
}

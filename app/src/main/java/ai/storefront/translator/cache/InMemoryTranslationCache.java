package ai.storefront.translator.cache;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTranslationCache implements TranslationCache {

    private final Map<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> lookup(CacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void store(CacheEntry entry) {
        Objects.requireNonNull(entry, "entry");
        entries.put(entry.key(), entry);
    }

    public int size() {
        return entries.size();
    }
}

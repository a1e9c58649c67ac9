package ai.storefront.translator.content;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryResourceRepository implements ResourceRepository {

    private final Map<String, Resource> resources = new ConcurrentHashMap<>();

    public InMemoryResourceRepository put(Resource resource) {
        Objects.requireNonNull(resource, "resource");
        resources.put(resource.id(), resource);
        return this;
    }

    public void remove(String id) {
        resources.remove(id);
    }

    @Override
    public Optional<Resource> findById(String id) {
        return Optional.ofNullable(resources.get(id));
    }

    @Override
    public List<Resource> findByLocale(String locale) {
        return resources.values().stream()
                .filter(resource -> resource.locale().equals(locale))
                .sorted(Comparator.comparing(Resource::id))
                .toList();
    }
}

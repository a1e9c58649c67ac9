package ai.storefront.translator.content;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the source resources.
 */
public interface ResourceRepository {

    Optional<Resource> findById(String id);

    /**
     * Resources stored in the given locale, ordered by id.
     */
    List<Resource> findByLocale(String locale);
}

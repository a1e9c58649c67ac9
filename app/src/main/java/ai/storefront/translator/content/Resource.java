package ai.storefront.translator.content;

import java.util.Objects;
import java.util.Optional;

/**
 * Source text of one storefront resource in one locale. The title is passed to providers as context.
 */
public record Resource(String id, String locale, Optional<String> title, String content, String contentHash) {

    public Resource {
        id = requireNonBlank(id, "id");
        locale = requireNonBlank(locale, "locale");
        title = title == null ? Optional.empty() : title.filter(value -> !value.isBlank());
        Objects.requireNonNull(content, "content");
        contentHash = requireNonBlank(contentHash, "contentHash");
    }

    /**
     * Creates a resource whose hash is computed from its content.
     */
    public static Resource of(String id, String locale, String title, String content) {
        return new Resource(id, locale, Optional.ofNullable(title), content, ContentHasher.hash(content));
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}

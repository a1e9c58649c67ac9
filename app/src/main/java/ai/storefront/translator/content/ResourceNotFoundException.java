package ai.storefront.translator.content;

/**
 * The resource behind a job item no longer exists. Items fail on it without retry.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceId;

    public ResourceNotFoundException(String resourceId) {
        super("Resource not found: " + resourceId);
        this.resourceId = resourceId;
    }

    public String resourceId() {
        return resourceId;
    }
}

package ai.storefront.translator.job;

/**
 * Persistence failure surfaced from a store implementation.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

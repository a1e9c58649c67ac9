package ai.storefront.translator.translate;

/**
 * Retryable provider failure: rate limit, 5xx, timeout or network trouble.
 */
public class TransientProviderException extends TranslationException {

    public TransientProviderException(String message, String provider, Integer statusCode, Throwable cause) {
        super(message, provider, statusCode, true, cause);
    }
}

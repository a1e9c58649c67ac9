package ai.storefront.translator.translate;

/**
 * Non-retryable provider failure such as bad credentials or a malformed request. Stops retries and fallback.
 */
public class PermanentProviderException extends TranslationException {

    public PermanentProviderException(String message, String provider, Integer statusCode, Throwable cause) {
        super(message, provider, statusCode, false, cause);
    }
}

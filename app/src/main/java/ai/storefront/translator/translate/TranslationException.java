package ai.storefront.translator.translate;

import ai.storefront.translator.retry.RetryHint;
import java.util.Optional;

/**
 * Runtime exception used to propagate translation failures, tagged with the provider that raised it.
 */
public class TranslationException extends RuntimeException implements RetryHint {

    private final String provider;
    private final Integer statusCode;
    private final boolean retryable;

    public TranslationException(String message, Throwable cause) {
        this(message, "unknown", null, false, cause);
    }

    public TranslationException(String message, String provider, Integer statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.provider = provider == null ? "unknown" : provider;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public String provider() {
        return provider;
    }

    public Optional<Integer> statusCode() {
        return Optional.ofNullable(statusCode);
    }

    @Override
    public boolean retryable() {
        return retryable;
    }
}

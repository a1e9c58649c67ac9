package ai.storefront.translator.translate;

import java.time.Duration;
import java.util.Optional;

/**
 * Provider rejected the call for exceeding its rate limit, optionally saying how long to wait.
 */
public class RateLimitedException extends TransientProviderException {

    private final Duration retryAfter;

    public RateLimitedException(String message, String provider, Duration retryAfter, Throwable cause) {
        super(message, provider, 429, cause);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public Optional<Duration> suggestedDelay() {
        return retryAfter();
    }
}

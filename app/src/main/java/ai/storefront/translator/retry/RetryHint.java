package ai.storefront.translator.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * Implemented by errors that classify themselves for {@link RetryPolicy}.
 */
public interface RetryHint {

    boolean retryable();

    /**
     * Delay requested by the remote side (for example a retry-after header). Takes precedence over backoff.
     */
    default Optional<Duration> suggestedDelay() {
        return Optional.empty();
    }
}

package ai.storefront.translator.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff settings.
 */
public record RetryConfig(int maxRetries,
                          Duration initialBackoff,
                          Duration maxBackoff,
                          double multiplier,
                          double jitterFactor) {

    public static final double MAX_JITTER_FACTOR = 0.3;

    public RetryConfig {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be zero or greater");
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be at least initialBackoff");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > MAX_JITTER_FACTOR) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and " + MAX_JITTER_FACTOR);
        }
    }

    public static RetryConfig defaults() {
        return new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, MAX_JITTER_FACTOR);
    }

    public RetryConfig withMaxRetries(int retries) {
        return new RetryConfig(retries, initialBackoff, maxBackoff, multiplier, jitterFactor);
    }

    public RetryConfig withoutJitter() {
        return new RetryConfig(maxRetries, initialBackoff, maxBackoff, multiplier, 0.0);
    }
}

package ai.storefront.translator.retry;

import ai.storefront.translator.concurrent.CancellationSignal;
import ai.storefront.translator.concurrent.OperationCancelledException;
import ai.storefront.translator.concurrent.TimeSource;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation up to {@code maxRetries + 1} times with exponential backoff between attempts.
 *
 * <p>Only errors judged retryable are retried: a {@link RetryHint} anywhere in the cause chain decides,
 * otherwise {@link TransientErrorHeuristics} inspects the messages. A suggested delay on the error wins
 * over the computed backoff.
 */
public class RetryPolicy {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryConfig config;
    private final TimeSource timeSource;
    private final DoubleSupplier random;

    public RetryPolicy(RetryConfig config) {
        this(config, TimeSource.system());
    }

    public RetryPolicy(RetryConfig config, TimeSource timeSource) {
        this(config, timeSource, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(RetryConfig config, TimeSource timeSource, DoubleSupplier random) {
        this.config = Objects.requireNonNull(config, "config");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        this.random = Objects.requireNonNull(random, "random");
    }

    public <T> T execute(Supplier<T> operation, CancellationSignal cancellation) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(cancellation, "cancellation");
        int maxAttempts = config.maxRetries() + 1;
        for (int attempt = 0; ; attempt++) {
            cancellation.throwIfCancelled();
            try {
                return operation.get();
            } catch (OperationCancelledException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                if (!isRetryable(ex)) {
                    throw ex;
                }
                if (attempt + 1 >= maxAttempts) {
                    LOGGER.warn("Giving up after {} attempts: {}", maxAttempts, ex.getMessage());
                    throw ex;
                }
                Duration delay = backoffFor(attempt, ex);
                LOGGER.warn("Attempt {}/{} failed ({}); retrying in {} ms",
                        attempt + 1, maxAttempts, ex.getMessage(), delay.toMillis());
                sleep(delay, cancellation);
            }
        }
    }

    /**
     * Delay to wait after the given zero-based attempt failed with {@code error}.
     */
    public Duration backoffFor(int attempt, Throwable error) {
        Optional<Duration> suggested = suggestedDelay(error);
        if (suggested.isPresent()) {
            Duration delay = suggested.get();
            return delay.compareTo(config.maxBackoff()) > 0 ? config.maxBackoff() : delay;
        }
        double base = config.initialBackoff().toMillis() * Math.pow(config.multiplier(), Math.max(0, attempt));
        double capped = Math.min(base, config.maxBackoff().toMillis());
        double jitter = capped * config.jitterFactor() * random.getAsDouble();
        return Duration.ofMillis(Math.round(capped + jitter));
    }

    public boolean isRetryable(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof OperationCancelledException) {
                return false;
            }
            if (cause instanceof RetryHint hint) {
                return hint.retryable();
            }
            cause = cause.getCause();
        }
        cause = error;
        while (cause != null) {
            if (TransientErrorHeuristics.looksTransient(cause.getMessage())) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    public void sleep(Duration delay, CancellationSignal cancellation) {
        if (delay.isZero() || delay.isNegative()) {
            cancellation.throwIfCancelled();
            return;
        }
        timeSource.sleep(delay, cancellation);
    }

    public RetryConfig config() {
        return config;
    }

    private Optional<Duration> suggestedDelay(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof RetryHint hint) {
                return hint.suggestedDelay();
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }
}

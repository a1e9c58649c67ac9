package ai.storefront.translator.ratelimit;

import ai.storefront.translator.concurrent.CancellationSignal;
import ai.storefront.translator.concurrent.TimeSource;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dual token bucket (tokens and requests) with continuous refill proportional to elapsed time.
 *
 * <p>One instance guards one provider and is shared by every job calling that provider. Both buckets
 * are evaluated and debited under a single lock so a caller never takes capacity from only one of them.
 */
public class RateLimiter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RateLimiter.class);
    private static final long MAX_WAIT_SLICE_MILLIS = 1000;
    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private final String name;
    private final RateLimitConfig config;
    private final TimeSource timeSource;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokenBucket;
    private double requestBucket;
    private long lastRefillMillis;

    public RateLimiter(String name, RateLimitConfig config) {
        this(name, config, TimeSource.system());
    }

    public RateLimiter(String name, RateLimitConfig config, TimeSource timeSource) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        this.tokenBucket = config.tokensPerMinute();
        this.requestBucket = config.requestsPerMinute();
        this.lastRefillMillis = timeSource.currentTimeMillis();
    }

    /**
     * Blocks until one request and {@code estimatedTokens} tokens are available, then debits both.
     * Requests larger than the token capacity are clamped to the capacity.
     */
    public void waitForCapacity(long estimatedTokens, CancellationSignal cancellation) {
        Objects.requireNonNull(cancellation, "cancellation");
        long needed = Math.min(Math.max(0, estimatedTokens), config.tokensPerMinute());
        boolean waited = false;
        while (true) {
            cancellation.throwIfCancelled();
            long waitMillis;
            lock.lock();
            try {
                refill();
                if (tokenBucket >= needed && requestBucket >= 1) {
                    tokenBucket -= needed;
                    requestBucket -= 1;
                    return;
                }
                waitMillis = millisUntilAvailable(needed);
            } finally {
                lock.unlock();
            }
            if (!waited) {
                LOGGER.debug("Rate limiter {} waiting ~{} ms for {} tokens", name, waitMillis, needed);
                waited = true;
            }
            long slice = Math.max(1, Math.min(waitMillis, MAX_WAIT_SLICE_MILLIS));
            timeSource.sleep(Duration.ofMillis(slice), cancellation);
        }
    }

    /**
     * Debits the tokens a call actually used beyond its estimate. The bucket may go negative, which
     * delays later callers until the overdraft refills.
     */
    public void reconcile(long estimatedTokens, long actualTokens) {
        long overage = actualTokens - estimatedTokens;
        if (overage <= 0) {
            return;
        }
        lock.lock();
        try {
            refill();
            tokenBucket -= overage;
        } finally {
            lock.unlock();
        }
    }

    public RateLimitStatus getStatus() {
        lock.lock();
        try {
            refill();
            return new RateLimitStatus(
                    Math.max(0, (long) Math.floor(tokenBucket)),
                    Math.max(0, (long) Math.floor(requestBucket)),
                    millisUntilFull());
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }

    public RateLimitConfig config() {
        return config;
    }

    private void refill() {
        long now = timeSource.currentTimeMillis();
        long elapsed = now - lastRefillMillis;
        if (elapsed <= 0) {
            return;
        }
        double minutes = elapsed / MILLIS_PER_MINUTE;
        tokenBucket = Math.min(config.tokensPerMinute(), tokenBucket + config.tokensPerMinute() * minutes);
        requestBucket = Math.min(config.requestsPerMinute(), requestBucket + config.requestsPerMinute() * minutes);
        lastRefillMillis = now;
    }

    private long millisUntilAvailable(long neededTokens) {
        long tokenWait = refillMillis(neededTokens - tokenBucket, config.tokensPerMinute());
        long requestWait = refillMillis(1 - requestBucket, config.requestsPerMinute());
        return Math.max(tokenWait, requestWait);
    }

    private long millisUntilFull() {
        long tokenWait = refillMillis(config.tokensPerMinute() - tokenBucket, config.tokensPerMinute());
        long requestWait = refillMillis(config.requestsPerMinute() - requestBucket, config.requestsPerMinute());
        return Math.max(tokenWait, requestWait);
    }

    private static long refillMillis(double deficit, long perMinute) {
        if (deficit <= 0) {
            return 0;
        }
        return (long) Math.ceil(deficit / perMinute * MILLIS_PER_MINUTE);
    }
}

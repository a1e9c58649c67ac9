package ai.storefront.translator.ratelimit;

/**
 * Per-minute budgets of one provider.
 */
public record RateLimitConfig(long tokensPerMinute, long requestsPerMinute) {

    public RateLimitConfig {
        if (tokensPerMinute < 1) {
            throw new IllegalArgumentException("tokensPerMinute must be at least 1");
        }
        if (requestsPerMinute < 1) {
            throw new IllegalArgumentException("requestsPerMinute must be at least 1");
        }
    }
}

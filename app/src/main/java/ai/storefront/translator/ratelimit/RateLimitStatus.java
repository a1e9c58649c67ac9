package ai.storefront.translator.ratelimit;

/**
 * Snapshot of the remaining budget of a limiter.
 */
public record RateLimitStatus(long remainingTokens, long remainingRequests, long resetInMs) {
}

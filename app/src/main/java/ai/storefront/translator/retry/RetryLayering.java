package ai.storefront.translator.retry;

import java.util.Locale;

/**
 * How item level retries relate to provider level retries.
 *
 * <ul>
 *   <li>{@link #LAYERED}: the adapter retries with its own budget inside every chain pass, and the job
 *   executor re-runs the chain up to the item budget.</li>
 *   <li>{@link #COLLAPSED}: one chain pass per item; the item budget becomes the adapter budget, so each
 *   provider sees at most {@code maxRetries + 1} attempts before falling back.</li>
 * </ul>
 */
public enum RetryLayering {
    LAYERED,
    COLLAPSED;

    /**
     * Retry settings for the provider adapters under this layering.
     */
    public RetryConfig providerRetry(RetryConfig configured, int itemMaxRetries) {
        return this == COLLAPSED ? configured.withMaxRetries(itemMaxRetries) : configured;
    }

    public static RetryLayering from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Retry layering must be provided");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "layered" -> LAYERED;
            case "collapsed" -> COLLAPSED;
            default -> throw new IllegalArgumentException("Unsupported retry layering: " + raw);
        };
    }
}

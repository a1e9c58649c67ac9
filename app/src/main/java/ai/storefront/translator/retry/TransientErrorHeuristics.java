package ai.storefront.translator.retry;

import java.util.List;
import java.util.Locale;

/**
 * Message based fallback classification for errors that carry no {@link RetryHint}.
 */
public final class TransientErrorHeuristics {

    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "429", "rate limit", "rate_limit", "too many requests", "resource_exhausted", "quota");
    private static final List<String> TRANSIENT_MARKERS = List.of(
            "500", "502", "503", "504", "internal server error", "bad gateway", "service unavailable",
            "overloaded", "timeout", "timed out", "econnreset", "connection reset");

    private TransientErrorHeuristics() {
    }

    public static boolean looksRateLimited(String message) {
        return containsAny(message, RATE_LIMIT_MARKERS);
    }

    public static boolean looksTransient(String message) {
        return looksRateLimited(message) || containsAny(message, TRANSIENT_MARKERS);
    }

    private static boolean containsAny(String message, List<String> markers) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}

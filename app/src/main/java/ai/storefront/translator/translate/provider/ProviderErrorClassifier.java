package ai.storefront.translator.translate.provider;

import ai.storefront.translator.retry.TransientErrorHeuristics;
import ai.storefront.translator.translate.PermanentProviderException;
import ai.storefront.translator.translate.RateLimitedException;
import ai.storefront.translator.translate.TransientProviderException;
import ai.storefront.translator.translate.TranslationException;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps backend failures onto the {@link TranslationException} hierarchy.
 */
public final class ProviderErrorClassifier {

    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile(
            "(?:retry in |retry after |retryDelay\"?:\\s*\"?|retry-after:\\s*)([0-9]+(?:\\.[0-9]+)?)\\s*s",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STATUS_PATTERN = Pattern.compile("\\b([45][0-9]{2})\\b");

    private ProviderErrorClassifier() {
    }

    public static TranslationException classify(String provider, RuntimeException error) {
        if (error instanceof TranslationException translationException) {
            return translationException;
        }
        String message = describe(error);
        if (hasCause(error, RateLimitException.class) || anyMessageMatches(error, true)) {
            return new RateLimitedException(message, provider, extractRetryAfter(error).orElse(null), error);
        }
        if (hasCause(error, AuthenticationException.class)
                || hasCause(error, ModelNotFoundException.class)
                || hasCause(error, InvalidRequestException.class)
                || hasCause(error, NonRetriableException.class)) {
            return new PermanentProviderException(message, provider, statusCode(error), error);
        }
        if (hasCause(error, RetriableException.class) || anyMessageMatches(error, false)) {
            return new TransientProviderException(message, provider, statusCode(error), error);
        }
        return new PermanentProviderException(message, provider, statusCode(error), error);
    }

    /**
     * Failures after which the provider should not be called again in this process.
     */
    public static boolean disablesProvider(Throwable error) {
        return hasCause(error, AuthenticationException.class) || hasCause(error, ModelNotFoundException.class);
    }

    static Optional<Duration> extractRetryAfter(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
                if (matcher.find()) {
                    double seconds = Double.parseDouble(matcher.group(1));
                    return Optional.of(Duration.ofMillis(Math.max(0, (long) (seconds * 1000))));
                }
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }

    private static Integer statusCode(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                Matcher matcher = STATUS_PATTERN.matcher(message);
                if (matcher.find()) {
                    return Integer.valueOf(matcher.group(1));
                }
            }
            cause = cause.getCause();
        }
        return null;
    }

    private static boolean anyMessageMatches(Throwable error, boolean rateLimitOnly) {
        Throwable cause = error;
        while (cause != null) {
            String message = cause.getMessage();
            if (rateLimitOnly ? TransientErrorHeuristics.looksRateLimited(message)
                    : TransientErrorHeuristics.looksTransient(message)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable cause = error;
        while (cause != null) {
            if (type.isInstance(cause)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}

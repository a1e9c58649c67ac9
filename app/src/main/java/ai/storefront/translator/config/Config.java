package ai.storefront.translator.config;

import ai.storefront.translator.retry.RetryConfig;
import ai.storefront.translator.retry.RetryLayering;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path databasePath,
        LogFormat logFormat,
        int maxConcurrency,
        Duration pollInterval,
        int itemMaxRetries,
        Duration itemRetryDelay,
        RetryConfig providerRetry,
        RetryLayering retryLayering,
        List<ProviderSettings> providers,
        Secrets secrets,
        boolean preserveHtml,
        boolean preserveLiquid
) {

    public Config {
        Objects.requireNonNull(databasePath, "databasePath");
        Objects.requireNonNull(logFormat, "logFormat");
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (itemMaxRetries < 0) {
            throw new IllegalArgumentException("itemMaxRetries must be zero or greater");
        }
        Objects.requireNonNull(itemRetryDelay, "itemRetryDelay");
        if (itemRetryDelay.isNegative()) {
            throw new IllegalArgumentException("itemRetryDelay must not be negative");
        }
        Objects.requireNonNull(providerRetry, "providerRetry");
        Objects.requireNonNull(retryLayering, "retryLayering");
        providers = List.copyOf(Objects.requireNonNull(providers, "providers"));
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("At least one translation provider must be configured");
        }
        Set<LlmProvider> seen = EnumSet.noneOf(LlmProvider.class);
        for (ProviderSettings settings : providers) {
            if (!seen.add(settings.provider())) {
                throw new IllegalArgumentException("Provider listed twice: " + settings.provider().id());
            }
        }
        Objects.requireNonNull(secrets, "secrets");
    }
}

package ai.storefront.translator.config;

import ai.storefront.translator.cli.CliArguments;
import ai.storefront.translator.ratelimit.RateLimitConfig;
import ai.storefront.translator.retry.RetryConfig;
import ai.storefront.translator.retry.RetryLayering;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_DATABASE_PATH = "DATABASE_PATH";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_MAX_CONCURRENCY = "MAX_CONCURRENCY";
    static final String ENV_POLL_INTERVAL_MS = "POLL_INTERVAL_MS";
    static final String ENV_ITEM_MAX_RETRIES = "ITEM_MAX_RETRIES";
    static final String ENV_ITEM_RETRY_DELAY_MS = "ITEM_RETRY_DELAY_MS";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_MS = "LLM_INITIAL_BACKOFF_MS";
    static final String ENV_LLM_MAX_BACKOFF_MS = "LLM_MAX_BACKOFF_MS";
    static final String ENV_LLM_BACKOFF_MULTIPLIER = "LLM_BACKOFF_MULTIPLIER";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";
    static final String ENV_RETRY_LAYERING = "RETRY_LAYERING";
    static final String ENV_TRANSLATION_PROVIDERS = "TRANSLATION_PROVIDERS";
    static final String ENV_PRESERVE_HTML = "PRESERVE_HTML";
    static final String ENV_PRESERVE_LIQUID = "PRESERVE_LIQUID";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_ANTHROPIC_API_KEY = "ANTHROPIC_API_KEY";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String SUFFIX_MODEL = "_MODEL";
    static final String SUFFIX_BASE_URL = "_BASE_URL";
    static final String SUFFIX_TOKENS_PER_MINUTE = "_TOKENS_PER_MINUTE";
    static final String SUFFIX_REQUESTS_PER_MINUTE = "_REQUESTS_PER_MINUTE";

    private static final String DEFAULT_DATABASE_PATH = "storefront-translator.db";
    private static final int DEFAULT_MAX_CONCURRENCY = 5;
    private static final long DEFAULT_POLL_INTERVAL_MS = 5000;
    private static final int DEFAULT_ITEM_MAX_RETRIES = 3;
    private static final long DEFAULT_ITEM_RETRY_DELAY_MS = 1000;
    private static final String DEFAULT_PROVIDERS = "openai,anthropic";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final Map<LlmProvider, RateLimitConfig> DEFAULT_RATE_LIMITS = Map.of(
            LlmProvider.OPENAI, new RateLimitConfig(90_000, 500),
            LlmProvider.ANTHROPIC, new RateLimitConfig(40_000, 50),
            LlmProvider.GEMINI, new RateLimitConfig(1_000_000, 60),
            LlmProvider.OLLAMA, new RateLimitConfig(1_000_000, 1_000),
            LlmProvider.MOCK, new RateLimitConfig(1_000_000, 6_000));

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path databasePath = Optional.ofNullable(arguments.databasePath())
                .orElseGet(() -> Path.of(env(ENV_DATABASE_PATH).orElse(DEFAULT_DATABASE_PATH)));
        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .orElseGet(() -> env(ENV_LOG_FORMAT).map(LogFormat::from).orElse(LogFormat.TEXT));

        int maxConcurrency = Optional.ofNullable(arguments.maxConcurrency())
                .orElseGet(() -> intValue(ENV_MAX_CONCURRENCY, DEFAULT_MAX_CONCURRENCY));
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("--max-concurrency must be at least 1");
        }
        Duration pollInterval = Duration.ofMillis(longValue(ENV_POLL_INTERVAL_MS, DEFAULT_POLL_INTERVAL_MS));
        int itemMaxRetries = intValue(ENV_ITEM_MAX_RETRIES, DEFAULT_ITEM_MAX_RETRIES);
        Duration itemRetryDelay = Duration.ofMillis(longValue(ENV_ITEM_RETRY_DELAY_MS, DEFAULT_ITEM_RETRY_DELAY_MS));

        RetryConfig defaults = RetryConfig.defaults();
        RetryConfig providerRetry = new RetryConfig(
                intValue(ENV_LLM_MAX_RETRY_ATTEMPTS, defaults.maxRetries()),
                Duration.ofMillis(longValue(ENV_LLM_INITIAL_BACKOFF_MS, defaults.initialBackoff().toMillis())),
                Duration.ofMillis(longValue(ENV_LLM_MAX_BACKOFF_MS, defaults.maxBackoff().toMillis())),
                doubleValue(ENV_LLM_BACKOFF_MULTIPLIER, defaults.multiplier()),
                doubleValue(ENV_LLM_RETRY_JITTER_FACTOR, defaults.jitterFactor()));
        RetryLayering layering = env(ENV_RETRY_LAYERING).map(RetryLayering::from).orElse(RetryLayering.LAYERED);

        String providerList = Optional.ofNullable(arguments.providers())
                .filter(ConfigLoader::isNotBlank)
                .orElseGet(() -> env(ENV_TRANSLATION_PROVIDERS).orElse(DEFAULT_PROVIDERS));
        List<ProviderSettings> providers = new ArrayList<>();
        for (LlmProvider provider : parseProviders(providerList)) {
            providers.add(resolveProvider(provider));
        }

        Secrets secrets = new Secrets(env(ENV_OPENAI_API_KEY), env(ENV_ANTHROPIC_API_KEY), env(ENV_GEMINI_API_KEY));
        boolean preserveHtml = booleanValue(ENV_PRESERVE_HTML, true);
        boolean preserveLiquid = booleanValue(ENV_PRESERVE_LIQUID, true);

        return new Config(databasePath, logFormat, maxConcurrency, pollInterval, itemMaxRetries, itemRetryDelay,
                providerRetry, layering, providers, secrets, preserveHtml, preserveLiquid);
    }

    private ProviderSettings resolveProvider(LlmProvider provider) {
        String prefix = provider.envPrefix();
        String model = env(prefix + SUFFIX_MODEL).orElse(provider.defaultModel());
        Optional<String> baseUrl = env(prefix + SUFFIX_BASE_URL);
        if (provider == LlmProvider.OLLAMA && baseUrl.isEmpty()) {
            baseUrl = Optional.of(DEFAULT_OLLAMA_BASE_URL);
        }
        RateLimitConfig defaults = DEFAULT_RATE_LIMITS.get(provider);
        RateLimitConfig rateLimit = new RateLimitConfig(
                longValue(prefix + SUFFIX_TOKENS_PER_MINUTE, defaults.tokensPerMinute()),
                longValue(prefix + SUFFIX_REQUESTS_PER_MINUTE, defaults.requestsPerMinute()));
        return new ProviderSettings(provider, model, baseUrl, rateLimit);
    }

    private static List<LlmProvider> parseProviders(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(LlmProvider::from)
                .distinct()
                .toList();
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key).map(String::trim).filter(ConfigLoader::isNotBlank);
    }

    private int intValue(String key, int defaultValue) {
        return env(key).map(raw -> {
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(key + " must be an integer", ex);
            }
        }).orElse(defaultValue);
    }

    private long longValue(String key, long defaultValue) {
        return env(key).map(raw -> {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(key + " must be an integer", ex);
            }
        }).orElse(defaultValue);
    }

    private double doubleValue(String key, double defaultValue) {
        return env(key).map(raw -> {
            try {
                return Double.parseDouble(raw);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(key + " must be a number", ex);
            }
        }).orElse(defaultValue);
    }

    private boolean booleanValue(String key, boolean defaultValue) {
        return env(key)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .map(value -> switch (value) {
                    case "true", "1", "yes" -> true;
                    case "false", "0", "no" -> false;
                    default -> throw new IllegalArgumentException(key + " must be true or false");
                })
                .orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}

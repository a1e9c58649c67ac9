package ai.storefront.translator.translate.provider;

import ai.storefront.translator.concurrent.TimeSource;
import ai.storefront.translator.config.LlmProvider;
import ai.storefront.translator.config.ProviderSettings;
import ai.storefront.translator.config.Secrets;
import ai.storefront.translator.ratelimit.RateLimiter;
import ai.storefront.translator.retry.RetryConfig;
import ai.storefront.translator.retry.RetryPolicy;
import ai.storefront.translator.translate.Translator;
import ai.storefront.translator.translate.TranslatorChain;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates provider adapters and the fallback chain from configuration. LangChain4j client retries are
 * disabled so that {@link RetryPolicy} owns every retry decision.
 */
public class ProviderTranslatorFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderTranslatorFactory.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(2);
    private static final double TEMPERATURE = 0.3;
    private static final int ANTHROPIC_MAX_TOKENS = 4096;

    private final TimeSource timeSource;

    public ProviderTranslatorFactory(TimeSource timeSource) {
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
    }

    /**
     * Builds the chain in the configured order. Providers whose API key is missing are skipped.
     *
     * @throws IllegalStateException when no configured provider can be created
     */
    public TranslatorChain createChain(List<ProviderSettings> providers, Secrets secrets, RetryConfig retryConfig) {
        List<Translator> translators = new ArrayList<>();
        for (ProviderSettings settings : providers) {
            create(settings, secrets, retryConfig).ifPresent(translators::add);
        }
        if (translators.isEmpty()) {
            throw new IllegalStateException("No translation provider could be configured; check TRANSLATION_PROVIDERS and API keys");
        }
        LOGGER.info("Translator chain: {}", translators.stream().map(t -> t.name() + "/" + t.model()).toList());
        return new TranslatorChain(translators, new RetryPolicy(retryConfig, timeSource));
    }

    public Optional<Translator> create(ProviderSettings settings, Secrets secrets, RetryConfig retryConfig) {
        LlmProvider provider = settings.provider();
        Optional<String> apiKey = secrets.apiKeyFor(provider);
        if (provider.requiresApiKey() && apiKey.isEmpty()) {
            LOGGER.warn("Skipping provider {}: {}_API_KEY is not set", provider.id(), provider.envPrefix());
            return Optional.empty();
        }
        RateLimiter rateLimiter = new RateLimiter(provider.id(), settings.rateLimit(), timeSource);
        RetryPolicy retryPolicy = new RetryPolicy(retryConfig, timeSource);
        if (provider == LlmProvider.MOCK) {
            return Optional.of(new MockTranslator(rateLimiter, retryPolicy));
        }
        ChatModel chatModel = createChatModel(settings, apiKey.orElse(null));
        return Optional.of(new ChatModelTranslator(provider.id(), settings.modelName(), chatModel, rateLimiter, retryPolicy));
    }

    private ChatModel createChatModel(ProviderSettings settings, String apiKey) {
        try {
            return switch (settings.provider()) {
                case OPENAI -> createOpenAiModel(settings, apiKey);
                case ANTHROPIC -> createAnthropicModel(settings, apiKey);
                case GEMINI -> createGeminiModel(settings, apiKey);
                case OLLAMA -> createOllamaModel(settings);
                case MOCK -> throw new IllegalArgumentException("mock provider has no chat model");
            };
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize %s chat model".formatted(settings.provider().id()), ex);
        }
    }

    private ChatModel createOpenAiModel(ProviderSettings settings, String apiKey) {
        LOGGER.info("Using OpenAI model '{}'", settings.modelName());
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(settings.modelName())
                .temperature(TEMPERATURE)
                .timeout(REQUEST_TIMEOUT)
                .maxRetries(0);
        settings.baseUrl().ifPresent(builder::baseUrl);
        return builder.build();
    }

    private ChatModel createAnthropicModel(ProviderSettings settings, String apiKey) {
        LOGGER.info("Using Anthropic model '{}'", settings.modelName());
        AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
                .apiKey(apiKey)
                .modelName(settings.modelName())
                .temperature(TEMPERATURE)
                .maxTokens(ANTHROPIC_MAX_TOKENS)
                .timeout(REQUEST_TIMEOUT)
                .maxRetries(0);
        settings.baseUrl().ifPresent(builder::baseUrl);
        return builder.build();
    }

    private ChatModel createGeminiModel(ProviderSettings settings, String apiKey) {
        LOGGER.info("Using Gemini model '{}'", settings.modelName());
        return GoogleAiGeminiChatModel.builder()
                .apiKey(apiKey)
                .modelName(settings.modelName())
                .temperature(TEMPERATURE)
                .timeout(REQUEST_TIMEOUT)
                .maxRetries(0)
                .build();
    }

    private ChatModel createOllamaModel(ProviderSettings settings) {
        String baseUrl = settings.baseUrl()
                .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when using ollama"));
        LOGGER.info("Using Ollama model '{}' via {}", settings.modelName(), baseUrl);
        return OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(settings.modelName())
                .temperature(TEMPERATURE)
                .timeout(REQUEST_TIMEOUT)
                .maxRetries(0)
                .build();
    }
}

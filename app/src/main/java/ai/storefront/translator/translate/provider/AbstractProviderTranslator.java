package ai.storefront.translator.translate.provider;

import ai.storefront.translator.ratelimit.RateLimitStatus;
import ai.storefront.translator.ratelimit.RateLimiter;
import ai.storefront.translator.retry.RetryPolicy;
import ai.storefront.translator.translate.TokenUsage;
import ai.storefront.translator.translate.TransientProviderException;
import ai.storefront.translator.translate.TranslationException;
import ai.storefront.translator.translate.TranslationPrompts;
import ai.storefront.translator.translate.TranslationRequest;
import ai.storefront.translator.translate.TranslationResult;
import ai.storefront.translator.translate.Translator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared adapter pipeline: prompt building, token estimation, rate limiting, retries, usage and cost.
 * Subclasses only talk to their backend.
 */
public abstract class AbstractProviderTranslator implements Translator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractProviderTranslator.class);
    private static final int MIN_ESTIMATED_TOKENS = 100;

    private final String name;
    private final String model;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final AtomicBoolean disabled = new AtomicBoolean(false);

    protected AbstractProviderTranslator(String name, String model, RateLimiter rateLimiter, RetryPolicy retryPolicy) {
        this.name = requireNonBlank(name, "name");
        this.model = requireNonBlank(model, "model");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    /**
     * Backend reply. {@code usage} is null when the backend does not report token counts.
     */
    protected record Completion(String text, TokenUsage usage) {
    }

    protected abstract Completion complete(TranslationRequest request, String systemPrompt, String userPrompt);

    @Override
    public String name() {
        return name;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public TranslationResult translate(TranslationRequest request) {
        Objects.requireNonNull(request, "request");
        String systemPrompt = TranslationPrompts.systemPrompt(request.preserveHtml(), request.preserveLiquid());
        String userPrompt = TranslationPrompts.userPrompt(request);
        long estimatedTokens = estimateTokens(systemPrompt + userPrompt);

        rateLimiter.waitForCapacity(estimatedTokens, request.cancellation());
        Completion completion = retryPolicy.execute(() -> invoke(request, systemPrompt, userPrompt), request.cancellation());

        TokenUsage usage = completion.usage() != null
                ? completion.usage()
                : TokenUsage.of(estimatedTokens, estimateTokens(completion.text()));
        rateLimiter.reconcile(estimatedTokens, usage.total());
        double cost = ModelPricing.cost(name, model, usage);
        LOGGER.debug("{} translated {} chars to {} ({} tokens)", name, request.text().length(),
                request.targetLocale(), usage.total());
        return new TranslationResult(request.text(), completion.text().strip(), request.sourceLocale(),
                request.targetLocale(), name, model, usage, cost);
    }

    @Override
    public boolean isAvailable() {
        return !disabled.get();
    }

    @Override
    public RateLimitStatus getRemainingCapacity() {
        return rateLimiter.getStatus();
    }

    public static long estimateTokens(String text) {
        long estimate = (long) Math.ceil((text == null ? 0 : text.length()) / 4.0);
        return Math.max(MIN_ESTIMATED_TOKENS, estimate);
    }

    protected RateLimiter rateLimiter() {
        return rateLimiter;
    }

    private Completion invoke(TranslationRequest request, String systemPrompt, String userPrompt) {
        Completion completion;
        try {
            completion = complete(request, systemPrompt, userPrompt);
        } catch (TranslationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            if (ProviderErrorClassifier.disablesProvider(ex) && disabled.compareAndSet(false, true)) {
                LOGGER.error("{} disabled after permanent failure: {}", name, ex.getMessage());
            }
            throw ProviderErrorClassifier.classify(name, ex);
        }
        if (completion == null || completion.text() == null || completion.text().isBlank()) {
            throw new TransientProviderException(
                    "%s returned an empty translation".formatted(name), name, null, null);
        }
        return completion;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}

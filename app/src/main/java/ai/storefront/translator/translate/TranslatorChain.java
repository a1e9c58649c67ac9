package ai.storefront.translator.translate;

import ai.storefront.translator.concurrent.OperationCancelledException;
import ai.storefront.translator.ratelimit.RateLimitStatus;
import ai.storefront.translator.retry.RetryPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered fallback across providers. The next provider is tried only after a retryable failure;
 * a non-retryable failure ends the chain at once.
 *
 * <p>{@link #getRemainingCapacity()} reports the primary provider only.
 */
public class TranslatorChain implements Translator {

    public static final String CHAIN_NAME = "chain";

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslatorChain.class);

    private final List<Translator> providers;
    private final RetryPolicy retryPolicy;

    public TranslatorChain(List<? extends Translator> providers, RetryPolicy retryPolicy) {
        Objects.requireNonNull(providers, "providers");
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("TranslatorChain requires at least one provider");
        }
        this.providers = List.copyOf(providers);
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    @Override
    public String name() {
        return CHAIN_NAME;
    }

    @Override
    public String model() {
        return "fallback-chain";
    }

    @Override
    public TranslationResult translate(TranslationRequest request) {
        Objects.requireNonNull(request, "request");
        List<ProviderFailure> failures = new ArrayList<>();
        TranslationException last = null;
        for (Translator provider : providers) {
            request.cancellation().throwIfCancelled();
            if (!provider.isAvailable()) {
                LOGGER.debug("Skipping unavailable provider {}", provider.name());
                continue;
            }
            try {
                return provider.translate(request);
            } catch (OperationCancelledException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                TranslationException failure = attribute(provider, ex);
                failures.add(new ProviderFailure(provider.name(), failure.getMessage(), failure.retryable()));
                last = failure;
                if (!failure.retryable()) {
                    LOGGER.warn("Provider {} failed permanently; not falling back: {}", provider.name(), failure.getMessage());
                    throw failure;
                }
                LOGGER.warn("Provider {} failed ({}); falling back to next provider", provider.name(), failure.getMessage());
            }
        }
        if (last == null) {
            throw new ChainExhaustedException(failures, true, null, null);
        }
        Duration suggested = last.suggestedDelay().orElse(null);
        throw new ChainExhaustedException(failures, last.retryable(), suggested, last);
    }

    @Override
    public boolean isAvailable() {
        for (Translator provider : providers) {
            if (provider.isAvailable()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public RateLimitStatus getRemainingCapacity() {
        return providers.get(0).getRemainingCapacity();
    }

    public List<Translator> providers() {
        return providers;
    }

    private TranslationException attribute(Translator provider, RuntimeException ex) {
        if (ex instanceof TranslationException translationException) {
            return translationException;
        }
        boolean retryable = retryPolicy.isRetryable(ex);
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return new TranslationException(message, provider.name(), null, retryable, ex);
    }
}

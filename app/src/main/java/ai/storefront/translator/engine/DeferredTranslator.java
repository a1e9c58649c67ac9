package ai.storefront.translator.engine;

import ai.storefront.translator.ratelimit.RateLimitStatus;
import ai.storefront.translator.translate.BatchTranslationResult;
import ai.storefront.translator.translate.TranslationRequest;
import ai.storefront.translator.translate.TranslationResult;
import ai.storefront.translator.translate.Translator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds the provider chain on first use, so commands that only read or update jobs run without provider
 * credentials.
 */
final class DeferredTranslator implements Translator {

    private final Supplier<Translator> factory;
    private Translator delegate;

    DeferredTranslator(Supplier<Translator> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    synchronized Translator delegate() {
        if (delegate == null) {
            delegate = Objects.requireNonNull(factory.get(), "translator");
        }
        return delegate;
    }

    @Override
    public String name() {
        return delegate().name();
    }

    @Override
    public String model() {
        return delegate().model();
    }

    @Override
    public TranslationResult translate(TranslationRequest request) {
        return delegate().translate(request);
    }

    @Override
    public BatchTranslationResult translateBatch(List<TranslationRequest> requests) {
        return delegate().translateBatch(requests);
    }

    @Override
    public boolean isAvailable() {
        return delegate().isAvailable();
    }

    @Override
    public RateLimitStatus getRemainingCapacity() {
        return delegate().getRemainingCapacity();
    }
}

package ai.storefront.translator.translate.provider;

import ai.storefront.translator.ratelimit.RateLimiter;
import ai.storefront.translator.retry.RetryPolicy;
import ai.storefront.translator.translate.TranslationRequest;

/**
 * Deterministic offline translator for local runs: prefixes the text with the target locale.
 */
public class MockTranslator extends AbstractProviderTranslator {

    public MockTranslator(RateLimiter rateLimiter, RetryPolicy retryPolicy) {
        super("mock", "mock", rateLimiter, retryPolicy);
    }

    @Override
    protected Completion complete(TranslationRequest request, String systemPrompt, String userPrompt) {
        return new Completion("[" + request.targetLocale() + "] " + request.text(), null);
    }
}

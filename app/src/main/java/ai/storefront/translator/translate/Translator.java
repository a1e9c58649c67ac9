package ai.storefront.translator.translate;

import ai.storefront.translator.ratelimit.RateLimitStatus;
import java.util.ArrayList;
import java.util.List;

/**
 * A translation backend, either a single provider or a chain of them.
 */
public interface Translator {

    String name();

    String model();

    TranslationResult translate(TranslationRequest request);

    /**
     * Translates each request independently, in order.
     */
    default BatchTranslationResult translateBatch(List<TranslationRequest> requests) {
        List<TranslationResult> results = new ArrayList<>(requests.size());
        for (TranslationRequest request : requests) {
            results.add(translate(request));
        }
        return BatchTranslationResult.of(results, name());
    }

    boolean isAvailable();

    RateLimitStatus getRemainingCapacity();
}

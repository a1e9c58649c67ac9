package ai.storefront.translator.translate;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate of a batch of independent translations.
 */
public record BatchTranslationResult(List<TranslationResult> results,
                                     TokenUsage totalTokensUsed,
                                     double totalCost,
                                     String provider) {

    public BatchTranslationResult {
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        Objects.requireNonNull(totalTokensUsed, "totalTokensUsed");
        Objects.requireNonNull(provider, "provider");
    }

    public static BatchTranslationResult of(List<TranslationResult> results, String fallbackProvider) {
        TokenUsage tokens = TokenUsage.ZERO;
        double cost = 0;
        String provider = fallbackProvider;
        for (TranslationResult result : results) {
            tokens = tokens.plus(result.tokensUsed());
            cost += result.cost();
            provider = result.provider();
        }
        return new BatchTranslationResult(results, tokens, cost, provider);
    }
}

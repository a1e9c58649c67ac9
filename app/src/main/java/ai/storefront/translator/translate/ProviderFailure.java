package ai.storefront.translator.translate;

/**
 * One provider's failure recorded while walking a {@link TranslatorChain}.
 */
public record ProviderFailure(String provider, String message, boolean retryable) {
}

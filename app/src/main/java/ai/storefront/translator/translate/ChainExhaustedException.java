package ai.storefront.translator.translate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Every provider of a chain failed (or none was available).
 */
public class ChainExhaustedException extends TranslationException {

    private final List<ProviderFailure> failures;
    private final Duration suggestedDelay;

    public ChainExhaustedException(List<ProviderFailure> failures, boolean retryable, Duration suggestedDelay, Throwable lastCause) {
        super(describe(failures), TranslatorChain.CHAIN_NAME, null, retryable, lastCause);
        this.failures = List.copyOf(failures);
        this.suggestedDelay = suggestedDelay;
    }

    public List<ProviderFailure> failures() {
        return failures;
    }

    @Override
    public Optional<Duration> suggestedDelay() {
        return Optional.ofNullable(suggestedDelay);
    }

    private static String describe(List<ProviderFailure> failures) {
        if (failures.isEmpty()) {
            return "No translation provider is available";
        }
        return "All providers failed. Errors: " + failures.stream()
                .map(failure -> failure.provider() + ": " + failure.message())
                .collect(Collectors.joining("; "));
    }
}

package ai.storefront.translator.translate.provider;

import static org.assertj.core.api.Assertions.assertThat;

import ai.storefront.translator.translate.PermanentProviderException;
import ai.storefront.translator.translate.RateLimitedException;
import ai.storefront.translator.translate.TransientProviderException;
import ai.storefront.translator.translate.TranslationException;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ProviderErrorClassifierTest {

    @Test
    void rateLimitExceptionBecomesRateLimited() {
        TranslationException classified = ProviderErrorClassifier.classify("openai",
                new RateLimitException("Rate limit reached. Please retry in 20s"));

        assertThat(classified).isInstanceOf(RateLimitedException.class);
        assertThat(classified.retryable()).isTrue();
        assertThat(classified.suggestedDelay()).contains(Duration.ofSeconds(20));
        assertThat(classified.provider()).isEqualTo("openai");
    }

    @Test
    void geminiRetryDelayIsParsed() {
        RuntimeException error = new RuntimeException("RESOURCE_EXHAUSTED: {\"retryDelay\": \"7.5s\"}");

        assertThat(ProviderErrorClassifier.extractRetryAfter(error)).contains(Duration.ofMillis(7500));
        assertThat(ProviderErrorClassifier.classify("gemini", error)).isInstanceOf(RateLimitedException.class);
    }

    @Test
    void authenticationAndBadRequestsArePermanent() {
        assertThat(ProviderErrorClassifier.classify("openai", new AuthenticationException("401 Unauthorized")))
                .isInstanceOf(PermanentProviderException.class)
                .extracting(TranslationException::retryable).isEqualTo(false);
        assertThat(ProviderErrorClassifier.classify("anthropic", new InvalidRequestException("400 prompt too long")))
                .isInstanceOf(PermanentProviderException.class);
    }

    @Test
    void timeoutsAndServerErrorsAreTransient() {
        TranslationException timeout = ProviderErrorClassifier.classify("ollama", new RuntimeException("request timed out"));
        TranslationException serverError = ProviderErrorClassifier.classify("openai",
                new IllegalStateException("upstream failed", new RuntimeException("503 Service Unavailable")));

        assertThat(timeout).isInstanceOf(TransientProviderException.class);
        assertThat(serverError).isInstanceOf(TransientProviderException.class);
        assertThat(serverError.statusCode()).contains(503);
    }

    @Test
    void unknownFailuresArePermanent() {
        assertThat(ProviderErrorClassifier.classify("openai", new IllegalArgumentException("unexpected field")))
                .isInstanceOf(PermanentProviderException.class);
    }

    @Test
    void onlyCredentialAndModelErrorsDisableProvider() {
        assertThat(ProviderErrorClassifier.disablesProvider(new AuthenticationException("bad key"))).isTrue();
        assertThat(ProviderErrorClassifier.disablesProvider(new ModelNotFoundException("no such model"))).isTrue();
        assertThat(ProviderErrorClassifier.disablesProvider(new RateLimitException("429"))).isFalse();
    }
}

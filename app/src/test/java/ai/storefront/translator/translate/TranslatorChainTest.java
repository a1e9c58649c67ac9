package ai.storefront.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import ai.storefront.translator.concurrent.ManualTimeSource;
import ai.storefront.translator.retry.RetryConfig;
import ai.storefront.translator.retry.RetryPolicy;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class TranslatorChainTest {

    private final RetryPolicy retryPolicy = new RetryPolicy(RetryConfig.defaults().withoutJitter(), new ManualTimeSource());

    @Test
    void returnsPrimaryResultWithoutTouchingFallbacks() {
        ScriptedTranslator primary = ScriptedTranslator.echo("openai");
        ScriptedTranslator secondary = ScriptedTranslator.echo("anthropic");
        TranslatorChain chain = new TranslatorChain(List.of(primary, secondary), retryPolicy);

        TranslationResult result = chain.translate(TranslationRequest.of("Hello", "en", "fr"));

        assertThat(result.translatedText()).isEqualTo("[fr] Hello");
        assertThat(result.provider()).isEqualTo("openai");
        assertThat(secondary.calls()).isZero();
    }

    @Test
    void fallsBackAfterRetryableFailure() {
        ScriptedTranslator primary = ScriptedTranslator.failing("openai",
                new TransientProviderException("503 Service Unavailable", "openai", 503, null));
        ScriptedTranslator secondary = ScriptedTranslator.echo("anthropic");
        ScriptedTranslator third = ScriptedTranslator.echo("gemini");
        TranslatorChain chain = new TranslatorChain(List.of(primary, secondary, third), retryPolicy);

        TranslationResult result = chain.translate(TranslationRequest.of("Hello", "en", "de"));

        assertThat(result.provider()).isEqualTo("anthropic");
        assertThat(primary.calls()).isEqualTo(1);
        assertThat(secondary.calls()).isEqualTo(1);
        assertThat(third.calls()).isZero();
    }

    @Test
    void permanentFailureStopsTheChain() {
        ScriptedTranslator primary = ScriptedTranslator.failing("openai",
                new PermanentProviderException("content policy violation", "openai", 400, null));
        ScriptedTranslator secondary = ScriptedTranslator.echo("anthropic");
        TranslatorChain chain = new TranslatorChain(List.of(primary, secondary), retryPolicy);

        assertThatThrownBy(() -> chain.translate(TranslationRequest.of("Hello", "en", "de")))
                .isInstanceOf(PermanentProviderException.class)
                .hasMessageContaining("content policy");
        assertThat(secondary.calls()).isZero();
    }

    @Test
    void exhaustionListsEveryProviderAndKeepsRetryAfter() {
        ScriptedTranslator primary = ScriptedTranslator.failing("openai",
                new TransientProviderException("timeout", "openai", null, null));
        ScriptedTranslator secondary = ScriptedTranslator.failing("anthropic",
                new RateLimitedException("429 rate limit", "anthropic", Duration.ofSeconds(12), null));
        TranslatorChain chain = new TranslatorChain(List.of(primary, secondary), retryPolicy);

        ChainExhaustedException thrown = catchThrowableOfType(
                () -> chain.translate(TranslationRequest.of("Hello", "en", "ja")), ChainExhaustedException.class);

        assertThat(thrown.failures()).extracting(ProviderFailure::provider).containsExactly("openai", "anthropic");
        assertThat(thrown.retryable()).isTrue();
        assertThat(thrown.suggestedDelay()).contains(Duration.ofSeconds(12));
        assertThat(thrown.getMessage()).startsWith("All providers failed").contains("openai: timeout");
    }

    @Test
    void foreignExceptionsAreClassifiedByMessage() {
        ScriptedTranslator primary = ScriptedTranslator.failing("openai", new IllegalStateException("connection reset by peer"));
        ScriptedTranslator secondary = ScriptedTranslator.failing("anthropic", new IllegalStateException("malformed payload"));
        TranslatorChain chain = new TranslatorChain(List.of(primary, secondary), retryPolicy);

        TranslationException thrown = catchThrowableOfType(
                () -> chain.translate(TranslationRequest.of("Hello", "en", "ja")), TranslationException.class);

        assertThat(thrown.retryable()).isFalse();
        assertThat(thrown.provider()).isEqualTo("anthropic");
        assertThat(primary.calls()).isEqualTo(1);
    }

    @Test
    void skipsUnavailableProviders() {
        ScriptedTranslator disabled = ScriptedTranslator.echo("openai").unavailable();
        ScriptedTranslator secondary = ScriptedTranslator.echo("anthropic");
        TranslatorChain chain = new TranslatorChain(List.of(disabled, secondary), retryPolicy);

        TranslationResult result = chain.translate(TranslationRequest.of("Hi", "en", "fr"));

        assertThat(result.provider()).isEqualTo("anthropic");
        assertThat(disabled.calls()).isZero();
        assertThat(chain.isAvailable()).isTrue();
    }

    @Test
    void noAvailableProviderIsRetryableExhaustion() {
        TranslatorChain chain = new TranslatorChain(List.of(ScriptedTranslator.echo("openai").unavailable()), retryPolicy);

        ChainExhaustedException thrown = catchThrowableOfType(
                () -> chain.translate(TranslationRequest.of("Hi", "en", "fr")), ChainExhaustedException.class);

        assertThat(thrown.failures()).isEmpty();
        assertThat(thrown.retryable()).isTrue();
        assertThat(chain.isAvailable()).isFalse();
    }

    @Test
    void batchTranslationSumsUsage() {
        TranslatorChain chain = new TranslatorChain(List.of(ScriptedTranslator.echo("openai")), retryPolicy);

        BatchTranslationResult batch = chain.translateBatch(List.of(
                TranslationRequest.of("One", "en", "fr"),
                TranslationRequest.of("Two", "en", "fr")));

        assertThat(batch.results()).extracting(TranslationResult::translatedText).containsExactly("[fr] One", "[fr] Two");
        assertThat(batch.totalTokensUsed().total()).isEqualTo(40);
        assertThat(batch.provider()).isEqualTo("openai");
    }

    @Test
    void requiresAtLeastOneProvider() {
        assertThatThrownBy(() -> new TranslatorChain(List.of(), retryPolicy)).isInstanceOf(IllegalArgumentException.class);
    }
}

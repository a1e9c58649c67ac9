package ai.storefront.translator.translate.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.storefront.translator.concurrent.ManualTimeSource;
import ai.storefront.translator.ratelimit.RateLimitConfig;
import ai.storefront.translator.ratelimit.RateLimiter;
import ai.storefront.translator.retry.RetryConfig;
import ai.storefront.translator.retry.RetryPolicy;
import ai.storefront.translator.translate.PermanentProviderException;
import ai.storefront.translator.translate.TransientProviderException;
import ai.storefront.translator.translate.TranslationRequest;
import ai.storefront.translator.translate.TranslationResult;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

class ChatModelTranslatorTest {

    private final ManualTimeSource clock = new ManualTimeSource();
    private final RetryPolicy retryPolicy = new RetryPolicy(
            new RetryConfig(2, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.0), clock);

    @Test
    void sendsSystemAndUserPromptAndReportsUsage() {
        List<ChatRequest> seen = new ArrayList<>();
        ChatModel stubModel = stubModel(request -> {
            seen.add(request);
            return ChatResponse.builder()
                    .aiMessage(AiMessage.from("  Bonjour le monde \n"))
                    .tokenUsage(new TokenUsage(1200, 800))
                    .build();
        });
        ChatModelTranslator translator = translator("openai", "gpt-4o", stubModel);

        TranslationResult result = translator.translate(TranslationRequest.of("Hello world", "en", "fr"));

        assertThat(result.translatedText()).isEqualTo("Bonjour le monde");
        assertThat(result.provider()).isEqualTo("openai");
        assertThat(result.model()).isEqualTo("gpt-4o");
        assertThat(result.tokensUsed().input()).isEqualTo(1200);
        assertThat(result.tokensUsed().output()).isEqualTo(800);
        assertThat(result.cost()).isCloseTo(0.003 + 0.008, org.assertj.core.data.Offset.offset(1e-9));

        List<ChatMessage> messages = seen.get(0).messages();
        assertThat(messages).hasSize(2);
        assertThat(((SystemMessage) messages.get(0)).text()).contains("HTML tags").contains("Liquid tags");
        assertThat(((UserMessage) messages.get(1)).singleText())
                .isEqualTo("Translate the following text from en to fr:\n\nHello world");
    }

    @Test
    void estimatesUsageWhenBackendReportsNone() {
        ChatModelTranslator translator = translator("ollama", "llama3.1",
                stubModel(request -> ChatResponse.builder().aiMessage(AiMessage.from("Hallo")).build()));

        TranslationResult result = translator.translate(TranslationRequest.of("Hello", "en", "de"));

        assertThat(result.tokensUsed().output()).isEqualTo(100);
        assertThat(result.tokensUsed().input()).isGreaterThanOrEqualTo(100);
        assertThat(result.cost()).isZero();
    }

    @Test
    void retriesRateLimitsWithSuggestedDelay() {
        AtomicInteger attempts = new AtomicInteger();
        ChatModelTranslator translator = translator("anthropic", "claude-sonnet-4-20250514", stubModel(request -> {
            if (attempts.incrementAndGet() == 1) {
                throw new RateLimitException("429 Too Many Requests, retry after 3s");
            }
            return ChatResponse.builder().aiMessage(AiMessage.from("Hola")).build();
        }));

        TranslationResult result = translator.translate(TranslationRequest.of("Hello", "en", "es"));

        assertThat(result.translatedText()).isEqualTo("Hola");
        assertThat(attempts).hasValue(2);
        assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(3));
    }

    @Test
    void blankCompletionIsRetriedThenFails() {
        AtomicInteger attempts = new AtomicInteger();
        ChatModelTranslator translator = translator("openai", "gpt-4o", stubModel(request -> {
            attempts.incrementAndGet();
            return ChatResponse.builder().aiMessage(AiMessage.from("   ")).build();
        }));

        assertThatThrownBy(() -> translator.translate(TranslationRequest.of("Hello", "en", "es")))
                .isInstanceOf(TransientProviderException.class)
                .hasMessageContaining("empty translation");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void authenticationFailureDisablesProvider() {
        AtomicInteger attempts = new AtomicInteger();
        ChatModelTranslator translator = translator("openai", "gpt-4o", stubModel(request -> {
            attempts.incrementAndGet();
            throw new AuthenticationException("401 invalid api key");
        }));

        assertThatThrownBy(() -> translator.translate(TranslationRequest.of("Hello", "en", "es")))
                .isInstanceOf(PermanentProviderException.class);
        assertThat(attempts).hasValue(1);
        assertThat(translator.isAvailable()).isFalse();
    }

    @Test
    void debitsTheRateLimiter() {
        ChatModelTranslator translator = translator("openai", "gpt-4o", stubModel(request -> ChatResponse.builder()
                .aiMessage(AiMessage.from("Ciao"))
                .tokenUsage(new TokenUsage(300, 200))
                .build()));

        translator.translate(TranslationRequest.of("Hello", "en", "it"));

        assertThat(translator.getRemainingCapacity().remainingTokens()).isEqualTo(10_000 - 500);
        assertThat(translator.getRemainingCapacity().remainingRequests()).isEqualTo(9);
    }

    @Test
    void estimatesAtLeastOneHundredTokens() {
        assertThat(AbstractProviderTranslator.estimateTokens("")).isEqualTo(100);
        assertThat(AbstractProviderTranslator.estimateTokens("x".repeat(2001))).isEqualTo(501);
    }

    private ChatModelTranslator translator(String provider, String model, ChatModel chatModel) {
        RateLimiter limiter = new RateLimiter(provider, new RateLimitConfig(10_000, 10), clock);
        return new ChatModelTranslator(provider, model, chatModel, limiter, retryPolicy);
    }

    private static ChatModel stubModel(Function<ChatRequest, ChatResponse> handler) {
        return new ChatModel() {
            @Override
            public ChatResponse chat(ChatRequest chatRequest) {
                return handler.apply(chatRequest);
            }
        };
    }
}

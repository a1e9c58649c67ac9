package ai.storefront.translator.translate.provider;

import ai.storefront.translator.ratelimit.RateLimiter;
import ai.storefront.translator.retry.RetryPolicy;
import ai.storefront.translator.translate.TokenUsage;
import ai.storefront.translator.translate.TranslationRequest;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import java.util.Objects;

/**
 * Translator backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelTranslator extends AbstractProviderTranslator {

    private final ChatModel chatModel;

    public ChatModelTranslator(String providerName,
                               String modelName,
                               ChatModel chatModel,
                               RateLimiter rateLimiter,
                               RetryPolicy retryPolicy) {
        super(providerName, modelName, rateLimiter, retryPolicy);
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    }

    @Override
    protected Completion complete(TranslationRequest request, String systemPrompt, String userPrompt) {
        List<ChatMessage> messages = List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt));
        ChatResponse response = chatModel.chat(messages);
        if (response == null || response.aiMessage() == null) {
            return null;
        }
        return new Completion(response.aiMessage().text(), usageOf(response));
    }

    private static TokenUsage usageOf(ChatResponse response) {
        dev.langchain4j.model.output.TokenUsage usage = response.tokenUsage();
        if (usage == null || usage.inputTokenCount() == null || usage.outputTokenCount() == null) {
            return null;
        }
        return TokenUsage.of(usage.inputTokenCount(), usage.outputTokenCount());
    }
}

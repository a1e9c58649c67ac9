package ai.storefront.translator.translate.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import ai.storefront.translator.translate.TokenUsage;
import org.junit.jupiter.api.Test;

class ModelPricingTest {

    @Test
    void pricesKnownModels() {
        double cost = ModelPricing.cost("anthropic", "claude-3-haiku-20240307", TokenUsage.of(2000, 1000));

        assertThat(cost).isCloseTo(0.0005 + 0.00125, within(1e-12));
    }

    @Test
    void unknownModelUsesProviderDefaultTier() {
        assertThat(ModelPricing.priceFor("openai", "gpt-next")).isEqualTo(ModelPricing.priceFor("openai", "gpt-4o"));
    }

    @Test
    void stripsGeminiModelPrefix() {
        assertThat(ModelPricing.priceFor("gemini", "models/gemini-1.5-flash"))
                .isEqualTo(new ModelPricing.Price(0.000075, 0.0003));
    }

    @Test
    void localProvidersAreFree() {
        assertThat(ModelPricing.cost("ollama", "llama3.1", TokenUsage.of(5000, 5000))).isZero();
        assertThat(ModelPricing.cost("mock", "mock", TokenUsage.of(5000, 5000))).isZero();
    }
}

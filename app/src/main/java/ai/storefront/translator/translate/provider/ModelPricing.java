package ai.storefront.translator.translate.provider;

import ai.storefront.translator.translate.TokenUsage;
import java.util.Locale;
import java.util.Map;

/**
 * Static USD price table per 1K tokens. Unknown models fall back to the provider's default tier;
 * providers without a table (local or mock backends) cost nothing.
 */
public final class ModelPricing {

    public record Price(double inputPer1k, double outputPer1k) {
    }

    private static final Map<String, Map<String, Price>> PRICES = Map.of(
            "openai", Map.of(
                    "gpt-4o", new Price(0.0025, 0.01),
                    "gpt-4o-mini", new Price(0.00015, 0.0006),
                    "gpt-4-turbo", new Price(0.01, 0.03)),
            "anthropic", Map.of(
                    "claude-sonnet-4-20250514", new Price(0.003, 0.015),
                    "claude-3-5-sonnet-20241022", new Price(0.003, 0.015),
                    "claude-3-haiku-20240307", new Price(0.00025, 0.00125)),
            "gemini", Map.of(
                    "gemini-1.5-pro", new Price(0.00125, 0.005),
                    "gemini-1.5-flash", new Price(0.000075, 0.0003),
                    "gemini-2.0-flash", new Price(0.0001, 0.0004)));

    private static final Map<String, String> DEFAULT_TIER = Map.of(
            "openai", "gpt-4o",
            "anthropic", "claude-sonnet-4-20250514",
            "gemini", "gemini-1.5-pro");

    private static final Price FREE = new Price(0, 0);

    private ModelPricing() {
    }

    public static Price priceFor(String provider, String model) {
        String providerKey = provider == null ? "" : provider.toLowerCase(Locale.ROOT);
        Map<String, Price> table = PRICES.get(providerKey);
        if (table == null) {
            return FREE;
        }
        Price price = model == null ? null : table.get(model);
        if (price == null && model != null && model.startsWith("models/")) {
            price = table.get(model.substring("models/".length()));
        }
        return price != null ? price : table.get(DEFAULT_TIER.get(providerKey));
    }

    public static double cost(String provider, String model, TokenUsage usage) {
        Price price = priceFor(provider, model);
        return usage.input() / 1000.0 * price.inputPer1k() + usage.output() / 1000.0 * price.outputPer1k();
    }
}

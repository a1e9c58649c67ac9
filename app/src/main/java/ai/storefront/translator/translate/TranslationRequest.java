package ai.storefront.translator.translate;

import ai.storefront.translator.concurrent.CancellationSignal;
import java.util.Objects;
import java.util.Optional;

/**
 * Text to translate together with the markup handling flags and the caller's cancellation signal.
 */
public record TranslationRequest(String text,
                                 String sourceLocale,
                                 String targetLocale,
                                 Optional<String> context,
                                 boolean preserveHtml,
                                 boolean preserveLiquid,
                                 CancellationSignal cancellation) {

    public TranslationRequest {
        Objects.requireNonNull(text, "text");
        sourceLocale = requireNonBlank(sourceLocale, "sourceLocale");
        targetLocale = requireNonBlank(targetLocale, "targetLocale");
        context = context == null ? Optional.empty() : context.filter(value -> !value.isBlank());
        cancellation = cancellation == null ? CancellationSignal.NONE : cancellation;
    }

    public static TranslationRequest of(String text, String sourceLocale, String targetLocale) {
        return new TranslationRequest(text, sourceLocale, targetLocale, Optional.empty(), true, true, CancellationSignal.NONE);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}

package ai.storefront.translator.translate;

/**
 * Builds the system and user prompts sent to chat models.
 */
public final class TranslationPrompts {

    private TranslationPrompts() {
    }

    public static String systemPrompt(boolean preserveHtml, boolean preserveLiquid) {
        StringBuilder rules = new StringBuilder();
        int index = 1;
        if (preserveHtml) {
            rules.append(index++).append(". **HTML tags**: Keep all HTML tags and attributes exactly as they appear (e.g. <strong>, <a href=\"...\">, <br>).\n");
        }
        if (preserveLiquid) {
            rules.append(index++).append(". **Liquid tags**: Keep Liquid output and logic tags unchanged (e.g. {{ product.title }}, {% if %}, {% endif %}).\n");
        }
        rules.append(index++).append(". **Placeholders**: Keep placeholders such as {0}, {name}, %s and %d unchanged.\n");
        rules.append(index++).append(". **URLs and links**: Never translate URLs, link destinations or email addresses.\n");
        rules.append(index++).append(". **Code**: Do not translate text inside <code> or <pre> blocks.\n");
        rules.append(index).append(". **Numbers and units**: Keep numbers, currencies and units appropriate for the target locale.\n");
        return """
You are a professional e-commerce translator. Translate the text accurately while preserving:

""" + rules + """

Guidelines:
- Translate naturally for the target language and culture, keeping the tone and formality of the source.
- Preserve line breaks and whitespace structure.
- Respond with ONLY the translated text, without explanations or commentary.""";
    }

    public static String userPrompt(TranslationRequest request) {
        String prompt = "Translate the following text from %s to %s:\n\n%s"
                .formatted(request.sourceLocale(), request.targetLocale(), request.text());
        return request.context()
                .map(context -> "Context: " + context + "\n\n" + prompt)
                .orElse(prompt);
    }
}

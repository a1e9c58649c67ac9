package ai.storefront.translator.translate;

/**
 * Tokens consumed by one or more provider calls.
 */
public record TokenUsage(long input, long output, long total) {

    public static final TokenUsage ZERO = new TokenUsage(0, 0, 0);

    public static TokenUsage of(long input, long output) {
        return new TokenUsage(input, output, input + output);
    }

    public TokenUsage plus(TokenUsage other) {
        return new TokenUsage(input + other.input, output + other.output, total + other.total);
    }
}

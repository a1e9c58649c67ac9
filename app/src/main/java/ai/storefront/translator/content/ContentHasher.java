package ai.storefront.translator.content;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * SHA-256 digest of source text. Whitespace runs collapse to one space and the ends are trimmed, so
 * reformatting alone does not mark content as changed.
 */
public final class ContentHasher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ContentHasher() {
    }

    public static String hash(String content) {
        String normalized = WHITESPACE.matcher(content == null ? "" : content).replaceAll(" ").strip();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}

package de.bsommerfeld.recall.core.text;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Write-path normalization shared by observations, prompts and imports:
 * private-span redaction, length capping, topic-key slugging and the
 * content hash that drives deduplication.
 */
public final class TextNormalizer {

    public static final String REDACTED = "[REDACTED]";
    public static final String TRUNCATION_MARKER = "... [truncated]";

    static final int MAX_TOPIC_KEY_LENGTH = 120;

    private static final Pattern PRIVATE_SPAN = Pattern.compile("<private>.*?</private>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String HASH_ALGORITHM = "SHA-256";

    private TextNormalizer() {
    }

    /**
     * Replaces every {@code <private>…</private>} span with {@link #REDACTED}
     * and trims the result. {@code null} becomes the empty string.
     */
    public static String redactPrivate(String text) {
        if (text == null) {
            return "";
        }
        return PRIVATE_SPAN.matcher(text).replaceAll(REDACTED).trim();
    }

    /** Cuts {@code content} to {@code maxLength} characters and appends {@link #TRUNCATION_MARKER}. */
    public static String capLength(String content, int maxLength) {
        if (content.length() <= maxLength) {
            return content;
        }
        return content.substring(0, maxLength) + TRUNCATION_MARKER;
    }

    /** Redaction followed by length capping, the order every write path uses. */
    public static String cleanContent(String content, int maxLength) {
        return capLength(redactPrivate(content), maxLength);
    }

    /**
     * Lower-cased, whitespace-collapsed topic key capped at 120 characters.
     * Blank input yields the empty string, which callers store as NULL.
     */
    public static String normalizeTopicKey(String topicKey) {
        if (topicKey == null) {
            return "";
        }
        String v = topicKey.trim().toLowerCase(Locale.ROOT);
        if (v.isEmpty()) {
            return "";
        }
        v = WHITESPACE.matcher(v).replaceAll("-");
        return v.length() > MAX_TOPIC_KEY_LENGTH ? v.substring(0, MAX_TOPIC_KEY_LENGTH) : v;
    }

    /** Collapses whitespace runs to single spaces and trims. */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim()).replaceAll(" ");
    }

    /**
     * Hex SHA-256 of the lower-cased, whitespace-collapsed content. Two texts
     * differing only in case or spacing hash equally.
     */
    public static String contentHash(String content) {
        String normalized = collapseWhitespace(content).toLowerCase(Locale.ROOT);
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError(HASH_ALGORITHM + " not available", e);
        }
    }

    /** Shortens {@code text} to {@code max} characters plus {@code ...}. */
    public static String truncate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }

    /** {@code null} for blank input, the value otherwise. */
    public static String nullIfEmpty(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}

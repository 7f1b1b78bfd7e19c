package de.bsommerfeld.recall.core.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns raw user input into a safe FTS5 {@code MATCH} expression. Every
 * whitespace-separated token becomes a quoted phrase, so operators such as
 * {@code AND}, {@code NEAR}, {@code -} or {@code :} are matched literally.
 */
public final class FtsQuery {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FtsQuery() {
    }

    /**
     * {@code fix auth bug} becomes {@code "fix" "auth" "bug"}. Leading and
     * trailing double quotes of a token are dropped, inner ones are doubled.
     *
     * @return the expression, or an empty string when no token remains
     */
    public static String sanitize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        List<String> phrases = new ArrayList<>();
        for (String token : WHITESPACE.split(raw.trim())) {
            String stripped = stripQuotes(token);
            if (stripped.isEmpty()) {
                continue;
            }
            phrases.add('"' + stripped.replace("\"", "\"\"") + '"');
        }
        return String.join(" ", phrases);
    }

    private static String stripQuotes(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '"') {
            start++;
        }
        while (end > start && token.charAt(end - 1) == '"') {
            end--;
        }
        return token.substring(start, end);
    }
}

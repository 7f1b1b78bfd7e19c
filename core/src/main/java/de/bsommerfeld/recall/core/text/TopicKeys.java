package de.bsommerfeld.recall.core.text;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Suggests stable topic keys of the form {@code family/segment}, e.g.
 * {@code bug/nil-pointer-in-auth-middleware}. Callers pass the suggestion back
 * as {@code topic_key} when a fact is expected to evolve.
 */
public final class TopicKeys {

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_SEGMENT_LENGTH = 100;
    private static final int CONTENT_WORDS = 8;

    private TopicKeys() {
    }

    public static String suggest(String type, String title, String content) {
        String family = inferFamily(type, title, content);
        String segment = segment(TextNormalizer.redactPrivate(title));

        if (segment.isEmpty()) {
            String cleanContent = TextNormalizer.redactPrivate(content).toLowerCase(Locale.ROOT);
            String[] words = cleanContent.isBlank() ? new String[0] : WHITESPACE.split(cleanContent.trim());
            if (words.length > CONTENT_WORDS) {
                words = Arrays.copyOf(words, CONTENT_WORDS);
            }
            segment = segment(String.join(" ", words));
        }

        if (segment.startsWith(family + "-")) {
            segment = segment.substring(family.length() + 1);
        }
        if (segment.isEmpty() || segment.equals(family)) {
            segment = "general";
        }
        return family + "/" + segment;
    }

    static String inferFamily(String type, String title, String content) {
        String t = type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
        switch (t) {
            case "architecture", "design", "adr", "refactor":
                return "architecture";
            case "bug", "bugfix", "fix", "incident", "hotfix":
                return "bug";
            case "decision":
                return "decision";
            case "pattern", "convention", "guideline":
                return "pattern";
            case "config", "setup", "infra", "infrastructure", "ci":
                return "config";
            case "discovery", "investigation", "root_cause", "root-cause":
                return "discovery";
            case "learning", "learn":
                return "learning";
            case "session_summary":
                return "session";
            default:
                break;
        }

        String text = ((title == null ? "" : title) + " " + (content == null ? "" : content)).toLowerCase(Locale.ROOT);
        if (containsAny(text, "bug", "fix", "panic", "error", "crash", "regression", "incident", "hotfix")) {
            return "bug";
        }
        if (containsAny(text, "architecture", "design", "adr", "boundary", "hexagonal", "refactor")) {
            return "architecture";
        }
        if (containsAny(text, "decision", "tradeoff", "chose", "choose", "decide")) {
            return "decision";
        }
        if (containsAny(text, "pattern", "convention", "naming", "guideline")) {
            return "pattern";
        }
        if (containsAny(text, "config", "setup", "environment", "env", "docker", "pipeline")) {
            return "config";
        }
        if (containsAny(text, "discovery", "investigate", "investigation", "found", "root cause")) {
            return "discovery";
        }
        if (containsAny(text, "learned", "learning")) {
            return "learning";
        }

        if (!t.isEmpty() && !t.equals("manual")) {
            return segment(t);
        }
        return "topic";
    }

    /** Lower-case slug of alphanumeric runs joined by {@code -}, capped at 100 characters. */
    static String segment(String s) {
        if (s == null) {
            return "";
        }
        String v = s.trim().toLowerCase(Locale.ROOT);
        if (v.isEmpty()) {
            return "";
        }
        v = NON_ALNUM.matcher(v).replaceAll(" ").trim();
        v = WHITESPACE.matcher(v).replaceAll("-");
        return v.length() > MAX_SEGMENT_LENGTH ? v.substring(0, MAX_SEGMENT_LENGTH) : v;
    }

    private static boolean containsAny(String text, String... words) {
        for (String w : words) {
            if (text.contains(w)) {
                return true;
            }
        }
        return false;
    }
}

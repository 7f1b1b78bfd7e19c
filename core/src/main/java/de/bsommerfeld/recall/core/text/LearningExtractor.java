package de.bsommerfeld.recall.core.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls "key learnings" out of free-form markdown, typically the closing
 * message of a coding session.
 *
 * <p>
 * A learnings section starts at a level 2 or 3 heading named
 * {@code Key Learnings}, {@code Learnings} or {@code Aprendizajes (Clave)}
 * and runs to the next level 1–3 heading. Sections are tried from the last one
 * backwards and the first section that yields an item wins. Inside a section
 * numbered items ({@code 1.} / {@code 1)}) are preferred over bullets
 * ({@code -} / {@code *}). Items shorter than {@value #MIN_LEARNING_LENGTH}
 * characters after markdown cleanup are dropped.
 */
public final class LearningExtractor {

    public static final int MIN_LEARNING_LENGTH = 20;

    private static final Pattern HEADER = Pattern.compile(
            "^#{2,3}\\s+(?:Aprendizajes(?:\\s+Clave)?|Key\\s+Learnings?|Learnings?):?\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern NEXT_HEADING = Pattern.compile("\n#{1,3} ");
    private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\s*\\d+[.)]\\s+(.+)", Pattern.MULTILINE);
    private static final Pattern BULLET_ITEM = Pattern.compile("^\\s*[-*]\\s+(.+)", Pattern.MULTILINE);

    private static final Pattern BOLD = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
    private static final Pattern ITALIC = Pattern.compile("\\*([^*]+)\\*");

    private LearningExtractor() {
    }

    /**
     * @return the learnings of the most recent qualifying section, empty when
     *         the text has none
     */
    public static List<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Integer> sectionStarts = new ArrayList<>();
        Matcher header = HEADER.matcher(text);
        while (header.find()) {
            sectionStarts.add(header.end());
        }

        for (int i = sectionStarts.size() - 1; i >= 0; i--) {
            String section = text.substring(sectionStarts.get(i));
            Matcher next = NEXT_HEADING.matcher(section);
            if (next.find()) {
                section = section.substring(0, next.start());
            }

            List<String> learnings = collect(NUMBERED_ITEM, section);
            if (learnings.isEmpty()) {
                learnings = collect(BULLET_ITEM, section);
            }
            if (!learnings.isEmpty()) {
                return learnings;
            }
        }
        return List.of();
    }

    private static List<String> collect(Pattern item, String section) {
        List<String> result = new ArrayList<>();
        Matcher m = item.matcher(section);
        while (m.find()) {
            String cleaned = cleanMarkdown(m.group(1));
            if (cleaned.length() >= MIN_LEARNING_LENGTH) {
                result.add(cleaned);
            }
        }
        return result;
    }

    /** Strips bold, inline code and italic markers, then collapses whitespace. */
    static String cleanMarkdown(String text) {
        String v = BOLD.matcher(text).replaceAll("$1");
        v = INLINE_CODE.matcher(v).replaceAll("$1");
        v = ITALIC.matcher(v).replaceAll("$1");
        return TextNormalizer.collapseWhitespace(v);
    }
}

package de.bsommerfeld.recall.core.domain;

import java.util.Locale;

/**
 * Verbosity of formatted results: {@code SUMMARY} shows ids and titles,
 * {@code STANDARD} adds truncated content, {@code FULL} prints everything.
 */
public enum DetailLevel {

    SUMMARY,
    STANDARD,
    FULL;

    /** Footer appended to summary listings. */
    public static final String SUMMARY_FOOTER = "\n---\n💡 Use detail_level: standard or full for more detail.";

    /** Empty or unrecognized input defaults to {@link #STANDARD}. */
    public static DetailLevel parse(String raw) {
        if (raw == null) {
            return STANDARD;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "summary" -> SUMMARY;
            case "full" -> FULL;
            default -> STANDARD;
        };
    }
}

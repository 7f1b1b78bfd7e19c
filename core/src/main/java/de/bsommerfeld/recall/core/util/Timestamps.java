package de.bsommerfeld.recall.core.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Formats instants the way the store persists them: UTC,
 * {@code yyyy-MM-dd HH:mm:ss}. The format sorts lexicographically and is
 * understood by SQLite's {@code datetime()}.
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return FORMAT.format(instant);
    }

    public static String now(Clock clock) {
        return format(clock.instant());
    }

    /** Timestamp for {@code now - amount}, used for window and age cutoffs. */
    public static String before(Clock clock, Duration amount) {
        return format(clock.instant().minus(amount));
    }
}

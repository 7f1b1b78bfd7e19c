package de.bsommerfeld.recall.core.domain;

/**
 * Typed, directed edge between two observations.
 *
 * @param note free-form annotation, empty string when none was given
 */
public record Relation(
        long id,
        long fromId,
        long toId,
        String type,
        String note,
        String createdAt) {

    /** Edge type used when the caller does not name one. */
    public static final String DEFAULT_TYPE = "relates_to";
}

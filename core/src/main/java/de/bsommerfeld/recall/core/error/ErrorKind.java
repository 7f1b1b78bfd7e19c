package de.bsommerfeld.recall.core.error;

/**
 * Failure categories surfaced by the memory engine. Callers branch on the kind
 * rather than on exception messages.
 */
public enum ErrorKind {

    /** Referenced session, observation or relation is absent (or soft-deleted). */
    NOT_FOUND,

    /** Self-relation, empty required field or malformed structured input. */
    INVALID_ARGUMENT,

    /** The relation triple (from, to, type) is already present. */
    ALREADY_EXISTS,

    /** Store is busy or locked. Transient, safe to retry. */
    UNAVAILABLE,

    /** Unexpected store failure. */
    INTERNAL;

    public boolean isRetryable() {
        return this == UNAVAILABLE;
    }
}

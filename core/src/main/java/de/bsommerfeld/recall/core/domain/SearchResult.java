package de.bsommerfeld.recall.core.domain;

/**
 * An observation with its FTS5 rank. Lower (more negative) ranks are better
 * matches; recency fallback results carry {@code 0}.
 */
public record SearchResult(Observation observation, double rank) {
}

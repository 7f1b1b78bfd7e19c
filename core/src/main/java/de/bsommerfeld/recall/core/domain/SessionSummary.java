package de.bsommerfeld.recall.core.domain;

/**
 * Compact session view used by context listings.
 *
 * @param observationCount number of active observations recorded in the session
 */
public record SessionSummary(
        String id,
        String project,
        String startedAt,
        String endedAt,
        String summary,
        int observationCount) {
}

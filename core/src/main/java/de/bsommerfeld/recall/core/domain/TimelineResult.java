package de.bsommerfeld.recall.core.domain;

import java.util.List;
import java.util.Optional;

/**
 * Chronological window around a focus observation within its session.
 *
 * @param focus        the focus observation
 * @param before       older neighbors, oldest first
 * @param after        newer neighbors, oldest first
 * @param session      owning session, {@code null} when it could not be loaded
 * @param totalInRange active observations in the whole session
 */
public record TimelineResult(
        Observation focus,
        List<Observation> before,
        List<Observation> after,
        Session session,
        int totalInRange) {

    public Optional<Session> sessionInfo() {
        return Optional.ofNullable(session);
    }

    /** Focus plus both neighbor lists. */
    public int windowSize() {
        return before.size() + 1 + after.size();
    }
}

package de.bsommerfeld.recall.core.domain;

import java.util.Optional;

/**
 * @param deletedCount ids that were active and are now soft-deleted
 * @param summaryId    id of the created summary, {@code null} when none
 */
public record CompactResult(int deletedCount, int totalBefore, int totalAfter, Long summaryId) {

    public Optional<Long> summary() {
        return Optional.ofNullable(summaryId);
    }
}

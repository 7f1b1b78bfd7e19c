package de.bsommerfeld.recall.core.domain;

import java.util.List;

/**
 * Batch soft-delete of stale observations, optionally replaced by a summary
 * observation of type {@code compaction_summary}.
 *
 * @param project used for the summary observation and the before/after totals
 * @param scope   same, free-form
 */
public record CompactRequest(
        List<Long> ids,
        String summaryTitle,
        String summaryContent,
        String project,
        String scope,
        String sessionId) {

    public CompactRequest {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }
}

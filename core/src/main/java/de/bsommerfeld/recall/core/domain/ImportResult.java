package de.bsommerfeld.recall.core.domain;

/**
 * Rows written by an import. Sessions count only ids that were new to the
 * target store.
 */
public record ImportResult(int sessionsImported, int observationsImported, int promptsImported) {
}

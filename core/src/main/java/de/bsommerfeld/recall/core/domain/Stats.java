package de.bsommerfeld.recall.core.domain;

import java.util.List;

/**
 * Aggregate counts. Observations count active rows only; projects are ordered
 * by their latest observation.
 */
public record Stats(int totalSessions, int totalObservations, int totalPrompts, List<String> projects) {
}

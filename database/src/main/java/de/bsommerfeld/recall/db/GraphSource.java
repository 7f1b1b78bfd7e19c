package de.bsommerfeld.recall.db;

import de.bsommerfeld.recall.core.domain.Observation;
import de.bsommerfeld.recall.core.domain.Relation;

import java.util.List;
import java.util.Optional;

/**
 * The three reads a relation-graph walk needs. {@link SqlMemoryStore}
 * answers them from SQLite; tests can stub them to simulate concurrent
 * deletes between the adjacency and the metadata fetch.
 */
public interface GraphSource {

    /**
     * @throws de.bsommerfeld.recall.core.error.MemoryException with
     *         {@code NOT_FOUND} if the observation is missing or soft-deleted
     */
    Observation getObservation(long id);

    /** Every edge touching {@code observationId}, oldest first. */
    List<Relation> getRelations(long observationId);

    /**
     * Lightweight metadata of any observation, soft-deleted ones included.
     * Empty when the row no longer exists.
     */
    Optional<GraphNode> findNode(long id);

    /** Metadata a context node carries about the observation it reached. */
    record GraphNode(long id, String title, String type, String project, String createdAt) {
    }
}

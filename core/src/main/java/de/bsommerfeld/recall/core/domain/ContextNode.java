package de.bsommerfeld.recall.core.domain;

/**
 * One observation reached by a graph traversal, with the edge that led to it.
 *
 * @param project      project of the reached observation, empty when unset
 * @param relationType type of the traversed edge
 * @param direction    edge direction relative to the expanded node
 * @param note         note of the traversed edge, empty when unset
 * @param depth        hop count from the root, starting at 1
 */
public record ContextNode(
        long id,
        String title,
        String type,
        String project,
        String createdAt,
        String relationType,
        RelationDirection direction,
        String note,
        int depth) {
}

package de.bsommerfeld.recall.db;

import de.bsommerfeld.recall.core.domain.ContextNode;
import de.bsommerfeld.recall.core.domain.ContextResult;
import de.bsommerfeld.recall.core.domain.Observation;
import de.bsommerfeld.recall.core.domain.Relation;
import de.bsommerfeld.recall.core.domain.RelationDirection;
import de.bsommerfeld.recall.core.error.MemoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Breadth-first walk over the relation graph starting at a root observation.
 *
 * <p>
 * Every node is recorded and expanded at most once: the root is seeded as
 * visited and neighbors are marked visited the moment they are discovered.
 * Edges are followed in both directions. A neighbor whose row disappears
 * between the adjacency fetch and the metadata fetch, or whose metadata
 * cannot be read, is skipped.
 */
public class ContextTraversal {

    private static final Logger LOG = LoggerFactory.getLogger(ContextTraversal.class);

    public static final int DEFAULT_DEPTH = 2;
    public static final int MAX_DEPTH = 5;

    private final GraphSource graph;

    public ContextTraversal(GraphSource graph) {
        this.graph = graph;
    }

    /** Non-positive depths become {@value #DEFAULT_DEPTH}, larger ones are capped at {@value #MAX_DEPTH}. */
    public static int clampDepth(int requested) {
        if (requested <= 0) {
            return DEFAULT_DEPTH;
        }
        return Math.min(requested, MAX_DEPTH);
    }

    /**
     * @return the root record, the discovered nodes in discovery order and the
     *         deepest level actually reached
     * @throws de.bsommerfeld.recall.core.error.MemoryException with
     *         {@code NOT_FOUND} if the root is missing or soft-deleted
     */
    public ContextResult build(long rootId, int requestedDepth) {
        int maxDepth = clampDepth(requestedDepth);
        Observation root = graph.getObservation(rootId);

        Set<Long> visited = new HashSet<>();
        visited.add(rootId);
        Deque<long[]> queue = new ArrayDeque<>();
        queue.add(new long[] { rootId, 0 });

        List<ContextNode> connected = new ArrayList<>();
        int reached = 0;

        while (!queue.isEmpty()) {
            long[] current = queue.poll();
            long currentId = current[0];
            int depth = (int) current[1];
            if (depth >= maxDepth) {
                continue;
            }

            for (Relation rel : graph.getRelations(currentId)) {
                boolean outgoing = rel.fromId() == currentId;
                long otherId = outgoing ? rel.toId() : rel.fromId();
                if (!visited.add(otherId)) {
                    continue;
                }

                Optional<GraphSource.GraphNode> node;
                try {
                    node = graph.findNode(otherId);
                } catch (MemoryException e) {
                    LOG.debug("Skipping neighbor {} of observation {}: {}", otherId, currentId, e.getMessage());
                    continue;
                }
                if (node.isEmpty()) {
                    LOG.debug("Skipping vanished neighbor {} of observation {}", otherId, currentId);
                    continue;
                }

                int nodeDepth = depth + 1;
                GraphSource.GraphNode meta = node.get();
                connected.add(new ContextNode(meta.id(), meta.title(), meta.type(), meta.project(), meta.createdAt(),
                        rel.type(), outgoing ? RelationDirection.OUTGOING : RelationDirection.INCOMING,
                        rel.note(), nodeDepth));
                reached = Math.max(reached, nodeDepth);
                queue.add(new long[] { otherId, nodeDepth });
            }
        }

        return new ContextResult(root, List.copyOf(connected), connected.size(), reached);
    }
}

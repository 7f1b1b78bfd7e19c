package de.bsommerfeld.recall.core.domain;

import java.util.List;

/**
 * Output of a context traversal.
 *
 * @param root       the full root observation
 * @param connected  reached nodes in discovery order
 * @param totalNodes {@code connected.size()}
 * @param maxDepth   deepest depth actually reached, 0 when nothing is connected
 */
public record ContextResult(Observation root, List<ContextNode> connected, int totalNodes, int maxDepth) {
}

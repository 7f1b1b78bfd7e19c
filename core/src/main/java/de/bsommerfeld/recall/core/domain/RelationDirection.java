package de.bsommerfeld.recall.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of the edge that led a traversal to a node, seen from the node
 * being expanded.
 */
public enum RelationDirection {

    OUTGOING("outgoing"),
    INCOMING("incoming");

    private final String wire;

    RelationDirection(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}

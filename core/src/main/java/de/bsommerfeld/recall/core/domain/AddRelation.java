package de.bsommerfeld.recall.core.domain;

/**
 * Input for creating an edge. With {@code bidirectional} set the reverse edge
 * is created in the same transaction.
 */
public record AddRelation(long fromId, long toId, String type, String note, boolean bidirectional) {

    public AddRelation(long fromId, long toId, String type) {
        this(fromId, toId, type, null, false);
    }
}

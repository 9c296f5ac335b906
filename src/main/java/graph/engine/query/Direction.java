package graph.engine.query;

/** Orientation of a relationship pattern relative to its left node. */
public enum Direction {
    OUTGOING,
    INCOMING,
    EITHER
}

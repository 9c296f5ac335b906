package graph.engine.plan;

/** Equality condition between a left-input column and a right-input column. */
public record JoinKey(String leftColumn, String rightColumn) {
    @Override
    public String toString() { return leftColumn + " = " + rightColumn; }
}

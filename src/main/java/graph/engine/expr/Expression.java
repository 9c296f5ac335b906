package graph.engine.expr;

import java.util.List;

/**
 * Node of a scalar or aggregate expression tree. Implementations are immutable records.
 */
public interface Expression {
    /** Canonical textual form, used to name unaliased result columns. */
    String text();

    List<Expression> children();

    /** Copy of this node with the given children, same arity and order as {@link #children()}. */
    Expression withChildren(List<Expression> children);

    default boolean isAggregate() { return false; }
}

package graph.engine.plan;

import graph.engine.expr.Expression;

public record SortKey(Expression expression, boolean ascending) {
    @Override
    public String toString() { return expression.text() + (ascending ? " ASC" : " DESC"); }
}

package graph.engine.query;

import graph.engine.expr.Expression;

/** One RETURN projection; the output column is named by the alias, else by the expression text. */
public record ReturnItem(Expression expression, String alias) {
    public ReturnItem {
        if (expression == null) throw new IllegalArgumentException("expression required");
    }

    public String outputName() {
        return alias != null ? alias : expression.text();
    }
}

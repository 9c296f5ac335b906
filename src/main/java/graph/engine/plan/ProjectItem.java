package graph.engine.plan;

import graph.engine.expr.Expression;

/** Expression computed into a named output column. */
public record ProjectItem(Expression expression, String outputName) {
    @Override
    public String toString() {
        return expression.text().equals(outputName) ? outputName : expression.text() + " AS " + outputName;
    }
}

package graph.engine.exec;

import graph.engine.expr.Expression;
import graph.engine.expr.ExpressionEvaluator;
import graph.engine.expr.TruthValue;

/**
 * Keeps rows for which the predicate is TRUE; FALSE and UNKNOWN rows are dropped.
 */
public class FilterOperator implements Operator {
    private final Operator child;
    private final Expression predicate;
    private final ExpressionEvaluator evaluator;

    public FilterOperator(Operator child, Expression predicate, ExpressionEvaluator evaluator) {
        this.child = child;
        this.predicate = predicate;
        this.evaluator = evaluator;
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Row next() {
        Row r;
        while ((r = child.next()) != null) {
            if (evaluator.test(predicate, r) == TruthValue.TRUE) return r;
        }
        return null;
    }

    @Override
    public void close() { child.close(); }

    @Override
    public RowSchema schema() { return child.schema(); }
}

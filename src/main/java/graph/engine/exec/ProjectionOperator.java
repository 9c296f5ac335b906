package graph.engine.exec;

import java.util.ArrayList;
import java.util.List;

import graph.engine.expr.ExpressionEvaluator;
import graph.engine.plan.ProjectItem;

/**
 * Evaluates each RETURN item against the child row, producing the output columns in order.
 */
public class ProjectionOperator implements Operator {
    private final Operator child;
    private final List<ProjectItem> items;
    private final ExpressionEvaluator evaluator;
    private final RowSchema schema;

    public ProjectionOperator(Operator child, List<ProjectItem> items, ExpressionEvaluator evaluator) {
        this.child = child;
        this.items = List.copyOf(items);
        this.evaluator = evaluator;
        this.schema = new RowSchema(items.stream().map(ProjectItem::outputName).toList());
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Row next() {
        Row r = child.next();
        if (r == null) return null;
        List<Object> projected = new ArrayList<>(items.size());
        for (ProjectItem item : items) projected.add(evaluator.evaluate(item.expression(), r));
        return new Row(schema, projected);
    }

    @Override
    public void close() { child.close(); }

    @Override
    public RowSchema schema() { return schema; }
}

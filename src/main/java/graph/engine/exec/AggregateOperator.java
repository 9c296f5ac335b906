package graph.engine.exec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import graph.engine.expr.Accumulator;
import graph.engine.expr.Accumulators;
import graph.engine.expr.Aggregate;
import graph.engine.expr.ExpressionEvaluator;
import graph.engine.expr.Values;
import graph.engine.plan.ProjectItem;

/**
 * Hash aggregation. Groups are emitted in first-seen order. Without group keys a single
 * row is produced even for empty input (count 0, other aggregates null).
 * Group keys compare numerically, so 1 and 1.0 fall in the same group; the group shows
 * the key values of its first row.
 */
public class AggregateOperator implements Operator {
    private final Operator child;
    private final List<ProjectItem> items;
    private final ExpressionEvaluator evaluator;
    private final RowSchema schema;
    private Iterator<Row> output;

    public AggregateOperator(Operator child, List<ProjectItem> items, ExpressionEvaluator evaluator) {
        this.child = child;
        this.items = List.copyOf(items);
        this.evaluator = evaluator;
        this.schema = new RowSchema(items.stream().map(ProjectItem::outputName).toList());
    }

    @Override
    public void open() {
        child.open();
        Map<List<Object>, Group> groups = new LinkedHashMap<>();
        boolean keyed = items.stream().anyMatch(i -> !i.expression().isAggregate());
        Row r;
        while ((r = child.next()) != null) {
            List<Object> keyValues = new ArrayList<>();
            List<Object> hashKey = new ArrayList<>();
            for (ProjectItem i : items) {
                if (i.expression().isAggregate()) continue;
                Object v = evaluator.evaluate(i.expression(), r);
                keyValues.add(v);
                hashKey.add(Values.canonical(v));
            }
            Group group = groups.computeIfAbsent(hashKey, k -> new Group(keyValues, newAccumulators()));
            int a = 0;
            for (ProjectItem i : items) {
                if (!(i.expression() instanceof Aggregate agg)) continue;
                Object v = agg.isCountStar() ? null : evaluator.evaluate(agg.argument(), r);
                group.accumulators().get(a++).add(v);
            }
        }
        child.close();
        if (groups.isEmpty() && !keyed) groups.put(List.of(), new Group(List.of(), newAccumulators()));

        List<Row> rows = new ArrayList<>(groups.size());
        for (Group g : groups.values()) {
            List<Object> values = new ArrayList<>(items.size());
            int k = 0;
            int a = 0;
            for (ProjectItem i : items) {
                values.add(i.expression().isAggregate() ? g.accumulators().get(a++).result() : g.keyValues().get(k++));
            }
            rows.add(new Row(schema, values));
        }
        output = rows.iterator();
    }

    private record Group(List<Object> keyValues, List<Accumulator> accumulators) {}

    private List<Accumulator> newAccumulators() {
        List<Accumulator> accs = new ArrayList<>();
        for (ProjectItem i : items) {
            if (i.expression() instanceof Aggregate agg) accs.add(Accumulators.create(agg));
        }
        return accs;
    }

    @Override
    public Row next() {
        return output != null && output.hasNext() ? output.next() : null;
    }

    @Override
    public void close() { output = null; }

    @Override
    public RowSchema schema() { return schema; }
}

package graph.engine.exec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import graph.engine.expr.ExpressionEvaluator;
import graph.engine.expr.Values;
import graph.engine.plan.SortKey;

/**
 * Materializing stable sort. Nulls sort last in both directions.
 */
public class SortOperator implements Operator {
    private final Operator child;
    private final List<SortKey> keys;
    private final ExpressionEvaluator evaluator;
    private Iterator<Row> output;

    public SortOperator(Operator child, List<SortKey> keys, ExpressionEvaluator evaluator) {
        this.child = child;
        this.keys = List.copyOf(keys);
        this.evaluator = evaluator;
    }

    private record Keyed(Row row, List<Object> sortValues) {}

    @Override
    public void open() {
        child.open();
        List<Keyed> rows = new ArrayList<>();
        Row r;
        while ((r = child.next()) != null) {
            List<Object> values = new ArrayList<>(keys.size());
            for (SortKey k : keys) values.add(evaluator.evaluate(k.expression(), r));
            rows.add(new Keyed(r, values));
        }
        child.close();
        rows.sort(comparator()); // List.sort is stable
        List<Row> sorted = new ArrayList<>(rows.size());
        for (Keyed k : rows) sorted.add(k.row());
        output = sorted.iterator();
    }

    private Comparator<Keyed> comparator() {
        return (a, b) -> {
            for (int i = 0; i < keys.size(); i++) {
                Object x = a.sortValues().get(i);
                Object y = b.sortValues().get(i);
                int c;
                if (x == null || y == null) {
                    c = x == null ? (y == null ? 0 : 1) : -1;
                } else {
                    c = Values.sortCompare(x, y);
                    if (!keys.get(i).ascending()) c = -c;
                }
                if (c != 0) return c;
            }
            return 0;
        };
    }

    @Override
    public Row next() {
        return output != null && output.hasNext() ? output.next() : null;
    }

    @Override
    public void close() { output = null; }

    @Override
    public RowSchema schema() { return child.schema(); }
}

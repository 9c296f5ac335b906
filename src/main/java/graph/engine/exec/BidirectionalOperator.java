package graph.engine.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import graph.engine.expr.PropertyRef;
import graph.engine.plan.BidirectionalNode;

/**
 * Emits each relationship row as stored (start = from, end = to) and then reversed,
 * skipping the reversed copy of self loops.
 */
public class BidirectionalOperator implements Operator {
    private final Operator child;
    private final int fromIndex;
    private final int toIndex;
    private final RowSchema schema;
    private Row pendingReverse;

    public BidirectionalOperator(Operator child, String variable, String fromColumn, String toColumn) {
        this.child = child;
        this.fromIndex = child.schema().indexOf(PropertyRef.qualify(variable, fromColumn));
        this.toIndex = child.schema().indexOf(PropertyRef.qualify(variable, toColumn));
        List<String> names = new ArrayList<>(child.schema().names());
        names.add(PropertyRef.qualify(variable, BidirectionalNode.START));
        names.add(PropertyRef.qualify(variable, BidirectionalNode.END));
        this.schema = new RowSchema(names);
    }

    @Override
    public void open() {
        child.open();
        pendingReverse = null;
    }

    @Override
    public Row next() {
        if (pendingReverse != null) {
            Row out = pendingReverse;
            pendingReverse = null;
            return out;
        }
        Row r = child.next();
        if (r == null) return null;
        Object from = r.get(fromIndex);
        Object to = r.get(toIndex);
        if (!Objects.equals(from, to)) pendingReverse = extend(r, to, from);
        return extend(r, from, to);
    }

    private Row extend(Row r, Object start, Object end) {
        List<Object> values = new ArrayList<>(r.values().size() + 2);
        values.addAll(r.values());
        values.add(start);
        values.add(end);
        return new Row(schema, values);
    }

    @Override
    public void close() {
        child.close();
        pendingReverse = null;
    }

    @Override
    public RowSchema schema() { return schema; }
}

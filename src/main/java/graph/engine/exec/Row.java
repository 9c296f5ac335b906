package graph.engine.exec;

import java.util.ArrayList;
import java.util.List;

import graph.engine.expr.EvalContext;

/**
 * Execution pipeline unit: positional values plus the schema naming them.
 */
public final class Row implements EvalContext {
    private final RowSchema schema;
    private final List<Object> values;

    public Row(RowSchema schema, List<Object> values) {
        if (schema.size() != values.size()) {
            throw new IllegalArgumentException("Row has " + values.size() + " values for columns " + schema);
        }
        this.schema = schema;
        this.values = values;
    }

    public RowSchema schema() { return schema; }

    public List<Object> values() { return values; }

    public Object get(int index) { return values.get(index); }

    @Override
    public Object valueOf(String column) { return values.get(schema.indexOf(column)); }

    /** Left values followed by right values under the combined schema. */
    static Row concat(RowSchema combined, Row left, Row right) {
        List<Object> all = new ArrayList<>(left.values.size() + right.values.size());
        all.addAll(left.values);
        all.addAll(right.values);
        return new Row(combined, all);
    }

    @Override
    public String toString() { return "Row" + values; }
}

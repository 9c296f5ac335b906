package graph.engine.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

import graph.engine.catalog.ColumnSchema;
import graph.engine.catalog.DataType;
import graph.engine.error.GraphQueryException;

/**
 * Immutable in-memory column store. Every column has the same length.
 * Values are normalized on the way in (integral numbers to Long, Float to Double).
 */
public class ColumnarTable implements Table {
    private final String name; // for error messages only, may be null
    private final List<ColumnSchema> schema;
    private final List<List<Object>> columns;
    private final Map<String, Integer> positions;
    private final int rowCount;

    protected ColumnarTable(String name, List<ColumnSchema> schema, List<List<Object>> columns) {
        if (schema.size() != columns.size()) throw new IllegalArgumentException("schema/column count mismatch");
        this.name = name;
        this.schema = List.copyOf(schema);
        List<List<Object>> frozen = new ArrayList<>(columns.size());
        Map<String, Integer> pos = new HashMap<>();
        int rows = -1;
        for (int i = 0; i < columns.size(); i++) {
            List<Object> col = columns.get(i);
            if (rows == -1) rows = col.size();
            else if (rows != col.size()) {
                throw new IllegalArgumentException("Column '" + schema.get(i).name() + "' has " + col.size()
                    + " values, expected " + rows);
            }
            if (pos.put(schema.get(i).name(), i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + schema.get(i).name());
            }
            frozen.add(Collections.unmodifiableList(new ArrayList<>(col)));
        }
        this.columns = Collections.unmodifiableList(frozen);
        this.positions = pos;
        this.rowCount = Math.max(rows, 0);
    }

    public static Builder builder() { return new Builder(null); }

    public static Builder builder(String name) { return new Builder(name); }

    public String name() { return name; }

    @Override
    public List<ColumnSchema> schema() { return schema; }

    @Override
    public int rowCount() { return rowCount; }

    @Override
    public boolean hasColumn(String column) { return positions.containsKey(column); }

    @Override
    public List<Object> column(String column) {
        return columns.get(indexOf(column));
    }

    @Override
    public ColumnarTable select(List<String> names) {
        List<ColumnSchema> s = new ArrayList<>(names.size());
        List<List<Object>> cols = new ArrayList<>(names.size());
        for (String n : names) {
            int idx = indexOf(n);
            s.add(schema.get(idx));
            cols.add(columns.get(idx));
        }
        return new ColumnarTable(name, s, cols);
    }

    @Override
    public ColumnarTable filter(IntPredicate rowFilter) {
        List<List<Object>> cols = new ArrayList<>(columns.size());
        for (int c = 0; c < columns.size(); c++) cols.add(new ArrayList<>());
        for (int r = 0; r < rowCount; r++) {
            if (!rowFilter.test(r)) continue;
            for (int c = 0; c < columns.size(); c++) cols.get(c).add(columns.get(c).get(r));
        }
        return new ColumnarTable(name, schema, cols);
    }

    @Override
    public List<Object> row(int index) {
        if (index < 0 || index >= rowCount) throw new IndexOutOfBoundsException("row " + index + " of " + rowCount);
        List<Object> values = new ArrayList<>(columns.size());
        for (List<Object> col : columns) values.add(col.get(index));
        return values;
    }

    protected List<List<Object>> columns() { return columns; }

    private int indexOf(String column) {
        Integer idx = positions.get(column);
        if (idx == null) throw GraphQueryException.columnNotFound(column, name);
        return idx;
    }

    @Override
    public String toString() {
        return "ColumnarTable{" + (name != null ? name + ", " : "") + "columns=" + columnNames() + ", rows=" + rowCount + "}";
    }

    /**
     * Column-at-a-time builder. Types are inferred from the values when not given.
     */
    public static final class Builder {
        private final String name;
        private final List<ColumnSchema> schema = new ArrayList<>();
        private final List<List<Object>> columns = new ArrayList<>();

        private Builder(String name) { this.name = name; }

        public Builder addColumn(String column, List<?> values) {
            List<Object> normalized = normalize(values);
            return add(new ColumnSchema(column, DataType.infer(normalized)), normalized);
        }

        public Builder addColumn(String column, DataType type, List<?> values) {
            List<Object> normalized = normalize(values);
            for (Object v : normalized) {
                DataType actual = DataType.of(v);
                if (!type.accepts(actual)) {
                    throw new IllegalArgumentException("Column '" + column + "' declared " + type + " but holds " + actual);
                }
            }
            if (type == DataType.FLOAT) {
                normalized.replaceAll(v -> v instanceof Long l ? (Object) l.doubleValue() : v);
            }
            return add(new ColumnSchema(column, type), normalized);
        }

        /** Builds a table from row-oriented data given the column names in order. */
        public Builder addRows(List<String> columnNames, List<List<?>> rows) {
            for (int c = 0; c < columnNames.size(); c++) {
                List<Object> values = new ArrayList<>(rows.size());
                for (List<?> row : rows) {
                    if (row.size() != columnNames.size()) {
                        throw new IllegalArgumentException("Row " + row + " does not match columns " + columnNames);
                    }
                    values.add(row.get(c));
                }
                addColumn(columnNames.get(c), values);
            }
            return this;
        }

        private Builder add(ColumnSchema cs, List<Object> values) {
            schema.add(cs);
            columns.add(values);
            return this;
        }

        private static List<Object> normalize(List<?> values) {
            if (values == null) throw new IllegalArgumentException("values required");
            List<Object> out = new ArrayList<>(values.size());
            for (Object v : values) out.add(DataType.normalize(v));
            return out;
        }

        public ColumnarTable build() {
            return new ColumnarTable(name, schema, columns);
        }
    }
}

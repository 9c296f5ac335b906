package graph.engine.table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import graph.engine.catalog.ColumnSchema;
import graph.engine.catalog.DataType;

/**
 * Final output of a query: named columns of equal length in RETURN order.
 * Immutable; equality is by column names, types and values in order.
 */
public final class ResultTable extends ColumnarTable {
    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private ResultTable(List<ColumnSchema> schema, List<List<Object>> columns) {
        super(null, schema, columns);
    }

    /** Assembles a result from row-major values produced by the engine. */
    public static ResultTable fromRows(List<String> columnNames, List<List<Object>> rows) {
        int width = columnNames.size();
        List<List<Object>> cols = new ArrayList<>(width);
        for (int c = 0; c < width; c++) cols.add(new ArrayList<>(rows.size()));
        for (List<Object> row : rows) {
            if (row.size() != width) throw new IllegalArgumentException("Row width " + row.size() + " != " + width);
            for (int c = 0; c < width; c++) cols.get(c).add(DataType.normalize(row.get(c)));
        }
        List<ColumnSchema> schema = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            DataType type = DataType.infer(cols.get(c));
            if (type == DataType.FLOAT) {
                cols.get(c).replaceAll(v -> v instanceof Long l ? (Object) l.doubleValue() : v);
            }
            schema.add(new ColumnSchema(columnNames.get(c), type));
        }
        return new ResultTable(schema, cols);
    }

    public static ResultTable empty(List<String> columnNames) {
        return fromRows(columnNames, List.of());
    }

    /** Column name to values, in column order. */
    public Map<String, List<Object>> toColumns() {
        Map<String, List<Object>> out = new LinkedHashMap<>();
        List<ColumnSchema> schema = schema();
        for (int i = 0; i < schema.size(); i++) out.put(schema.get(i).name(), columns().get(i));
        return out;
    }

    /** One ordered column-name to value map per row. */
    public List<Map<String, Object>> toRows() {
        List<Map<String, Object>> out = new ArrayList<>(rowCount());
        List<String> names = columnNames();
        for (int r = 0; r < rowCount(); r++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < names.size(); c++) row.put(names.get(c), columns().get(c).get(r));
            out.add(row);
        }
        return out;
    }

    /** Row-oriented JSON array, nulls included. */
    public String toJson() {
        return GSON.toJson(toRows());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultTable other)) return false;
        return schema().equals(other.schema()) && columns().equals(other.columns());
    }

    @Override
    public int hashCode() { return 31 * schema().hashCode() + columns().hashCode(); }

    @Override
    public String toString() {
        return "ResultTable" + toColumns();
    }
}

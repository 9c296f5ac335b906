package graph.engine.table;

import java.util.List;
import java.util.function.IntPredicate;

import graph.engine.catalog.ColumnSchema;

/**
 * Columnar data source consumed by the engine: named typed columns with
 * column-wise access, column selection, row filtering and row materialization.
 * Implementations are expected to be immutable.
 */
public interface Table {
    List<ColumnSchema> schema();

    int rowCount();

    /** Values of a column in row order; COLUMN_NOT_FOUND when absent. */
    List<Object> column(String name);

    /** New table holding only the named columns, in the given order. */
    Table select(List<String> columns);

    /** New table holding only the rows whose index passes the filter. */
    Table filter(IntPredicate rowFilter);

    /** Values of one row in schema order. */
    List<Object> row(int index);

    default boolean hasColumn(String name) {
        for (ColumnSchema c : schema()) {
            if (c.name().equals(name)) return true;
        }
        return false;
    }

    default List<String> columnNames() {
        return schema().stream().map(ColumnSchema::name).toList();
    }
}

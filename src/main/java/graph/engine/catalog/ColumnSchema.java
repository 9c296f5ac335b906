package graph.engine.catalog;

// Immutable data carrier for a table column.
public record ColumnSchema(String name, DataType type) {
    public ColumnSchema {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("column name required");
        if (type == null) throw new IllegalArgumentException("column type required");
    }
}

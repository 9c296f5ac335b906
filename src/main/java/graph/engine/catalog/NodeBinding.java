package graph.engine.catalog;

// Immutable binding of a node label to its table and identifying column.
// label is stored normalized (lowercase).
public record NodeBinding(String label, String tableReference, String idColumn) {}

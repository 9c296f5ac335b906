package graph.engine.catalog;

// Immutable binding of a relationship type to its table and endpoint key columns.
// type is stored normalized (lowercase).
public record RelationshipBinding(String type, String tableReference, String fromColumn, String toColumn) {}

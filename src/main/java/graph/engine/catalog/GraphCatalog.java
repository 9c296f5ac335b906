package graph.engine.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import graph.engine.error.GraphQueryException;

/**
 * Immutable mapping from node labels and relationship types to the tables that hold them.
 * All names are normalized to lowercase on registration and on lookup.
 * Dataset presence is not checked here; tables are resolved when a query executes.
 */
public final class GraphCatalog {
    private final Map<String, NodeBinding> nodes;
    private final Map<String, RelationshipBinding> relationships;

    private GraphCatalog(Map<String, NodeBinding> nodes, Map<String, RelationshipBinding> relationships) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.relationships = Collections.unmodifiableMap(new LinkedHashMap<>(relationships));
    }

    public static Builder builder() { return new Builder(); }

    public static String normalize(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name required");
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public Optional<NodeBinding> findLabel(String label) {
        return Optional.ofNullable(nodes.get(normalize(label)));
    }

    public Optional<RelationshipBinding> findRelationship(String type) {
        return Optional.ofNullable(relationships.get(normalize(type)));
    }

    public NodeBinding resolveLabel(String label) {
        return findLabel(label).orElseThrow(() -> GraphQueryException.unknownLabel(label));
    }

    public RelationshipBinding resolveRelationship(String type) {
        return findRelationship(type).orElseThrow(() -> GraphQueryException.unknownRelationshipType(type));
    }

    /** Normalized label names in registration order. */
    public Set<String> nodeLabels() { return nodes.keySet(); }

    /** Normalized relationship type names in registration order. */
    public Set<String> relationshipTypes() { return relationships.keySet(); }

    public Map<String, NodeBinding> nodeBindings() { return nodes; }

    public Map<String, RelationshipBinding> relationshipBindings() { return relationships; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphCatalog other)) return false;
        return nodes.equals(other.nodes) && relationships.equals(other.relationships);
    }

    @Override
    public int hashCode() { return 31 * nodes.hashCode() + relationships.hashCode(); }

    @Override
    public String toString() {
        return "GraphCatalog{nodes=" + nodes.values() + ", relationships=" + relationships.values() + "}";
    }

    /**
     * Incremental builder. Registering the same name twice with an identical definition is a no-op;
     * a conflicting definition fails with DUPLICATE_BINDING. build() may be called repeatedly and
     * returns an independent snapshot each time.
     */
    public static final class Builder {
        private final Map<String, NodeBinding> nodes = new LinkedHashMap<>();
        private final Map<String, RelationshipBinding> relationships = new LinkedHashMap<>();

        private Builder() {}

        public Builder addNodeLabel(String label, String tableReference, String idColumn) {
            String key = normalize(label);
            NodeBinding binding = new NodeBinding(key, requireName(tableReference, "table reference"),
                requireName(idColumn, "id column"));
            if (relationships.containsKey(key)) {
                throw GraphQueryException.duplicateBinding("Name '" + label + "' is already a relationship type");
            }
            NodeBinding existing = nodes.putIfAbsent(key, binding);
            if (existing != null && !existing.equals(binding)) {
                throw GraphQueryException.duplicateBinding("Conflicting definitions for node label '" + label
                    + "': " + existing + " vs " + binding);
            }
            return this;
        }

        /** Registers a label whose table reference is the label name itself. */
        public Builder withNodeLabel(String label, String idColumn) {
            return addNodeLabel(label, label, idColumn);
        }

        public Builder addRelationship(String type, String fromColumn, String toColumn, String tableReference) {
            String key = normalize(type);
            RelationshipBinding binding = new RelationshipBinding(key, requireName(tableReference, "table reference"),
                requireName(fromColumn, "from column"), requireName(toColumn, "to column"));
            if (nodes.containsKey(key)) {
                throw GraphQueryException.duplicateBinding("Name '" + type + "' is already a node label");
            }
            RelationshipBinding existing = relationships.putIfAbsent(key, binding);
            if (existing != null && !existing.equals(binding)) {
                throw GraphQueryException.duplicateBinding("Conflicting definitions for relationship type '" + type
                    + "': " + existing + " vs " + binding);
            }
            return this;
        }

        /** Registers a relationship type whose table reference is the type name itself. */
        public Builder withRelationship(String type, String fromColumn, String toColumn) {
            return addRelationship(type, fromColumn, toColumn, type);
        }

        public GraphCatalog build() {
            return new GraphCatalog(nodes, relationships);
        }

        private static String requireName(String value, String what) {
            if (value == null || value.isBlank()) throw new IllegalArgumentException(what + " required");
            return value.trim();
        }
    }
}

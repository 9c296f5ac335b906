package graph.engine.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import graph.engine.catalog.GraphCatalog;

/**
 * Immutable name to table mapping supplied at execution time.
 * Keys are label names, relationship type names or table references, matched case-insensitively.
 */
public final class Datasets {
    private static final Datasets EMPTY = new Datasets(Map.of());

    private final Map<String, Table> tables;

    private Datasets(Map<String, Table> tables) {
        this.tables = Collections.unmodifiableMap(tables);
    }

    public static Datasets empty() { return EMPTY; }

    public static Datasets of(Map<String, ? extends Table> tables) {
        if (tables == null) throw new IllegalArgumentException("tables must not be null");
        Builder b = builder();
        tables.forEach(b::put);
        return b.build();
    }

    public static Builder builder() { return new Builder(); }

    public Optional<Table> find(String name) {
        return Optional.ofNullable(tables.get(GraphCatalog.normalize(name)));
    }

    public boolean contains(String name) { return tables.containsKey(GraphCatalog.normalize(name)); }

    /** Normalized names. */
    public Set<String> names() { return tables.keySet(); }

    public int size() { return tables.size(); }

    @Override
    public String toString() { return "Datasets" + tables.keySet(); }

    public static final class Builder {
        private final Map<String, Table> tables = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String name, Table table) {
            if (table == null) throw new IllegalArgumentException("table must not be null for " + name);
            String key = GraphCatalog.normalize(name);
            Table previous = tables.putIfAbsent(key, table);
            if (previous != null && previous != table) {
                throw new IllegalArgumentException("Two datasets registered under name '" + name + "'");
            }
            return this;
        }

        public Datasets build() { return new Datasets(new LinkedHashMap<>(tables)); }
    }
}

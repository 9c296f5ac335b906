package graph.engine.exec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import graph.engine.error.GraphQueryException;

/**
 * Column names of a row layout and their positions. Shared by every row an operator emits.
 */
public final class RowSchema {
    private final List<String> names;
    private final Map<String, Integer> positions;

    public RowSchema(List<String> names) {
        this.names = List.copyOf(names);
        this.positions = new HashMap<>();
        for (int i = 0; i < this.names.size(); i++) {
            if (positions.put(this.names.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate column in row layout: " + this.names.get(i));
            }
        }
    }

    public List<String> names() { return names; }

    public int size() { return names.size(); }

    public int indexOf(String column) {
        Integer idx = positions.get(column);
        if (idx == null) throw GraphQueryException.columnNotFound(column, null);
        return idx;
    }

    public RowSchema concat(RowSchema other) {
        List<String> all = new ArrayList<>(names);
        all.addAll(other.names);
        return new RowSchema(all);
    }

    @Override
    public String toString() { return names.toString(); }
}

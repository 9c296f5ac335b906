package graph.engine.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import graph.engine.expr.Expression;

/**
 * (variable:Label {property: value, ...}). variable and label may be null.
 */
public record NodePattern(String variable, String label, Map<String, Expression> properties) {
    public NodePattern {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public NodePattern(String variable, String label) {
        this(variable, label, Map.of());
    }
}

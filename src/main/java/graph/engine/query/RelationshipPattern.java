package graph.engine.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import graph.engine.expr.Expression;

/**
 * -[variable:TYPE {property: value}]-> and friends. variable and type may be null.
 */
public record RelationshipPattern(String variable, String type, Direction direction,
                                  Map<String, Expression> properties) {
    public RelationshipPattern {
        if (direction == null) throw new IllegalArgumentException("direction required");
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public RelationshipPattern(String variable, String type, Direction direction) {
        this(variable, type, direction, Map.of());
    }
}

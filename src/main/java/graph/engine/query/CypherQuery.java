package graph.engine.query;

import java.util.List;

import graph.engine.expr.Expression;

/**
 * Parsed read query: MATCH patterns, optional WHERE, RETURN list and optional
 * ORDER BY / SKIP / LIMIT. where, skip and limit may be null.
 */
public record CypherQuery(List<PathPattern> patterns,
                          Expression where,
                          boolean distinct,
                          List<ReturnItem> returnItems,
                          List<OrderItem> orderBy,
                          Long skip,
                          Long limit) {
    public CypherQuery {
        if (patterns == null || patterns.isEmpty()) throw new IllegalArgumentException("at least one pattern required");
        if (returnItems == null || returnItems.isEmpty()) throw new IllegalArgumentException("RETURN items required");
        patterns = List.copyOf(patterns);
        returnItems = List.copyOf(returnItems);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        if (skip != null && skip < 0) throw new IllegalArgumentException("SKIP must be non-negative");
        if (limit != null && limit < 0) throw new IllegalArgumentException("LIMIT must be non-negative");
    }
}

package graph.engine.query;

import graph.engine.expr.Expression;

public record OrderItem(Expression expression, boolean ascending) {}

package graph.engine.expr;

import java.util.List;

import graph.engine.catalog.DataType;

public record Literal(Object value) implements Expression {
    public static final Literal NULL = new Literal(null);
    public static final Literal TRUE = new Literal(Boolean.TRUE);
    public static final Literal FALSE = new Literal(Boolean.FALSE);

    public Literal {
        value = DataType.normalize(value);
        DataType.of(value); // rejects unsupported value classes
    }

    @Override
    public String text() {
        if (value == null) return "null";
        if (value instanceof String s) return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
        return String.valueOf(value);
    }

    @Override
    public List<Expression> children() { return List.of(); }

    @Override
    public Expression withChildren(List<Expression> children) { return this; }

    @Override
    public String toString() { return text(); }
}

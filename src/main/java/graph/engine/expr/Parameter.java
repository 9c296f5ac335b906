package graph.engine.expr;

import java.util.List;

/** Query parameter placeholder ($name), replaced by a literal before compilation. */
public record Parameter(String name) implements Expression {
    @Override
    public String text() { return "$" + name; }

    @Override
    public List<Expression> children() { return List.of(); }

    @Override
    public Expression withChildren(List<Expression> children) { return this; }

    @Override
    public String toString() { return text(); }
}

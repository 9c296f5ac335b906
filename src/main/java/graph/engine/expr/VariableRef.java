package graph.engine.expr;

import java.util.List;

/** Bare identifier: a pattern variable or, in ORDER BY, a RETURN alias. */
public record VariableRef(String name) implements Expression {
    @Override
    public String text() { return name; }

    @Override
    public List<Expression> children() { return List.of(); }

    @Override
    public Expression withChildren(List<Expression> children) { return this; }

    @Override
    public String toString() { return text(); }
}

package graph.engine.expr;

import java.util.List;

/** Direct reference to a named column of the operator input (for example a projected output column). */
public record ColumnRef(String column) implements Expression {
    @Override
    public String text() { return column; }

    @Override
    public List<Expression> children() { return List.of(); }

    @Override
    public Expression withChildren(List<Expression> children) { return this; }

    @Override
    public String toString() { return text(); }
}

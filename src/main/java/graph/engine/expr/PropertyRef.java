package graph.engine.expr;

import java.util.List;

/** Property access on a pattern variable: variable.property. */
public record PropertyRef(String variable, String property) implements Expression {
    public static String qualify(String variable, String column) {
        return variable + "." + column;
    }

    /** Name of the column carrying this property in operator rows. */
    public String qualifiedName() { return qualify(variable, property); }

    @Override
    public String text() { return qualifiedName(); }

    @Override
    public List<Expression> children() { return List.of(); }

    @Override
    public Expression withChildren(List<Expression> children) { return this; }

    @Override
    public String toString() { return text(); }
}

package graph.engine.expr;

import java.util.List;

/** Unary minus. */
public record Negate(Expression operand) implements Expression {
    @Override
    public String text() { return "-" + Expressions.operand(operand); }

    @Override
    public List<Expression> children() { return List.of(operand); }

    @Override
    public Expression withChildren(List<Expression> children) { return new Negate(children.get(0)); }

    @Override
    public String toString() { return text(); }
}

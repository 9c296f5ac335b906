package graph.engine.expr;

import java.util.List;

/** IS NULL / IS NOT NULL. Never evaluates to null. */
public record NullCheck(Expression operand, boolean negated) implements Expression {
    @Override
    public String text() {
        return Expressions.operand(operand) + (negated ? " IS NOT NULL" : " IS NULL");
    }

    @Override
    public List<Expression> children() { return List.of(operand); }

    @Override
    public Expression withChildren(List<Expression> children) { return new NullCheck(children.get(0), negated); }

    @Override
    public String toString() { return text(); }
}

package graph.engine.expr;

import java.util.List;

/** Binary arithmetic: +, -, *, /, %. */
public record Arithmetic(Op op, Expression left, Expression right) implements Expression {
    public enum Op {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%");

        private final String symbol;

        Op(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }
    }

    @Override
    public String text() {
        return Expressions.operand(left) + " " + op.symbol() + " " + Expressions.operand(right);
    }

    @Override
    public List<Expression> children() { return List.of(left, right); }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new Arithmetic(op, children.get(0), children.get(1));
    }

    @Override
    public String toString() { return text(); }
}

package graph.engine.expr;

import java.util.List;

/** Binary comparison: =, <>, <, <=, >, >=. */
public record Comparison(Op op, Expression left, Expression right) implements Expression {
    public enum Op {
        EQ("="), NE("<>"), LT("<"), LTE("<="), GT(">"), GTE(">=");

        private final String symbol;

        Op(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }

        boolean accept(int cmp) {
            return switch (this) {
                case EQ -> cmp == 0;
                case NE -> cmp != 0;
                case LT -> cmp < 0;
                case LTE -> cmp <= 0;
                case GT -> cmp > 0;
                case GTE -> cmp >= 0;
            };
        }
    }

    @Override
    public String text() {
        return Expressions.operand(left) + " " + op.symbol() + " " + Expressions.operand(right);
    }

    @Override
    public List<Expression> children() { return List.of(left, right); }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new Comparison(op, children.get(0), children.get(1));
    }

    @Override
    public String toString() { return text(); }
}

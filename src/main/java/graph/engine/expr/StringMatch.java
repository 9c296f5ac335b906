package graph.engine.expr;

import java.util.List;

/** String predicates: CONTAINS, STARTS WITH, ENDS WITH. Both operands must be strings. */
public record StringMatch(Op op, Expression left, Expression right) implements Expression {
    public enum Op {
        CONTAINS("CONTAINS"), STARTS_WITH("STARTS WITH"), ENDS_WITH("ENDS WITH");

        private final String keyword;

        Op(String keyword) { this.keyword = keyword; }

        public String keyword() { return keyword; }

        boolean test(String value, String pattern) {
            return switch (this) {
                case CONTAINS -> value.contains(pattern);
                case STARTS_WITH -> value.startsWith(pattern);
                case ENDS_WITH -> value.endsWith(pattern);
            };
        }
    }

    @Override
    public String text() {
        return Expressions.operand(left) + " " + op.keyword() + " " + Expressions.operand(right);
    }

    @Override
    public List<Expression> children() { return List.of(left, right); }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new StringMatch(op, children.get(0), children.get(1));
    }

    @Override
    public String toString() { return text(); }
}

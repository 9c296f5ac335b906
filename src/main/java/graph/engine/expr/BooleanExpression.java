package graph.engine.expr;

import java.util.Arrays;
import java.util.List;

/**
 * Composes child expressions with AND / OR / XOR / NOT under three-valued logic.
 * AND / OR / XOR take two or more children, NOT exactly one.
 */
public record BooleanExpression(Type type, List<Expression> children) implements Expression {
    public enum Type { AND, OR, XOR, NOT }

    public BooleanExpression {
        if (type == Type.NOT && children.size() != 1) {
            throw new IllegalArgumentException("NOT requires exactly one child expression");
        }
        if (type != Type.NOT && children.size() < 2) {
            throw new IllegalArgumentException(type + " requires at least two child expressions");
        }
        children = List.copyOf(children);
    }

    public static BooleanExpression and(Expression... expressions) {
        return new BooleanExpression(Type.AND, Arrays.asList(expressions));
    }

    public static BooleanExpression or(Expression... expressions) {
        return new BooleanExpression(Type.OR, Arrays.asList(expressions));
    }

    public static BooleanExpression xor(Expression... expressions) {
        return new BooleanExpression(Type.XOR, Arrays.asList(expressions));
    }

    public static BooleanExpression not(Expression expression) {
        return new BooleanExpression(Type.NOT, List.of(expression));
    }

    /** AND of the given conjuncts; a single conjunct is returned as is. */
    public static Expression allOf(List<Expression> conjuncts) {
        if (conjuncts.isEmpty()) throw new IllegalArgumentException("no conjuncts");
        return conjuncts.size() == 1 ? conjuncts.get(0) : new BooleanExpression(Type.AND, conjuncts);
    }

    @Override
    public String text() {
        if (type == Type.NOT) return "NOT " + Expressions.operand(children.get(0));
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(' ').append(type).append(' ');
            sb.append(Expressions.operand(children.get(i)));
        }
        return sb.toString();
    }

    @Override
    public Expression withChildren(List<Expression> newChildren) {
        return new BooleanExpression(type, newChildren);
    }

    @Override
    public String toString() { return text(); }
}

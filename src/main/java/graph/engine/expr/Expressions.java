package graph.engine.expr;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Tree helpers shared by the parser, compiler and evaluator.
 */
public final class Expressions {
    private Expressions() {}

    /** Text of a child expression, parenthesized when it is itself an operator expression. */
    static String operand(Expression e) {
        boolean compound = e instanceof Comparison || e instanceof BooleanExpression || e instanceof Arithmetic
            || e instanceof StringMatch || e instanceof NullCheck || e instanceof InList;
        return compound ? "(" + e.text() + ")" : e.text();
    }

    /**
     * Bottom-up rewrite: children are rewritten first, then the function is applied to the rebuilt node.
     */
    public static Expression rewrite(Expression e, Function<Expression, Expression> fn) {
        List<Expression> children = e.children();
        Expression rebuilt = e;
        if (!children.isEmpty()) {
            List<Expression> newChildren = new ArrayList<>(children.size());
            boolean changed = false;
            for (Expression c : children) {
                Expression nc = rewrite(c, fn);
                changed |= nc != c;
                newChildren.add(nc);
            }
            if (changed) rebuilt = e.withChildren(newChildren);
        }
        return fn.apply(rebuilt);
    }

    /** All nodes of the tree in pre-order that satisfy the filter. */
    public static List<Expression> collect(Expression e, Predicate<Expression> filter) {
        List<Expression> out = new ArrayList<>();
        collectInto(e, filter, out);
        return out;
    }

    private static void collectInto(Expression e, Predicate<Expression> filter, List<Expression> out) {
        if (filter.test(e)) out.add(e);
        for (Expression c : e.children()) collectInto(c, filter, out);
    }

    public static boolean containsAggregate(Expression e) {
        return !collect(e, Expression::isAggregate).isEmpty();
    }

    /** Variables referenced through property access or bare identifiers, in first-use order. */
    public static Set<String> referencedVariables(Expression e) {
        Set<String> vars = new LinkedHashSet<>();
        for (Expression x : collect(e, n -> n instanceof PropertyRef || n instanceof VariableRef)) {
            vars.add(x instanceof PropertyRef p ? p.variable() : ((VariableRef) x).name());
        }
        return vars;
    }

    public static List<PropertyRef> propertyRefs(Expression e) {
        List<PropertyRef> out = new ArrayList<>();
        for (Expression x : collect(e, n -> n instanceof PropertyRef)) out.add((PropertyRef) x);
        return out;
    }

    /** Splits nested ANDs into a flat conjunct list. */
    public static List<Expression> conjuncts(Expression e) {
        List<Expression> out = new ArrayList<>();
        splitAnd(e, out);
        return out;
    }

    private static void splitAnd(Expression e, List<Expression> out) {
        if (e instanceof BooleanExpression b && b.type() == BooleanExpression.Type.AND) {
            for (Expression c : b.children()) splitAnd(c, out);
        } else {
            out.add(e);
        }
    }
}

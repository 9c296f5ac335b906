package graph.engine.expr;

import graph.engine.error.GraphQueryException;
import graph.engine.error.Stage;

/**
 * Compile-time type check. Column types are only known once datasets are supplied,
 * so only operands whose type is fixed by the query text (literals and what is built
 * from them) are checked here; the evaluator repeats the checks on real values.
 */
public final class StaticTypeChecker {
    public enum Kind { NUMBER, STRING, BOOLEAN, NULL, UNKNOWN }

    private StaticTypeChecker() {}

    /** Infers the static kind of the expression, failing with TYPE_MISMATCH on a provable conflict. */
    public static Kind check(Expression e) {
        if (e instanceof Literal l) return kindOf(l.value());
        if (e instanceof PropertyRef || e instanceof ColumnRef || e instanceof Parameter) return Kind.UNKNOWN;
        if (e instanceof VariableRef v) {
            throw mismatch("Variable '" + v.name() + "' is a node or relationship, not a value; access one of its properties");
        }
        if (e instanceof Comparison c) {
            requireComparable(check(c.left()), check(c.right()), c);
            return Kind.BOOLEAN;
        }
        if (e instanceof BooleanExpression b) {
            for (Expression child : b.children()) {
                Kind k = check(child);
                if (k == Kind.NUMBER || k == Kind.STRING) {
                    throw mismatch(b.type() + " expects boolean operands but '" + child.text() + "' is " + k);
                }
            }
            return Kind.BOOLEAN;
        }
        if (e instanceof Arithmetic a) return arithmetic(a);
        if (e instanceof Negate n) {
            Kind k = check(n.operand());
            if (k == Kind.STRING || k == Kind.BOOLEAN) throw mismatch("Cannot negate " + k + " '" + n.operand().text() + "'");
            return k == Kind.NULL ? Kind.NULL : Kind.NUMBER;
        }
        if (e instanceof StringMatch s) {
            for (Expression side : s.children()) {
                Kind k = check(side);
                if (k == Kind.NUMBER || k == Kind.BOOLEAN) {
                    throw mismatch(s.op().keyword() + " requires strings but '" + side.text() + "' is " + k);
                }
            }
            return Kind.BOOLEAN;
        }
        if (e instanceof NullCheck n) {
            check(n.operand());
            return Kind.BOOLEAN;
        }
        if (e instanceof InList in) {
            Kind operand = check(in.operand());
            for (Expression item : in.items()) requireComparable(operand, check(item), in);
            return Kind.BOOLEAN;
        }
        if (e instanceof Aggregate a) {
            if (a.isCountStar() || a.function() == Aggregate.Function.COUNT) {
                if (a.argument() != null) check(a.argument());
                return Kind.NUMBER;
            }
            Kind arg = check(a.argument());
            switch (a.function()) {
                case SUM, AVG -> {
                    if (arg == Kind.STRING || arg == Kind.BOOLEAN) {
                        throw mismatch(a.text() + " requires a numeric argument but got " + arg);
                    }
                    return Kind.NUMBER;
                }
                default -> { return arg; }
            }
        }
        for (Expression child : e.children()) check(child);
        return Kind.UNKNOWN;
    }

    private static Kind arithmetic(Arithmetic a) {
        Kind l = check(a.left());
        Kind r = check(a.right());
        if (l == Kind.NULL || r == Kind.NULL) return Kind.NULL;
        if (a.op() == Arithmetic.Op.ADD && l == Kind.STRING && r == Kind.STRING) return Kind.STRING;
        if (l == Kind.BOOLEAN || r == Kind.BOOLEAN
                || (l == Kind.STRING && r != Kind.UNKNOWN) || (r == Kind.STRING && l != Kind.UNKNOWN)
                || (a.op() != Arithmetic.Op.ADD && (l == Kind.STRING || r == Kind.STRING))) {
            throw mismatch("Cannot apply '" + a.op().symbol() + "' to " + l + " and " + r + " in " + a.text());
        }
        if (l == Kind.NUMBER && r == Kind.NUMBER) return Kind.NUMBER;
        return Kind.UNKNOWN;
    }

    private static void requireComparable(Kind l, Kind r, Expression where) {
        if (l == Kind.UNKNOWN || r == Kind.UNKNOWN || l == Kind.NULL || r == Kind.NULL) return;
        if (l != r) throw mismatch("Cannot compare " + l + " with " + r + " in " + where.text());
    }

    private static Kind kindOf(Object v) {
        if (v == null) return Kind.NULL;
        if (Values.isNumber(v)) return Kind.NUMBER;
        if (v instanceof String) return Kind.STRING;
        return Kind.BOOLEAN;
    }

    private static GraphQueryException mismatch(String message) {
        return GraphQueryException.typeMismatch(Stage.COMPILE, message);
    }
}

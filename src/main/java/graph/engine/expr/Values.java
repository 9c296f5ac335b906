package graph.engine.expr;

import graph.engine.catalog.DataType;
import graph.engine.error.GraphQueryException;
import graph.engine.error.Stage;

/**
 * Value semantics over normalized carriers (Long, Double, Boolean, String).
 * Integers and floats compare and combine uniformly; any other type pairing is a TYPE_MISMATCH.
 * Callers handle null before reaching these methods.
 */
public final class Values {
    private Values() {}

    public static boolean isNumber(Object v) {
        return v instanceof Long || v instanceof Double;
    }

    /** Ordering of two non-null values of compatible types. */
    public static int compare(Object a, Object b) {
        if (isNumber(a) && isNumber(b)) return compareNumbers((Number) a, (Number) b);
        if (a instanceof String sa && b instanceof String sb) return sa.compareTo(sb);
        if (a instanceof Boolean ba && b instanceof Boolean bb) return Boolean.compare(ba, bb);
        throw incompatible("compare", a, b);
    }

    /** Three-valued equality; incompatible types are a type error rather than false. */
    public static Boolean equalTo(Object a, Object b) {
        if (a == null || b == null) return null;
        return compare(a, b) == 0;
    }

    private static int compareNumbers(Number a, Number b) {
        if (a instanceof Long la && b instanceof Long lb) return Long.compare(la, lb);
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    /**
     * Arithmetic with null propagation. Integer operands stay integral (division truncates)
     * unless the exact result does not fit in a long, in which case it is computed in double.
     * Division or modulo by zero yields null. + on two strings concatenates.
     */
    public static Object arithmetic(Arithmetic.Op op, Object a, Object b) {
        if (a == null || b == null) return null;
        if (op == Arithmetic.Op.ADD && a instanceof String sa && b instanceof String sb) return sa + sb;
        if (!isNumber(a) || !isNumber(b)) throw incompatible("apply '" + op.symbol() + "' to", a, b);
        if (a instanceof Long la && b instanceof Long lb) {
            long x = la, y = lb;
            try {
                return switch (op) {
                    case ADD -> Math.addExact(x, y);
                    case SUB -> Math.subtractExact(x, y);
                    case MUL -> Math.multiplyExact(x, y);
                    case DIV -> {
                        if (y == 0) yield null;
                        if (x == Long.MIN_VALUE && y == -1) throw new ArithmeticException("long overflow");
                        yield x / y;
                    }
                    case MOD -> y == 0 ? null : (Object) (x % y);
                };
            } catch (ArithmeticException overflow) {
                return floating(op, x, y);
            }
        }
        return floating(op, ((Number) a).doubleValue(), ((Number) b).doubleValue());
    }

    private static Object floating(Arithmetic.Op op, double x, double y) {
        return switch (op) {
            case ADD -> x + y;
            case SUB -> x - y;
            case MUL -> x * y;
            case DIV -> y == 0.0 ? null : (Object) (x / y);
            case MOD -> y == 0.0 ? null : (Object) (x % y);
        };
    }

    public static Object negate(Object v) {
        if (v == null) return null;
        if (v instanceof Long l) return l == Long.MIN_VALUE ? (Object) (-(double) l) : (Object) (-l);
        if (v instanceof Double d) return -d;
        throw GraphQueryException.typeMismatch(Stage.EXECUTE, "Cannot negate " + describe(v));
    }

    /**
     * Hashing form of a value: an integral double becomes the equal Long, so values that compare
     * equal also hash equal. Other values, null included, are returned unchanged.
     */
    public static Object canonical(Object v) {
        if (v instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 0x1p53) {
            return d.longValue();
        }
        return v;
    }

    /**
     * Total order used by ORDER BY and MIN/MAX ties: numbers, then strings, then booleans;
     * within a type the natural order. Nulls are placed by the caller.
     */
    public static int sortCompare(Object a, Object b) {
        int ra = rank(a), rb = rank(b);
        if (ra != rb) return Integer.compare(ra, rb);
        return compare(a, b);
    }

    private static int rank(Object v) {
        if (isNumber(v)) return 0;
        if (v instanceof String) return 1;
        return 2;
    }

    static String describe(Object v) {
        return DataType.of(v) + " (" + v + ")";
    }

    private static GraphQueryException incompatible(String what, Object a, Object b) {
        return GraphQueryException.typeMismatch(Stage.EXECUTE,
            "Cannot " + what + " " + describe(a) + " and " + describe(b));
    }
}

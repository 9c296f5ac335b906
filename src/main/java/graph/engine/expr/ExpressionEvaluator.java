package graph.engine.expr;

import java.util.ArrayList;
import java.util.List;

import graph.engine.error.GraphQueryException;
import graph.engine.error.Stage;
import graph.engine.table.Table;

/**
 * Evaluates expressions against a row context, or column-wise over a whole table.
 * Null operands propagate through arithmetic and comparisons; boolean operators follow
 * three-valued logic (see {@link TruthValue}). Stateless and safe to share between threads.
 */
public class ExpressionEvaluator {

    public Object evaluate(Expression e, EvalContext ctx) {
        if (e instanceof Literal l) return l.value();
        if (e instanceof PropertyRef p) return ctx.valueOf(p.qualifiedName());
        if (e instanceof ColumnRef c) return ctx.valueOf(c.column());
        if (e instanceof Comparison c) return compare(c, ctx);
        if (e instanceof BooleanExpression b) return test(b, ctx).toValue();
        if (e instanceof Arithmetic a) {
            return Values.arithmetic(a.op(), evaluate(a.left(), ctx), evaluate(a.right(), ctx));
        }
        if (e instanceof Negate n) return Values.negate(evaluate(n.operand(), ctx));
        if (e instanceof StringMatch s) return matchString(s, ctx);
        if (e instanceof NullCheck n) {
            boolean isNull = evaluate(n.operand(), ctx) == null;
            return n.negated() != isNull;
        }
        if (e instanceof InList in) return inList(in, ctx);
        if (e instanceof Parameter p) throw GraphQueryException.missingParameter(p.name());
        if (e instanceof VariableRef v) {
            throw GraphQueryException.typeMismatch(Stage.EXECUTE, "Variable '" + v.name() + "' is not a scalar value");
        }
        if (e instanceof Aggregate a) {
            throw new IllegalStateException("Aggregate " + a.text() + " evaluated outside an aggregation");
        }
        throw new IllegalStateException("Unsupported expression: " + e.getClass().getSimpleName());
    }

    /** Evaluates a predicate to a truth value; null becomes UNKNOWN. */
    public TruthValue test(Expression e, EvalContext ctx) {
        if (e instanceof BooleanExpression b) {
            switch (b.type()) {
                case NOT -> { return test(b.children().get(0), ctx).not(); }
                case AND -> {
                    TruthValue acc = TruthValue.TRUE;
                    for (Expression c : b.children()) {
                        acc = acc.and(test(c, ctx));
                        if (acc == TruthValue.FALSE) return acc;
                    }
                    return acc;
                }
                case OR -> {
                    TruthValue acc = TruthValue.FALSE;
                    for (Expression c : b.children()) {
                        acc = acc.or(test(c, ctx));
                        if (acc == TruthValue.TRUE) return acc;
                    }
                    return acc;
                }
                case XOR -> {
                    TruthValue acc = test(b.children().get(0), ctx);
                    for (int i = 1; i < b.children().size(); i++) acc = acc.xor(test(b.children().get(i), ctx));
                    return acc;
                }
            }
        }
        return TruthValue.of(evaluate(e, ctx));
    }

    /** Column-batch evaluation: one value per table row. */
    public List<Object> evaluateColumn(Expression e, Table table) {
        List<Object> out = new ArrayList<>(table.rowCount());
        TableRowContext ctx = new TableRowContext(table);
        for (int r = 0; r < table.rowCount(); r++) {
            ctx.row = r;
            out.add(evaluate(e, ctx));
        }
        return out;
    }

    /** Rows of the table for which the predicate is TRUE. */
    public Table filter(Table table, Expression predicate) {
        TableRowContext ctx = new TableRowContext(table);
        return table.filter(r -> {
            ctx.row = r;
            return test(predicate, ctx) == TruthValue.TRUE;
        });
    }

    private Boolean compare(Comparison c, EvalContext ctx) {
        Object l = evaluate(c.left(), ctx);
        Object r = evaluate(c.right(), ctx);
        if (l == null || r == null) return null;
        return c.op().accept(Values.compare(l, r));
    }

    private Boolean matchString(StringMatch s, EvalContext ctx) {
        Object l = evaluate(s.left(), ctx);
        Object r = evaluate(s.right(), ctx);
        if (l == null || r == null) return null;
        if (!(l instanceof String value) || !(r instanceof String pattern)) {
            throw GraphQueryException.typeMismatch(Stage.EXECUTE,
                s.op().keyword() + " requires strings, got " + Values.describe(l) + " and " + Values.describe(r));
        }
        return s.op().test(value, pattern);
    }

    private Boolean inList(InList in, EvalContext ctx) {
        Object v = evaluate(in.operand(), ctx);
        if (v == null) return null;
        boolean sawNull = false;
        for (Expression item : in.items()) {
            Object candidate = evaluate(item, ctx);
            Boolean eq = Values.equalTo(v, candidate);
            if (eq == null) sawNull = true;
            else if (eq) return true;
        }
        return sawNull ? null : Boolean.FALSE;
    }

    /** Reads cell values straight from a columnar table. */
    private static final class TableRowContext implements EvalContext {
        private final Table table;
        private int row;

        TableRowContext(Table table) { this.table = table; }

        @Override
        public Object valueOf(String column) { return table.column(column).get(row); }
    }
}

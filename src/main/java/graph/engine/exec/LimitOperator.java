package graph.engine.exec;

/**
 * Passes through at most n rows.
 */
public class LimitOperator implements Operator {
    private final Operator child;
    private final long limit;
    private long emitted;

    public LimitOperator(Operator child, long limit) {
        this.child = child;
        this.limit = limit;
    }

    @Override
    public void open() {
        child.open();
        emitted = 0;
    }

    @Override
    public Row next() {
        if (emitted >= limit) return null;
        Row r = child.next();
        if (r != null) emitted++;
        return r;
    }

    @Override
    public void close() { child.close(); }

    @Override
    public RowSchema schema() { return child.schema(); }
}

package graph.engine.exec;

/**
 * Discards the first n rows of its child.
 */
public class SkipOperator implements Operator {
    private final Operator child;
    private final long count;

    public SkipOperator(Operator child, long count) {
        this.child = child;
        this.count = count;
    }

    @Override
    public void open() {
        child.open();
        for (long i = 0; i < count; i++) {
            if (child.next() == null) break;
        }
    }

    @Override
    public Row next() { return child.next(); }

    @Override
    public void close() { child.close(); }

    @Override
    public RowSchema schema() { return child.schema(); }
}

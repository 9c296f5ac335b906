package graph.engine.exec;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterator over an operator: opens it on first use and closes it when exhausted.
 */
final class RowIterator implements Iterator<Row> {
    private final Operator op;
    private boolean opened = false;
    private boolean finished = false;
    private Row next = null;

    RowIterator(Operator op) { this.op = op; }

    private void ensureOpen() {
        if (!opened) {
            op.open();
            opened = true;
            advance();
        }
    }

    private void advance() {
        if (finished) return;
        next = op.next();
        if (next == null) {
            finished = true;
            op.close();
        }
    }

    @Override
    public boolean hasNext() {
        ensureOpen();
        return !finished;
    }

    @Override
    public Row next() {
        if (!hasNext()) throw new NoSuchElementException();
        Row current = next;
        advance();
        return current;
    }
}

package graph.engine.exec;

/**
 * Pull-based physical operator. Callers open once, pull rows until null, then close.
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();

    /** Layout of the rows this operator produces; available before open. */
    RowSchema schema();
}

package graph.engine.expr;

/**
 * Running state of one aggregate over one group.
 * add() receives the evaluated argument (ignored by count(*)).
 */
public interface Accumulator {
    void add(Object value);

    Object result();
}

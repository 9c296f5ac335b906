package graph.engine.expr;

/**
 * Source of column values for evaluating one row.
 * Column names are qualified (variable.property) or projected output names.
 */
public interface EvalContext {
    Object valueOf(String column);
}

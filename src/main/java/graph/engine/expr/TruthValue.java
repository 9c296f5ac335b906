package graph.engine.expr;

import graph.engine.error.GraphQueryException;
import graph.engine.error.Stage;

/**
 * Three-valued logic result. UNKNOWN stands for a null boolean and is kept
 * distinct from FALSE; a filter keeps a row only on TRUE.
 */
public enum TruthValue {
    TRUE, FALSE, UNKNOWN;

    public static TruthValue of(boolean b) { return b ? TRUE : FALSE; }

    /** Interprets an evaluated value as a truth value; non-boolean values are a type error. */
    public static TruthValue of(Object value) {
        if (value == null) return UNKNOWN;
        if (value instanceof Boolean b) return of(b.booleanValue());
        throw GraphQueryException.typeMismatch(Stage.EXECUTE,
            "Expected a boolean but got " + value.getClass().getSimpleName() + " (" + value + ")");
    }

    public TruthValue and(TruthValue other) {
        if (this == FALSE || other == FALSE) return FALSE;
        if (this == UNKNOWN || other == UNKNOWN) return UNKNOWN;
        return TRUE;
    }

    public TruthValue or(TruthValue other) {
        if (this == TRUE || other == TRUE) return TRUE;
        if (this == UNKNOWN || other == UNKNOWN) return UNKNOWN;
        return FALSE;
    }

    public TruthValue xor(TruthValue other) {
        if (this == UNKNOWN || other == UNKNOWN) return UNKNOWN;
        return of(this != other);
    }

    public TruthValue not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }

    /** Boolean carrier value, null for UNKNOWN. */
    public Boolean toValue() {
        return switch (this) {
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            case UNKNOWN -> null;
        };
    }
}

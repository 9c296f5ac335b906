package graph.engine.catalog;

/**
 * Supported column value types.
 * INT values are carried as Long, FLOAT values as Double.
 * NULL marks a column whose values are all null.
 */
public enum DataType {
    INT,
    FLOAT,
    BOOLEAN,
    VARCHAR,
    NULL;

    /** Type of a single (already normalized) value. */
    public static DataType of(Object value) {
        if (value == null) return NULL;
        if (value instanceof Long) return INT;
        if (value instanceof Double) return FLOAT;
        if (value instanceof Boolean) return BOOLEAN;
        if (value instanceof String) return VARCHAR;
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getSimpleName());
    }

    /**
     * Widens boxed Java values to the carrier type of their column type:
     * Integer/Short/Byte to Long, Float to Double, Character to String.
     */
    public static Object normalize(Object value) {
        if (value == null) return null;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) return f.doubleValue();
        if (value instanceof Character c) return String.valueOf(c);
        return value;
    }

    /** Column type from its values: first non-null value decides, INT widens to FLOAT when mixed. */
    public static DataType infer(Iterable<?> values) {
        DataType found = NULL;
        for (Object v : values) {
            DataType t = of(v);
            if (t == NULL) continue;
            if (found == NULL) {
                found = t;
            } else if (found != t) {
                if ((found == INT && t == FLOAT) || (found == FLOAT && t == INT)) {
                    found = FLOAT;
                } else {
                    throw new IllegalArgumentException("Mixed column value types: " + found + " and " + t);
                }
            }
        }
        return found;
    }

    /** Whether a value of type {@code t} may be stored in a column of this type. */
    public boolean accepts(DataType t) {
        return t == NULL || t == this || (this == FLOAT && t == INT);
    }
}

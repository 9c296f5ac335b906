package graph.engine.error;

/**
 * Structured failure of a query call. Carries the error kind and the stage
 * (parse, compile or execute) that raised it. A call that throws this never
 * hands back a partial result.
 */
public class GraphQueryException extends RuntimeException {
    private final ErrorKind kind;
    private final Stage stage;

    public GraphQueryException(ErrorKind kind, String message) {
        this(kind, kind.defaultStage(), message, null);
    }

    public GraphQueryException(ErrorKind kind, Stage stage, String message) {
        this(kind, stage, message, null);
    }

    public GraphQueryException(ErrorKind kind, Stage stage, String message, Throwable cause) {
        super(message, cause);
        if (kind == null || stage == null) throw new IllegalArgumentException("kind and stage required");
        this.kind = kind;
        this.stage = stage;
    }

    public ErrorKind kind() { return kind; }
    public Stage stage() { return stage; }

    public static GraphQueryException parse(String message) {
        return new GraphQueryException(ErrorKind.PARSE_ERROR, message);
    }

    public static GraphQueryException unknownLabel(String label) {
        return new GraphQueryException(ErrorKind.UNKNOWN_LABEL, "Unknown node label: " + label);
    }

    public static GraphQueryException unknownRelationshipType(String type) {
        return new GraphQueryException(ErrorKind.UNKNOWN_RELATIONSHIP_TYPE, "Unknown relationship type: " + type);
    }

    public static GraphQueryException ambiguousNode(String variable, String detail) {
        return new GraphQueryException(ErrorKind.AMBIGUOUS_NODE_BINDING,
            "Cannot bind node '" + variable + "' to a table: " + detail);
    }

    public static GraphQueryException unboundVariable(String variable) {
        return new GraphQueryException(ErrorKind.UNBOUND_VARIABLE, "Variable not bound by MATCH: " + variable);
    }

    public static GraphQueryException duplicateBinding(String message) {
        return new GraphQueryException(ErrorKind.DUPLICATE_BINDING, message);
    }

    public static GraphQueryException typeMismatch(Stage stage, String message) {
        return new GraphQueryException(ErrorKind.TYPE_MISMATCH, stage, message);
    }

    public static GraphQueryException unsupportedAggregate(String message) {
        return new GraphQueryException(ErrorKind.UNSUPPORTED_AGGREGATE, message);
    }

    public static GraphQueryException missingParameter(String name) {
        return new GraphQueryException(ErrorKind.MISSING_PARAMETER, "Missing parameter: $" + name);
    }

    public static GraphQueryException missingDataset(String name) {
        return new GraphQueryException(ErrorKind.MISSING_DATASET, "No dataset supplied for table: " + name);
    }

    public static GraphQueryException columnNotFound(String column, String table) {
        return new GraphQueryException(ErrorKind.COLUMN_NOT_FOUND,
            "Column not found: " + column + (table != null ? " (table " + table + ")" : ""));
    }

    @Override
    public String toString() {
        return kind + " [" + stage + "]: " + getMessage();
    }
}

package graph.engine.error;

/**
 * Kinds of failure a query can produce, each tied to the stage that raises it.
 */
public enum ErrorKind {
    PARSE_ERROR(Stage.PARSE),
    UNKNOWN_LABEL(Stage.COMPILE),
    UNKNOWN_RELATIONSHIP_TYPE(Stage.COMPILE),
    AMBIGUOUS_NODE_BINDING(Stage.COMPILE),
    UNBOUND_VARIABLE(Stage.COMPILE),
    DUPLICATE_BINDING(Stage.COMPILE),
    TYPE_MISMATCH(Stage.COMPILE),
    UNSUPPORTED_AGGREGATE(Stage.COMPILE),
    MISSING_PARAMETER(Stage.COMPILE),
    MISSING_DATASET(Stage.EXECUTE),
    COLUMN_NOT_FOUND(Stage.EXECUTE);

    private final Stage defaultStage;

    ErrorKind(Stage defaultStage) {
        this.defaultStage = defaultStage;
    }

    public Stage defaultStage() { return defaultStage; }
}

package graph.engine.error;

/** Pipeline stage that reported an error. */
public enum Stage {
    PARSE,
    COMPILE,
    EXECUTE
}

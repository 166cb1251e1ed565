package Exceptions;

/**
 * Terminal failure categories of a pipeline run. None of them is retried by the engine.
 */
public enum ErrorKind {
    EMPTY_INPUT,
    SCHEMA_MISMATCH,
    TYPE_COERCION,
    MISSING_COLUMN,
    IO,
    COMPUTE
}

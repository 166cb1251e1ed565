package Exceptions;

/**
 * Raised when an input file header is not a valid transaction schema, when files disagree
 * on their column sets, or when a data row does not match its header.
 */
public class SchemaMismatchException extends PipelineException {

    public SchemaMismatchException(String message) {
        super(ErrorKind.SCHEMA_MISMATCH, message);
    }
}

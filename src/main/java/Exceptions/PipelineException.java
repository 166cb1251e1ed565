package Exceptions;

/**
 * Base type of every failure raised by the transform-and-aggregate engine.
 * <p>
 * Checked on purpose: the row functions executed by Flink declare {@code throws Exception},
 * so the same exceptions travel unchanged through both backends.
 */
public abstract class PipelineException extends Exception {

    private final ErrorKind kind;

    protected PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}

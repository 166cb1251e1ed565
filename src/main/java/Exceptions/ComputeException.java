package Exceptions;

/**
 * A Flink job failed for a reason other than one of the engine's own errors.
 */
public class ComputeException extends PipelineException {

    public ComputeException(String message, Throwable cause) {
        super(ErrorKind.COMPUTE, message, cause);
    }
}

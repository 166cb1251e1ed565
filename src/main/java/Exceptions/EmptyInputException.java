package Exceptions;

/**
 * Raised when the input locations resolve to zero files.
 */
public class EmptyInputException extends PipelineException {

    public EmptyInputException(String message) {
        super(ErrorKind.EMPTY_INPUT, message);
    }
}

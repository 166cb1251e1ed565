package Exceptions;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An input file or directory exists but cannot be read.
 */
public class InputReadException extends PipelineException {

    public InputReadException(Path source, IOException cause) {
        super(ErrorKind.IO, "Failed to read " + source + ": " + cause.getMessage(), cause);
    }
}

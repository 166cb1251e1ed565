package Exceptions;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Wraps the {@link IOException} of a failed artifact write.
 */
public class SinkWriteException extends PipelineException {

    public SinkWriteException(Path target, IOException cause) {
        super(ErrorKind.IO, "Failed to write " + target + ": " + cause.getMessage(), cause);
    }
}

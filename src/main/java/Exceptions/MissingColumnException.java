package Exceptions;

import java.util.List;

/**
 * Raised when a view declares a grouping or reduced column the dataset does not have.
 */
public class MissingColumnException extends PipelineException {

    public MissingColumnException(String view, List<String> missing) {
        super(ErrorKind.MISSING_COLUMN, "View '" + view + "' requires missing column(s) " + missing);
    }
}

package Engine;

import Exceptions.PipelineException;

import java.util.List;

/**
 * A schema-homogeneous collection of rows, the unit handed from one pipeline stage to the next.
 * <p>
 * Implementations are immutable. A local dataset is an ordered list; a Flink dataset is a
 * bounded stream that is only evaluated when {@link #collect()} is called and gives no
 * ordering guarantee.
 *
 * @param <T> the row type
 */
public interface Dataset<T> {

    /**
     * The ordered column names every row of this dataset carries.
     */
    List<String> columns();

    default boolean hasColumn(String column) {
        return columns().contains(column);
    }

    /**
     * Materializes the rows on the caller's side.
     *
     * @throws PipelineException if evaluating the dataset fails
     */
    List<T> collect() throws PipelineException;
}

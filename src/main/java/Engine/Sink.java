package Engine;

import Dto.TabularRecord;
import Exceptions.PipelineException;

import java.nio.file.Path;

/**
 * Last stage: externalizes a dataset as one delimited artifact.
 */
public interface Sink {

    /**
     * Writes a header row followed by one row per record, replacing {@code target} atomically.
     *
     * @param name logical artifact name, used for logging
     * @throws Exceptions.SinkWriteException if the target cannot be written
     */
    void persist(String name, Dataset<? extends TabularRecord> dataset, Path target) throws PipelineException;
}

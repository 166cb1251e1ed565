package Engine;

import Dto.RawTransaction;
import Exceptions.PipelineException;

import java.nio.file.Path;
import java.util.Set;

/**
 * First stage: reads delimited transaction files into one dataset.
 */
public interface RowSource {

    /**
     * @param locations files, or directories whose files with the configured extension are read
     * @return the concatenated rows of every resolved file
     * @throws Exceptions.EmptyInputException if the locations resolve to no file
     * @throws Exceptions.SchemaMismatchException if a header is invalid or the files disagree on their columns
     */
    Dataset<RawTransaction> load(Set<Path> locations) throws PipelineException;
}

package Engine;

import Dto.RawTransaction;
import Dto.Transaction;
import Exceptions.PipelineException;

/**
 * Second stage: types every column and derives the calendar and price columns.
 * See {@link TransactionNormalizer} for the row-level rules shared by all implementations.
 */
public interface Normalizer {

    /**
     * @return a new dataset; the input is never aliased
     * @throws Exceptions.TypeCoercionException naming the column and value that could not be coerced
     */
    Dataset<Transaction> normalize(Dataset<RawTransaction> dataset) throws PipelineException;
}

package Local;

import Dto.RawTransaction;
import Dto.Transaction;
import Engine.Dataset;
import Engine.LocalDataset;
import Engine.Normalizer;
import Engine.TransactionNormalizer;
import Engine.TransactionSchema;
import Exceptions.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes row by row on the calling thread; stops at the first row that fails coercion.
 */
public class LocalNormalizer implements Normalizer {

    private static final Logger log = LoggerFactory.getLogger(LocalNormalizer.class);

    @Override
    public Dataset<Transaction> normalize(Dataset<RawTransaction> dataset) throws PipelineException {
        TransactionNormalizer rowNormalizer = new TransactionNormalizer(dataset.hasColumn(TransactionSchema.IS_GIFT));
        List<RawTransaction> input = dataset.collect();
        List<Transaction> cleaned = new ArrayList<>(input.size());
        for (RawTransaction raw : input) {
            cleaned.add(rowNormalizer.normalizeRow(raw));
        }
        log.info("Cleaned data: {} records", cleaned.size());
        return new LocalDataset<>(TransactionSchema.normalizedColumns(dataset.columns()), cleaned);
    }
}
